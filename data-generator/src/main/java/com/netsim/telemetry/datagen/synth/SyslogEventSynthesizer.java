package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.datagen.synth.SyslogCatalog.Template;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.SyslogEventRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.Device;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Structured syslog events. The template comes from the catalog entry for the
 * fault kind; severe faults (severity >= 0.7) always use the kind's most
 * severe template.
 */
public class SyslogEventSynthesizer extends SeededRecordSynthesizer<SyslogEventRecord> {

    public SyslogEventSynthesizer(Topology topology, long seed) {
        super(topology, seed);
    }

    @Override
    public TableType getTableType() {
        return TableType.SYSLOG;
    }

    @Override
    public SyslogEventRecord synthesize(CommonFields common, FaultState fault, LocalDateTime timestamp) {
        DeviceInterface iface = interfaceOf(common);
        Device device = iface.getDevice();
        SyslogEventRecord record = label(new SyslogEventRecord(), common, fault);

        List<Template> templates = SyslogCatalog.templatesFor(fault.getKind());
        Template template = fault.getSeverity() >= 0.7
                ? templates.get(0)
                : templates.get(random.nextInt(templates.size()));

        String message = render(template.pattern, iface, fault.getSeverity());
        int facilityCode = SyslogCatalog.FACILITY_CODES.get(template.facility);

        record.setFacility(template.facility);
        record.setFacilityCode(facilityCode);
        record.setSeverity(SyslogCatalog.SEVERITY_NAMES.get(template.severityCode));
        record.setSeverityCode(template.severityCode);
        record.setPriority((int) check("priority", facilityCode * 8 + template.severityCode, 0, 191));
        record.setCategory(template.category);
        record.setMessage(message);
        record.setRawLog(SyslogCatalog.rawLine(device.getVendor(), timestamp, device.getHostname(), device.getIp(),
                template, template.facility, 1_000 + random.nextInt(9_000), message));
        return record;
    }

    private String render(String pattern, DeviceInterface iface, double severity) {
        String out = pattern.replace("{iface}", iface.getName());
        if (out.contains("{peer}")) {
            out = out.replace("{peer}", "10." + random.nextInt(256) + "." + random.nextInt(256) + "." + (1 + random.nextInt(254)));
        }
        if (out.contains("{asn}")) {
            out = out.replace("{asn}", String.valueOf(64_512 + random.nextInt(1_023)));
        }
        if (out.contains("{vlan}")) {
            out = out.replace("{vlan}", String.valueOf(1 + random.nextInt(4_094)));
        }
        if (out.contains("{n}")) {
            out = out.replace("{n}", String.valueOf(2 + Math.round(severity * 50) + random.nextInt(5)));
        }
        if (out.contains("{temp}")) {
            out = out.replace("{temp}", String.format(Locale.ROOT, "%.1f", 77.0 + 18.0 * severity));
        }
        if (out.contains("{rx}")) {
            out = out.replace("{rx}", String.format(Locale.ROOT, "%.2f", -7.5 - 6.0 * severity));
        }
        if (out.contains("{pct}")) {
            out = out.replace("{pct}", String.valueOf(50 + Math.round(45 * severity)));
        }
        return out;
    }
}
