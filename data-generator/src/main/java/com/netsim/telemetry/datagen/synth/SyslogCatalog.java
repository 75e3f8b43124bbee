package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultKind;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Message templates and vendor line formats for the syslog table.
 *
 * Normal traffic draws from informational protocol chatter (OSPF, BGP, LLDP,
 * LACP, STP, NTP, AAA). Each fault kind has its own warning/error templates.
 * Placeholders: {iface} {peer} {asn} {vlan} {n} {temp} {rx} {pct}.
 */
final class SyslogCatalog {

    static final Map<String, Integer> FACILITY_CODES = Map.of(
            "kern", 0, "user", 1, "daemon", 3, "auth", 4, "syslog", 5, "local7", 23);

    static final List<String> SEVERITY_NAMES = List.of(
            "emerg", "alert", "crit", "err", "warning", "notice", "info", "debug");

    private static final DateTimeFormatter SYSLOG_TIME = DateTimeFormatter.ofPattern("MMM dd HH:mm:ss", Locale.ENGLISH);

    static final List<Template> NORMAL = List.of(
            new Template("OSPF", "ADJCHG", "local7", 5, "OSPF neighbor {peer} on {iface} from LOADING to FULL, Loading Done"),
            new Template("BGP", "ADJCHANGE", "local7", 5, "BGP neighbor {peer} (AS {asn}) session established"),
            new Template("LLDP", "NBRADD", "daemon", 6, "LLDP neighbor {peer} discovered on {iface}"),
            new Template("LACP", "BUNDLE", "local7", 6, "Interface {iface} bundled into port-channel {n}"),
            new Template("STP", "TOPOCHANGE", "local7", 6, "STP topology change acknowledged on VLAN {vlan} via {iface}"),
            new Template("NTP", "SYNC", "daemon", 6, "Clock synchronized to NTP server {peer}, stratum 2"),
            new Template("AAA", "LOGIN", "auth", 6, "User netops logged in from {peer} via ssh"),
            new Template("SYS", "CONFIG", "syslog", 5, "Configured from vty by netops ({peer})"));

    static final Map<FaultKind, List<Template>> BY_FAULT = new EnumMap<>(FaultKind.class);

    static {
        BY_FAULT.put(FaultKind.LINK_FLAP, List.of(
                new Template("LINK", "UPDOWN", "local7", 3, "Interface {iface}, changed state to down"),
                new Template("LINK", "FLAP", "local7", 4, "Interface {iface} link flap detected: {n} transitions in 60s")));
        BY_FAULT.put(FaultKind.HIGH_TEMPERATURE, List.of(
                new Template("ENV", "TEMP_ALARM", "kern", 2, "Transceiver on {iface} temperature {temp}C exceeds high alarm threshold 75.0C"),
                new Template("ENV", "TEMP_WARN", "kern", 4, "Transceiver on {iface} temperature {temp}C above high warning threshold")));
        BY_FAULT.put(FaultKind.HIGH_ERROR_RATE, List.of(
                new Template("IF", "ERRRATE", "local7", 3, "Interface {iface} input error rate {pct}% exceeds limit"),
                new Template("IF", "CRC", "local7", 4, "Input CRC errors on {iface} exceeded threshold: {n} errors/min")));
        BY_FAULT.put(FaultKind.LOW_RX_POWER, List.of(
                new Template("OPTICS", "RX_LOW_ALARM", "local7", 3, "Transceiver on {iface} rx power {rx} dBm below low alarm threshold -7.0 dBm"),
                new Template("OPTICS", "RX_LOW_WARN", "local7", 4, "Transceiver on {iface} rx power {rx} dBm below low warning threshold")));
        BY_FAULT.put(FaultKind.BROADCAST_STORM, List.of(
                new Template("STORM", "CONTROL", "local7", 3, "Broadcast storm detected on {iface}, traffic suppressed at {pct}% of bandwidth"),
                new Template("L2", "MACFULL", "local7", 4, "MAC address table usage at {pct}% on VLAN {vlan}")));
    }

    private SyslogCatalog() {}

    static List<Template> templatesFor(FaultKind kind) {
        return kind == FaultKind.NONE ? NORMAL : BY_FAULT.get(kind);
    }

    /**
     * The line as the device vendor would emit it.
     */
    static String rawLine(String vendor, LocalDateTime timestamp, String hostname, String ip,
                          Template template, String facility, int pid, String message) {
        String ts = SYSLOG_TIME.format(timestamp);
        String severity = SEVERITY_NAMES.get(template.severityCode);
        return switch (vendor) {
            case "Cisco" -> String.format("%s %s %s: %%%s-%d-%s: %s",
                    ts, ip, hostname, template.category, template.severityCode, template.mnemonic, message);
            case "Juniper" -> String.format("%s %s %s %s[%d]: %s_%s: %s",
                    ts, ip, hostname, facility, pid, template.category, template.mnemonic, message);
            case "Huawei" -> String.format("%s %s %%%%01%s/%d/%s: %s",
                    ts, hostname, template.category, template.severityCode, template.mnemonic, message);
            case "Arista" -> String.format("%s %s %s: %%%s-%d-%s: %s",
                    ts, hostname, template.category, template.category, template.severityCode, template.mnemonic, message);
            default -> String.format("%s %s %s %s[%d]: %s: %s",
                    ts, ip, hostname, facility, pid, severity, message);
        };
    }

    static final class Template {
        final String category;
        final String mnemonic;
        final String facility;
        final int severityCode;
        final String pattern;

        Template(String category, String mnemonic, String facility, int severityCode, String pattern) {
            this.category = category;
            this.mnemonic = mnemonic;
            this.facility = facility;
            this.severityCode = severityCode;
            this.pattern = pattern;
        }
    }
}
