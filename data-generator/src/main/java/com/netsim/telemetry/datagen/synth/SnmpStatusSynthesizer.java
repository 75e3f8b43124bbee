package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.datagen.topology.VendorCatalog;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.SnmpStatusRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.Device;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * IF-MIB style polls.
 *
 * Counters are cumulative: each interface keeps its running totals, and every
 * poll adds the traffic of the time elapsed since the previous one, so HC
 * counters never decrease for a key. sysUpTime counts from the device's
 * uptime at the start of the window, in TimeTicks (1/100 s, wrapping at 2^32).
 *
 * Faults: LINK_FLAP sets ifOperStatus down and moves ifLastChange,
 * BROADCAST_STORM sets the storm flag and spikes broadcast counters and the
 * MAC table, HIGH_ERROR_RATE and LOW_RX_POWER grow the error counters.
 */
public class SnmpStatusSynthesizer extends SeededRecordSynthesizer<SnmpStatusRecord> {

    private static final int IF_TYPE_ETHERNET_CSMACD = 6;
    private static final long TIMETICKS_MODULO = 1L << 32;
    private static final double AVG_PACKET_BYTES = 800.0;

    private final LocalDateTime epoch;
    private final Map<String, CounterState> counters = new HashMap<>();

    /**
     * @param epoch start of the generation window; device uptimes are relative to it
     */
    public SnmpStatusSynthesizer(Topology topology, LocalDateTime epoch, long seed) {
        super(topology, seed);
        this.epoch = epoch;
    }

    @Override
    public TableType getTableType() {
        return TableType.SNMP;
    }

    @Override
    public SnmpStatusRecord synthesize(CommonFields common, FaultState fault, LocalDateTime timestamp) {
        DeviceInterface iface = interfaceOf(common);
        Device device = iface.getDevice();
        SnmpStatusRecord record = label(new SnmpStatusRecord(), common, fault);
        double severity = fault.getSeverity();

        long secondsSinceEpoch = Math.max(0, Duration.between(epoch, timestamp).getSeconds());
        long upSeconds = device.getUptimeAtStartSeconds() + secondsSinceEpoch;
        long sysUpTime = (upSeconds * 100) % TIMETICKS_MODULO;

        CounterState state = counters.computeIfAbsent(iface.getModuleId(), k -> initialState(iface));
        long elapsed = state.lastTimestamp == null
                ? getTableType().getGranularitySeconds()
                : Math.max(0, Duration.between(state.lastTimestamp, timestamp).getSeconds());
        state.lastTimestamp = timestamp;

        double bytesPerSecond = iface.getSpeed().getBitsPerSecond() / 8.0;
        double inUtil = iface.getBaselineUtilization() * jitter(0.2);
        double outUtil = iface.getBaselineUtilization() * jitter(0.2);
        boolean operDown = false;
        boolean storm = false;

        switch (fault.getKind()) {
            case LINK_FLAP -> {
                operDown = true;
                inUtil *= 1 - severity;
                outUtil *= 1 - severity;
                state.lastChange = sysUpTime;
            }
            case BROADCAST_STORM -> {
                storm = true;
                inUtil = Math.min(0.98, inUtil + 0.3 + 0.5 * severity);
            }
            default -> {
            }
        }

        long inBytes = Math.round(bytesPerSecond * inUtil * elapsed);
        long outBytes = Math.round(bytesPerSecond * outUtil * elapsed);
        long inPkts = Math.round(inBytes / AVG_PACKET_BYTES);
        long outPkts = Math.round(outBytes / AVG_PACKET_BYTES);

        state.hcInOctets += inBytes;
        state.hcOutOctets += outBytes;
        state.inUcast += Math.round(inPkts * 0.97);
        state.outUcast += Math.round(outPkts * 0.97);
        state.multicast += Math.round(inPkts * 0.01);
        state.broadcast += storm ? Math.round(inPkts * (0.2 + 0.6 * severity)) : Math.round(inPkts * 0.001);

        if (random.nextDouble() < 0.05) {
            state.inErrors += 1 + random.nextInt(3);
        }
        switch (fault.getKind()) {
            case HIGH_ERROR_RATE -> {
                long errors = Math.max(10, Math.round(inPkts * (0.001 + 0.02 * severity)));
                state.inErrors += errors;
                state.outErrors += errors / 10;
            }
            case LOW_RX_POWER -> state.inErrors += 50 + Math.round(500 * severity * random.nextDouble());
            case BROADCAST_STORM -> {
                state.inDiscards += Math.round(inPkts * 0.01 * severity);
                state.outDiscards += Math.round(outPkts * 0.005 * severity);
            }
            default -> {
            }
        }

        long macTable = Math.round(device.getMacTableSize() * jitter(0.05));
        if (storm) {
            macTable = Math.round(macTable * (1.5 + severity));
        }
        macTable = Math.min(device.getMacTableCapacity(), macTable);

        record.setIfIndex(iface.getPortIndex());
        record.setIfDescr(iface.getName());
        record.setIfAlias(iface.getAlias());
        record.setIfType(IF_TYPE_ETHERNET_CSMACD);
        record.setIfMtu(iface.getMtu());
        record.setIfSpeed(Math.min(iface.getSpeed().getBitsPerSecond(), SnmpStatusRecord.IF_SPEED_MAX));
        record.setIfHighSpeed(iface.getSpeed().getBitsPerSecond() / 1_000_000L);
        record.setIfAdminStatus("up");
        record.setIfOperStatus(operDown ? "down" : "up");
        record.setIfLastChange(state.lastChange);
        record.setIfHCInOctets(checkCounter("ifHCInOctets", state.hcInOctets));
        record.setIfHCOutOctets(checkCounter("ifHCOutOctets", state.hcOutOctets));
        record.setIfHCInUcastPkts(checkCounter("ifHCInUcastPkts", state.inUcast));
        record.setIfHCOutUcastPkts(checkCounter("ifHCOutUcastPkts", state.outUcast));
        record.setIfInErrors(checkCounter("ifInErrors", state.inErrors));
        record.setIfOutErrors(checkCounter("ifOutErrors", state.outErrors));
        record.setIfInDiscards(checkCounter("ifInDiscards", state.inDiscards));
        record.setIfOutDiscards(checkCounter("ifOutDiscards", state.outDiscards));
        record.setIfHCInBroadcastPkts(checkCounter("ifHCInBroadcastPkts", state.broadcast));
        record.setIfHCInMulticastPkts(checkCounter("ifHCInMulticastPkts", state.multicast));
        record.setBroadcastStorm(storm);
        record.setMacTableSize((int) check("macTableSize", macTable, 0, device.getMacTableCapacity()));
        record.setSysUpTime(sysUpTime);
        record.setSysObjectId(VendorCatalog.enterpriseOid(device.getVendor()) + ".1.1");
        return record;
    }

    /**
     * Running totals as they stood at the start of the window: roughly a
     * tenth of line-rate traffic over the device's uptime so far.
     */
    private CounterState initialState(DeviceInterface iface) {
        CounterState state = new CounterState();
        long uptime = iface.getDevice().getUptimeAtStartSeconds();
        double bytes = iface.getSpeed().getBitsPerSecond() / 8.0 * iface.getBaselineUtilization() * uptime * 0.1;
        state.hcInOctets = Math.round(bytes * jitter(0.1));
        state.hcOutOctets = Math.round(bytes * jitter(0.1));
        state.inUcast = Math.round(state.hcInOctets / AVG_PACKET_BYTES);
        state.outUcast = Math.round(state.hcOutOctets / AVG_PACKET_BYTES);
        state.lastChange = ((long) (uptime * random.nextDouble()) * 100) % TIMETICKS_MODULO;
        return state;
    }

    private static final class CounterState {
        private LocalDateTime lastTimestamp;
        private long lastChange;
        private long hcInOctets;
        private long hcOutOctets;
        private long inUcast;
        private long outUcast;
        private long inErrors;
        private long outErrors;
        private long inDiscards;
        private long outDiscards;
        private long broadcast;
        private long multicast;
    }
}
