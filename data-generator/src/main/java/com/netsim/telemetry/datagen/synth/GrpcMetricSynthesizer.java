package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.datagen.topology.VendorCatalog;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.GrpcMetricRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.LocalDateTime;

/**
 * gNMI interface counters for one sample interval, plus embedded optics.
 *
 * Traffic follows the interface's baseline utilization with a daily curve
 * (quietest around 06:00, busiest around 18:00). Faults widen error and drop
 * counters; a link flap takes the port oper-down.
 */
public class GrpcMetricSynthesizer extends SeededRecordSynthesizer<GrpcMetricRecord> {

    private static final int SAMPLE_INTERVAL_SEC = TableType.GRPC.getGranularitySeconds();
    private static final double AVG_PACKET_BYTES = 800.0;

    private final OpticalReadingSampler opticalSampler;

    public GrpcMetricSynthesizer(Topology topology, long seed, OpticalReadingSampler opticalSampler) {
        super(topology, seed);
        this.opticalSampler = opticalSampler;
    }

    @Override
    public TableType getTableType() {
        return TableType.GRPC;
    }

    @Override
    public GrpcMetricRecord synthesize(CommonFields common, FaultState fault, LocalDateTime timestamp) {
        DeviceInterface iface = interfaceOf(common);
        GrpcMetricRecord record = label(new GrpcMetricRecord(), common, fault);
        double severity = fault.getSeverity();

        record.setSubscriptionPath(VendorCatalog.gnmiCountersPath(iface.getDevice().getVendor(), iface.getName()));
        record.setEncoding(VendorCatalog.gnmiEncoding(iface.getDevice().getVendor()));
        record.setSampleIntervalSec(SAMPLE_INTERVAL_SEC);
        record.setAdminStatus("UP");
        record.setOperStatus("UP");

        double diurnal = 0.75 + 0.25 * Math.sin(2 * Math.PI * (timestamp.getHour() - 12) / 24.0);
        double inUtil = iface.getBaselineUtilization() * diurnal * jitter(0.25);
        double outUtil = iface.getBaselineUtilization() * diurnal * jitter(0.25);
        int carrierTransitions = 0;

        switch (fault.getKind()) {
            case LINK_FLAP -> {
                record.setOperStatus("DOWN");
                carrierTransitions = 2 + (int) Math.round(8 * severity);
                inUtil *= 0.5 * (1 - severity);
                outUtil *= 0.5 * (1 - severity);
            }
            case BROADCAST_STORM -> inUtil = Math.min(0.98, inUtil + 0.3 + 0.5 * severity);
            default -> {
            }
        }

        double bytesPerInterval = iface.getSpeed().getBitsPerSecond() / 8.0 * SAMPLE_INTERVAL_SEC;
        long inOctets = Math.round(bytesPerInterval * inUtil);
        long outOctets = Math.round(bytesPerInterval * outUtil);
        long inPkts = Math.round(inOctets / (AVG_PACKET_BYTES * jitter(0.1)));
        long outPkts = Math.round(outOctets / (AVG_PACKET_BYTES * jitter(0.1)));

        long inErrors = random.nextDouble() < 0.05 ? 1 + random.nextInt(3) : 0;
        long outErrors = 0;
        long inCrc = 0;
        long inDiscards = random.nextDouble() < 0.05 ? random.nextInt(5) : 0;
        long outDiscards = 0;
        long congestionDrops = 0;

        switch (fault.getKind()) {
            case HIGH_ERROR_RATE -> {
                inErrors = Math.max(10, Math.round(inPkts * (0.001 + 0.02 * severity)));
                inCrc = Math.round(inErrors * 0.8);
                outErrors = Math.round(inErrors * 0.1);
            }
            case LOW_RX_POWER -> {
                inCrc = 50 + Math.round(500 * severity * random.nextDouble());
                inErrors = inCrc;
            }
            case BROADCAST_STORM -> {
                congestionDrops = Math.round(inPkts * 0.01 * severity);
                inDiscards = congestionDrops / 2;
                outDiscards = congestionDrops / 4;
            }
            case LINK_FLAP -> inErrors += carrierTransitions * 10L;
            default -> {
            }
        }

        record.setInOctets(checkCounter("in_octets", inOctets));
        record.setOutOctets(checkCounter("out_octets", outOctets));
        record.setInPkts(checkCounter("in_pkts", inPkts));
        record.setOutPkts(checkCounter("out_pkts", outPkts));
        record.setInErrors(checkCounter("in_errors", inErrors));
        record.setOutErrors(checkCounter("out_errors", outErrors));
        record.setInDiscards(checkCounter("in_discards", inDiscards));
        record.setOutDiscards(checkCounter("out_discards", outDiscards));
        record.setInCrcErrors(checkCounter("in_crc_errors", inCrc));
        record.setCongestionDrops(checkCounter("congestion_drops", congestionDrops));
        record.setCarrierTransitions(carrierTransitions);
        record.setInUtilization(check("in_utilization", round(inUtil * 100, 2), 0, 100));
        record.setOutUtilization(check("out_utilization", round(outUtil * 100, 2), 0, 100));

        if (iface.hasModule()) {
            OpticalReading optics = opticalSampler.sample(iface.getModule(), fault, random);
            record.setTemperature(check("temperature", optics.getTemperature(), -40, 125));
            record.setVoltage(check("voltage", optics.getVoltage(), 0, 5));
            record.setBiasCurrent(check("bias_current", optics.getBiasCurrent(), 0, 200));
            record.setTxPower(check("tx_power", optics.getTxPower(), -40, 10));
            record.setRxPower(check("rx_power", optics.getRxPower(), -40, 10));
        }
        return record;
    }
}
