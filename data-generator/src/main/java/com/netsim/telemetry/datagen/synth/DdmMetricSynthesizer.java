package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.DdmMetricRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.OpticalModule;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.LocalDateTime;

/**
 * Digital diagnostics for optical modules: five readings around the module's
 * nominal values and one alarm flag per channel.
 */
public class DdmMetricSynthesizer extends SeededRecordSynthesizer<DdmMetricRecord> {

    private final OpticalReadingSampler opticalSampler;

    public DdmMetricSynthesizer(Topology topology, long seed, OpticalReadingSampler opticalSampler) {
        super(topology, seed);
        this.opticalSampler = opticalSampler;
    }

    @Override
    public TableType getTableType() {
        return TableType.DDM;
    }

    @Override
    public DdmMetricRecord synthesize(CommonFields common, FaultState fault, LocalDateTime timestamp) {
        DeviceInterface iface = interfaceOf(common);
        if (!iface.hasModule()) {
            throw new IllegalArgumentException("No optical module on " + iface.getModuleId());
        }
        OpticalModule module = iface.getModule();
        DdmMetricRecord record = label(new DdmMetricRecord(), common, fault);

        OpticalReading reading = opticalSampler.sample(module, fault, random);
        record.setOpticVendor(module.getVendor());
        record.setSerialNumber(module.getSerialNumber());
        record.setPartNumber(module.getPartNumber());
        record.setTemperature(check("temperature", reading.getTemperature(), -40, 125));
        record.setVoltage(check("voltage", reading.getVoltage(), 0, 5));
        record.setBiasCurrent(check("bias_current", reading.getBiasCurrent(), 0, 200));
        record.setTxPower(check("tx_power", reading.getTxPower(), -40, 10));
        record.setRxPower(check("rx_power", reading.getRxPower(), -40, 10));
        record.setTemperatureAlarm(reading.isTemperatureAlarm());
        record.setVoltageAlarm(reading.isVoltageAlarm());
        record.setBiasAlarm(reading.isBiasAlarm());
        record.setTxPowerAlarm(reading.isTxPowerAlarm());
        record.setRxPowerAlarm(reading.isRxPowerAlarm());
        return record;
    }
}
