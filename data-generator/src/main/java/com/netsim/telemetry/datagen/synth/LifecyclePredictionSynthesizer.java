package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.LifecyclePredictionRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.OpticalModule;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Remaining-life prediction derived from a module's recent DDM history.
 *
 * MODEL ("ddm-severity-hazard-v1"):
 *   acc  = sum over the history of (severity + 0.1 * channels in alarm)
 *   base = 0.001 + 0.05 * min(1, age / rated life)
 *   p    = 1 - (1 - base) * exp(-0.35 * acc)
 *   remaining days = round((rated life - age) * (1 - p)), at least 1
 *
 * p rises monotonically with accumulated severity and with age. The
 * synthesizer draws no randomness: given the same history it returns the same
 * prediction.
 */
public class LifecyclePredictionSynthesizer extends AbstractRecordSynthesizer<LifecyclePredictionRecord> {

    public static final String MODEL_NAME = "ddm-severity-hazard-v1";

    private static final double HAZARD_RATE = 0.35;
    private static final double ALARM_WEIGHT = 0.1;

    private final DdmHistoryView history;

    public LifecyclePredictionSynthesizer(Topology topology, DdmHistoryView history) {
        super(topology);
        this.history = history;
    }

    @Override
    public TableType getTableType() {
        return TableType.LIFECYCLE;
    }

    @Override
    public LifecyclePredictionRecord synthesize(CommonFields common, FaultState fault, LocalDateTime timestamp) {
        DeviceInterface iface = interfaceOf(common);
        if (!iface.hasModule()) {
            throw new IllegalArgumentException("No optical module on " + iface.getModuleId());
        }
        OpticalModule module = iface.getModule();
        List<DdmObservation> recent = history.recent(iface.getModuleId());

        double accumulated = accumulatedSeverity(recent);
        double probability = failureProbability(module.getAgeDays(), accumulated);
        int remaining = (int) Math.max(1, Math.round((OpticalModule.RATED_LIFE_DAYS - module.getAgeDays()) * (1 - probability)));

        LifecyclePredictionRecord record = label(new LifecyclePredictionRecord(), common, fault);
        record.setOpticVendor(module.getVendor());
        record.setSerialNumber(module.getSerialNumber());
        record.setFailureProbability(check("failure_probability", round(probability, 4), 0, 1));
        record.setPredictedRemainingDays((int) check("predicted_remaining_days", remaining, 1, OpticalModule.RATED_LIFE_DAYS));
        record.setPredictedFailureDate(timestamp.toLocalDate().plusDays(remaining));
        record.setAccumulatedSeverity(round(accumulated, 4));
        record.setHistorySize(recent.size());
        record.setModelName(MODEL_NAME);
        return record;
    }

    static double accumulatedSeverity(List<DdmObservation> recent) {
        double sum = 0;
        for (DdmObservation observation : recent) {
            sum += observation.getSeverity() + ALARM_WEIGHT * observation.getAlarmCount();
        }
        return sum;
    }

    static double failureProbability(int ageDays, double accumulated) {
        double base = 0.001 + 0.05 * Math.min(1.0, (double) ageDays / OpticalModule.RATED_LIFE_DAYS);
        return 1 - (1 - base) * Math.exp(-HAZARD_RATE * accumulated);
    }
}
