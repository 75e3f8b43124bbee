package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultKind;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.DdmMetricRecord;
import com.netsim.telemetry.shared.model.record.LifecyclePredictionRecord;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.OpticalModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.netsim.telemetry.datagen.synth.SynthesizerFixture.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LifecyclePredictionSynthesizerTest {

    private final SynthesizerFixture fx = new SynthesizerFixture();

    @Nested
    @DisplayName("Hazard model")
    class Model {

        @Test
        @DisplayName("Empty history leaves only the age-based baseline")
        void baseline() {
            assertThat(LifecyclePredictionSynthesizer.failureProbability(0, 0.0)).isCloseTo(0.001, within(1e-9));
            assertThat(LifecyclePredictionSynthesizer.failureProbability(OpticalModule.RATED_LIFE_DAYS, 0.0))
                    .isCloseTo(0.051, within(1e-9));
        }

        @Test
        @DisplayName("Probability rises with accumulated severity and with age")
        void monotonic() {
            double previous = -1;
            for (double acc = 0; acc <= 10; acc += 0.5) {
                double p = LifecyclePredictionSynthesizer.failureProbability(400, acc);
                assertThat(p).isGreaterThan(previous).isLessThanOrEqualTo(1.0);
                previous = p;
            }
            assertThat(LifecyclePredictionSynthesizer.failureProbability(1200, 2.0))
                    .isGreaterThan(LifecyclePredictionSynthesizer.failureProbability(100, 2.0));
        }

        @Test
        @DisplayName("Alarms add a tenth each on top of fault severity")
        void accumulated() {
            List<DdmObservation> history = List.of(
                    new DdmObservation(START, 0.0, 0),
                    new DdmObservation(START.plusMinutes(5), 0.6, 2),
                    new DdmObservation(START.plusMinutes(10), 0.0, 1));

            assertThat(LifecyclePredictionSynthesizer.accumulatedSeverity(history)).isCloseTo(0.9, within(1e-9));
        }
    }

    @Test
    @DisplayName("Predictions follow the history they are given")
    void suppliedHistory() {
        DeviceInterface iface = fx.optical();
        BoundedDdmHistory history = new BoundedDdmHistory(4);
        LifecyclePredictionSynthesizer synth = new LifecyclePredictionSynthesizer(fx.topology, history);
        DdmMetricSynthesizer ddm = new DdmMetricSynthesizer(fx.topology, 2L, new OpticalReadingSampler());

        LifecyclePredictionRecord healthy = synth.synthesize(fx.common(iface, START), FaultState.NORMAL, START);
        assertThat(healthy.getHistorySize()).isZero();

        for (int i = 0; i < 6; i++) {
            LocalDateTime ts = START.plusMinutes(5L * i);
            FaultState fault = FaultState.of(FaultKind.HIGH_TEMPERATURE, 0.8);
            DdmMetricRecord row = ddm.synthesize(fx.common(iface, ts), fault, ts);
            history.record(row, fault);
        }
        LocalDateTime now = START.plusMinutes(30);
        LifecyclePredictionRecord degraded = synth.synthesize(fx.common(iface, now), FaultState.NORMAL, now);

        assertThat(degraded.getHistorySize()).isEqualTo(4);
        assertThat(degraded.getFailureProbability()).isGreaterThan(healthy.getFailureProbability());
        assertThat(degraded.getPredictedRemainingDays()).isLessThan(healthy.getPredictedRemainingDays()).isPositive();
        assertThat(degraded.getPredictedFailureDate())
                .isEqualTo(now.toLocalDate().plusDays(degraded.getPredictedRemainingDays()));
        assertThat(degraded.getModelName()).isEqualTo(LifecyclePredictionSynthesizer.MODEL_NAME);
        assertThat(degraded.getSerialNumber()).isEqualTo(iface.getModule().getSerialNumber());
    }

    @Test
    @DisplayName("Two synthesizers over the same history predict the same values")
    void drawsNoRandomness() {
        DeviceInterface iface = fx.optical();
        BoundedDdmHistory history = new BoundedDdmHistory(4);
        DdmMetricSynthesizer ddm = new DdmMetricSynthesizer(fx.topology, 2L, new OpticalReadingSampler());
        FaultState fault = FaultState.of(FaultKind.LOW_RX_POWER, 0.5);
        history.record(ddm.synthesize(fx.common(iface, START), fault, START), fault);

        LifecyclePredictionRecord first = new LifecyclePredictionSynthesizer(fx.topology, history)
                .synthesize(fx.common(iface, START), fault, START);
        LifecyclePredictionRecord second = new LifecyclePredictionSynthesizer(fx.topology, history)
                .synthesize(fx.common(iface, START), fault, START);

        assertThat(second.getFailureProbability()).isEqualTo(first.getFailureProbability());
        assertThat(second.getPredictedRemainingDays()).isEqualTo(first.getPredictedRemainingDays());
        assertThat(second.getAccumulatedSeverity()).isEqualTo(first.getAccumulatedSeverity());
    }

    @Test
    @DisplayName("History window keeps only the most recent observations per module")
    void boundedWindow() {
        BoundedDdmHistory history = new BoundedDdmHistory(3);
        DdmMetricSynthesizer ddm = new DdmMetricSynthesizer(fx.topology, 2L, new OpticalReadingSampler());
        DeviceInterface a = fx.topology.getOpticalInterfaces().get(0);
        DeviceInterface b = fx.topology.getOpticalInterfaces().get(1);

        for (int i = 0; i < 5; i++) {
            LocalDateTime ts = START.plusMinutes(5L * i);
            history.record(ddm.synthesize(fx.common(a, ts), FaultState.NORMAL, ts), FaultState.NORMAL);
        }

        assertThat(history.recent(a.getModuleId())).extracting(DdmObservation::getTimestamp)
                .containsExactly(START.plusMinutes(10), START.plusMinutes(15), START.plusMinutes(20));
        assertThat(history.recent(b.getModuleId())).isEmpty();
    }
}
