package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.datagen.topology.VendorCatalog;
import com.netsim.telemetry.shared.model.fault.FaultKind;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.GrpcMetricRecord;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.OpticalModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.netsim.telemetry.datagen.synth.SynthesizerFixture.START;
import static org.assertj.core.api.Assertions.assertThat;

class GrpcMetricSynthesizerTest {

    private final SynthesizerFixture fx = new SynthesizerFixture();
    private final GrpcMetricSynthesizer synth = new GrpcMetricSynthesizer(fx.topology, 3L, new OpticalReadingSampler());

    private GrpcMetricRecord row(DeviceInterface iface, FaultState fault, LocalDateTime ts) {
        return synth.synthesize(fx.common(iface, ts), fault, ts);
    }

    @Test
    @DisplayName("Normal rows are up, labelled normal and carry no fault counters")
    void normal() {
        GrpcMetricRecord r = row(fx.optical(), FaultState.NORMAL, START.plusHours(12));

        assertThat(r.isAnomaly()).isFalse();
        assertThat(r.getAnomalyType()).isEqualTo("normal");
        assertThat(r.getOperStatus()).isEqualTo("UP");
        assertThat(r.getCarrierTransitions()).isZero();
        assertThat(r.getInUtilization()).isBetween(0.0, 100.0);
        assertThat(r.getSubscriptionPath()).isEqualTo(VendorCatalog.gnmiCountersPath(
                fx.optical().getDevice().getVendor(), fx.optical().getName()));
        assertThat(r.getSampleIntervalSec()).isEqualTo(60);
    }

    @Test
    @DisplayName("Optical readings are present only on ports with a module")
    void opticsOnlyWhereSeated() {
        GrpcMetricRecord optical = row(fx.optical(), FaultState.NORMAL, START);
        GrpcMetricRecord electrical = row(fx.electrical(), FaultState.NORMAL, START);

        assertThat(optical.getTemperature()).isNotNull();
        assertThat(optical.getRxPower()).isBetween(OpticalModule.RX_POWER_LOW_ALARM, OpticalModule.RX_POWER_HIGH_ALARM);
        assertThat(electrical.getTemperature()).isNull();
        assertThat(electrical.getRxPower()).isNull();
    }

    @Test
    @DisplayName("Link flap takes the port down and counts carrier transitions")
    void linkFlap() {
        GrpcMetricRecord r = row(fx.optical(), FaultState.of(FaultKind.LINK_FLAP, 0.9), START);

        assertThat(r.isAnomaly()).isTrue();
        assertThat(r.getAnomalyType()).isEqualTo("link_flap");
        assertThat(r.getOperStatus()).isEqualTo("DOWN");
        assertThat(r.getCarrierTransitions()).isGreaterThanOrEqualTo(2);
        assertThat(r.getRxPower()).isLessThan(OpticalModule.RX_POWER_LOW_ALARM);
    }

    @Test
    @DisplayName("High error rate shows up in error and CRC counters")
    void errorRate() {
        GrpcMetricRecord r = row(fx.electrical(), FaultState.of(FaultKind.HIGH_ERROR_RATE, 0.8), START.plusHours(18));

        assertThat(r.getInErrors()).isGreaterThanOrEqualTo(10);
        assertThat(r.getInCrcErrors()).isPositive();
    }

    @Test
    @DisplayName("Same seed and inputs give the same row")
    void deterministic() {
        GrpcMetricSynthesizer again = new GrpcMetricSynthesizer(fx.topology, 3L, new OpticalReadingSampler());
        LocalDateTime ts = START.plusMinutes(30);

        GrpcMetricRecord a = synth.synthesize(fx.common(fx.optical(), ts), FaultState.NORMAL, ts);
        GrpcMetricRecord b = again.synthesize(fx.common(fx.optical(), ts), FaultState.NORMAL, ts);

        assertThat(a.getInOctets()).isEqualTo(b.getInOctets());
        assertThat(a.getTemperature()).isEqualTo(b.getTemperature());
    }
}
