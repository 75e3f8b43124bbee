package com.netsim.telemetry.shared.model;

import com.netsim.telemetry.shared.config.SimulatorConfig;
import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.request.DateRange;
import com.netsim.telemetry.shared.model.request.GenerationRequest;
import com.netsim.telemetry.shared.model.topology.EnvironmentProfile;
import com.netsim.telemetry.shared.model.topology.Topology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Request validation happens eagerly and always names the offending field.
 */
class GenerationRequestTest {

    private static final DateRange ONE_DAY = DateRange.of(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 1));

    private GenerationRequest.Builder valid() {
        return GenerationRequest.builder().dateRange(ONE_DAY).rowsPerTable(100).faultRatio(0.1);
    }

    @Nested
    @DisplayName("Date ranges")
    class DateRanges {

        @Test
        @DisplayName("Single calendar day spans 86400 seconds")
        void singleDay() {
            assertThat(ONE_DAY.getSeconds()).isEqualTo(86_400);
            assertThat(ONE_DAY.getStart()).isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0));
            assertThat(ONE_DAY.contains(LocalDateTime.of(2025, 3, 2, 0, 0))).isFalse();
        }

        @Test
        @DisplayName("Inverted range is rejected")
        void inverted() {
            assertThatThrownBy(() -> DateRange.of(LocalDate.of(2025, 3, 2), LocalDate.of(2025, 3, 1)))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("dateRange");
        }

        @Test
        @DisplayName("Empty timestamp range is rejected")
        void empty() {
            LocalDateTime t = LocalDateTime.of(2025, 3, 1, 12, 0);
            assertThatThrownBy(() -> DateRange.between(t, t))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest(name = "fault ratio {0} is rejected")
        @ValueSource(doubles = {-0.01, 1.01, Double.NaN})
        void faultRatioOutOfRange(double ratio) {
            assertThatThrownBy(() -> valid().faultRatio(ratio).build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("faultRatio");
        }

        @ParameterizedTest(name = "device count {0} is rejected")
        @ValueSource(ints = {0, -3, Topology.MAX_DEVICE_COUNT + 1})
        void deviceCountOutOfRange(int devices) {
            assertThatThrownBy(() -> valid().deviceCount(devices).build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("deviceCount");
        }

        @Test
        void negativeVolumeRejected() {
            assertThatThrownBy(() -> valid().rowsPerTable(-1).build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("rowsPerTable");
        }

        @Test
        void emptyTableSetRejected() {
            assertThatThrownBy(() -> valid().tables(EnumSet.noneOf(TableType.class)).build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("tables");
        }

        @Test
        void missingDateRangeRejected() {
            assertThatThrownBy(() -> GenerationRequest.builder().build())
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("dateRange");
        }

        @Test
        @DisplayName("Zero volume and boundary ratios are valid")
        void boundaries() {
            assertThat(valid().rowsPerTable(0).faultRatio(0.0).build().getRowsPerTable()).isZero();
            assertThat(valid().faultRatio(1.0).build().getFaultRatio()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Device count falls back to the profile default")
        void profileDefault() {
            GenerationRequest request = valid().environment(EnvironmentProfile.LAB).build();
            assertThat(request.getDeviceCount()).isEqualTo(EnvironmentProfile.LAB.getDefaultDeviceCount());
        }

        @Test
        @DisplayName("Output names default per table and seed stays empty")
        void outputNames() {
            GenerationRequest request = valid().outputName(TableType.SNMP, "custom_snmp").build();
            assertThat(request.getOutputName(TableType.SNMP)).isEqualTo("custom_snmp");
            assertThat(request.getOutputName(TableType.LIFECYCLE)).isEqualTo("predict_data");
            assertThat(request.getSeed()).isEmpty();
        }

        @Test
        @DisplayName("withSeed pins the seed and keeps everything else")
        void withSeed() {
            GenerationRequest original = valid().deviceCount(7).tables(Set.of(TableType.DDM)).build();
            GenerationRequest pinned = original.withSeed(99L);
            assertThat(pinned.getSeed()).contains(99L);
            assertThat(pinned.getDeviceCount()).isEqualTo(7);
            assertThat(pinned.getTables()).containsExactly(TableType.DDM);
            assertThat(pinned.getDateRange()).isEqualTo(original.getDateRange());
        }
    }

    @Nested
    @DisplayName("From configuration")
    class FromConfig {

        @Test
        void readsOverrides() {
            Properties props = new Properties();
            props.setProperty("generation.start-date", "2025-04-01");
            props.setProperty("generation.end-date", "2025-04-02");
            props.setProperty("generation.rows-per-table", "250");
            props.setProperty("generation.environment", "small lab");
            props.setProperty("generation.devices", "3");
            props.setProperty("generation.seed", "7");
            props.setProperty("generation.tables", "snmp, ddm");

            GenerationRequest request = GenerationRequest.fromConfig(SimulatorConfig.withOverrides(props));

            assertThat(request.getRowsPerTable()).isEqualTo(250);
            assertThat(request.getEnvironment()).isEqualTo(EnvironmentProfile.LAB);
            assertThat(request.getDeviceCount()).isEqualTo(3);
            assertThat(request.getSeed()).contains(7L);
            assertThat(request.getTables()).containsExactlyInAnyOrder(TableType.SNMP, TableType.DDM);
            assertThat(request.getDateRange().getSeconds()).isEqualTo(2 * 86_400);
        }

        @Test
        void malformedNumberNamesField() {
            Properties props = new Properties();
            props.setProperty("generation.fault-ratio", "lots");
            assertThatThrownBy(() -> GenerationRequest.fromConfig(SimulatorConfig.withOverrides(props)))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting("field").isEqualTo("faultRatio");
        }
    }
}
