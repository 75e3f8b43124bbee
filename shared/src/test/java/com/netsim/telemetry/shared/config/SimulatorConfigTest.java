package com.netsim.telemetry.shared.config;

import com.netsim.telemetry.shared.model.record.TableType;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatorConfigTest {

    @Test
    void fileValuesAndDefaults() {
        SimulatorConfig config = SimulatorConfig.withOverrides(new Properties());

        assertThat(config.getSinkType()).isEqualTo("jsonl");
        assertThat(config.getOutputName(TableType.LIFECYCLE)).isEqualTo("predict_data");
        assertThat(config.get("no.such.key", "fallback")).isEqualTo("fallback");
        assertThat(config.getBoolean("no.such.key", true)).isTrue();
    }

    @Test
    void overridesWinOverFile() {
        Properties props = new Properties();
        props.setProperty("output.snmp", "polls");
        props.setProperty("generation.parallel", "true");

        SimulatorConfig config = SimulatorConfig.withOverrides(props);

        assertThat(config.getOutputName(TableType.SNMP)).isEqualTo("polls");
        assertThat(config.getBoolean("generation.parallel", false)).isTrue();
    }

    @Test
    void systemPropertyOverridesFile() {
        System.setProperty("output.ddm", "optics_from_sysprop");
        try {
            assertThat(SimulatorConfig.withOverrides(new Properties()).getOutputName(TableType.DDM))
                    .isEqualTo("optics_from_sysprop");
        } finally {
            System.clearProperty("output.ddm");
        }
    }

    @Test
    void overridesWinOverSystemProperties() {
        System.setProperty("output.grpc", "from_sysprop");
        try {
            Properties props = new Properties();
            props.setProperty("output.grpc", "from_flag");
            assertThat(SimulatorConfig.withOverrides(props).getOutputName(TableType.GRPC))
                    .isEqualTo("from_flag");
        } finally {
            System.clearProperty("output.grpc");
        }
    }
}
