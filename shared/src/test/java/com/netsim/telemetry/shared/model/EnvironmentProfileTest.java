package com.netsim.telemetry.shared.model;

import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.EnvironmentProfile;
import com.netsim.telemetry.shared.model.topology.LinkSpeed;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentProfileTest {

    @ParameterizedTest(name = "''{0}'' resolves to {1}")
    @CsvSource({
            "small lab, LAB",
            "Lab, LAB",
            "large datacenter, DATACENTER",
            "large-datacenter, DATACENTER",
            "ISP, ISP",
            "campus, CAMPUS",
            "complete, COMPLETE"
    })
    void resolvesAliases(String name, EnvironmentProfile expected) {
        assertThat(EnvironmentProfile.fromName(name)).isEqualTo(expected);
    }

    @Test
    void unknownProfileNamesField() {
        assertThatThrownBy(() -> EnvironmentProfile.fromName("moon base"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("environment");
    }

    @Test
    void lowestSpeedCarriesNoOptic() {
        assertThat(LinkSpeed.G1.supportsPluggableOptics()).isFalse();
        assertThat(LinkSpeed.G400.supportsPluggableOptics()).isTrue();
    }

    @Test
    void tableAliases() {
        assertThat(TableType.fromName("gnmi")).isEqualTo(TableType.GRPC);
        assertThat(TableType.fromName("predict")).isEqualTo(TableType.LIFECYCLE);
        assertThatThrownBy(() -> TableType.fromName("netflow"))
                .isInstanceOf(ConfigurationException.class);
    }
}
