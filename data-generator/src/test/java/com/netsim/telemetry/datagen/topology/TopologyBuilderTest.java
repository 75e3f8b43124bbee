package com.netsim.telemetry.datagen.topology;

import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.topology.Device;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.EnvironmentProfile;
import com.netsim.telemetry.shared.model.topology.OpticalModule;
import com.netsim.telemetry.shared.model.topology.Topology;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologyBuilderTest {

    @Test
    @DisplayName("Same seed builds the same fleet")
    void deterministic() {
        Topology a = new TopologyBuilder(42L).build(EnvironmentProfile.DATACENTER, 20);
        Topology b = new TopologyBuilder(42L).build(EnvironmentProfile.DATACENTER, 20);

        assertThat(a.getModuleIds()).containsExactlyElementsOf(b.getModuleIds());
        assertThat(a.getDevices()).extracting(Device::getIp)
                .containsExactlyElementsOf(b.getDevices().stream().map(Device::getIp).toList());
        assertThat(a.getOpticalInterfaces()).extracting(i -> i.getModule().getSerialNumber())
                .containsExactlyElementsOf(b.getOpticalInterfaces().stream()
                        .map(i -> i.getModule().getSerialNumber()).toList());
    }

    @Test
    @DisplayName("Different seeds build different fleets")
    void seedMatters() {
        Topology a = new TopologyBuilder(1L).build(EnvironmentProfile.DATACENTER, 20);
        Topology b = new TopologyBuilder(2L).build(EnvironmentProfile.DATACENTER, 20);

        assertThat(a.getModuleIds()).isNotEqualTo(b.getModuleIds());
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(EnvironmentProfile.class)
    @DisplayName("Every profile yields unique keys and at least one optic per device")
    void everyProfile(EnvironmentProfile profile) {
        Topology topology = new TopologyBuilder(7L).build(profile, 12);

        assertThat(topology.getDevices()).hasSize(12);
        assertThat(topology.getModuleIds()).hasSize(topology.getInterfaces().size());
        for (Device device : topology.getDevices()) {
            assertThat(topology.interfacesOf(device))
                    .hasSizeBetween(profile.getMinPorts(), profile.getMaxPorts())
                    .anyMatch(DeviceInterface::hasModule);
            assertThat(device.getMacTableSize()).isBetween(profile.getMinMacTable(), profile.getMaxMacTable());
        }
    }

    @Test
    @DisplayName("Devices are spread over racks before any rack gets a second device")
    void placement() {
        EnvironmentProfile profile = EnvironmentProfile.DATACENTER;
        Topology topology = new TopologyBuilder(3L).build(profile, profile.getTotalRacks());

        Set<String> racks = topology.getDevices().stream()
                .map(d -> d.getDatacenter() + "/" + d.getRoom() + "/" + d.getRack())
                .collect(Collectors.toSet());
        assertThat(racks).hasSize(profile.getTotalRacks());
        assertThat(topology.getDevices()).extracting(Device::getDatacenter)
                .containsOnly("DC1", "DC2", "DC3");
    }

    @Test
    @DisplayName("Management addresses are sequential and skip .0 and .255")
    void addressing() {
        Topology topology = new TopologyBuilder(3L).build(EnvironmentProfile.LAB, 256);

        assertThat(topology.getDevices().get(0).getIp()).isEqualTo("192.168.100.1");
        assertThat(topology.getDevices().get(253).getIp()).isEqualTo("192.168.100.254");
        assertThat(topology.getDevices().get(254).getIp()).isEqualTo("192.168.101.1");
        assertThat(topology.getDevices()).extracting(Device::getIp).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Optic baselines sit inside the alarm thresholds")
    void opticBaselines() {
        Topology topology = new TopologyBuilder(11L).build(EnvironmentProfile.COMPLETE, 30);

        for (DeviceInterface iface : topology.getOpticalInterfaces()) {
            OpticalModule m = iface.getModule();
            assertThat(m.getNominalTemperature()).isBetween(OpticalModule.TEMPERATURE_LOW_ALARM, OpticalModule.TEMPERATURE_HIGH_ALARM);
            assertThat(m.getNominalRxPower()).isBetween(OpticalModule.RX_POWER_LOW_ALARM, OpticalModule.RX_POWER_HIGH_ALARM);
            assertThat(m.getAgeDays()).isLessThan(OpticalModule.RATED_LIFE_DAYS);
            assertThat(iface.getSpeed().supportsPluggableOptics()).isTrue();
            assertThat(VendorCatalog.OPTICAL_VENDORS).contains(m.getVendor());
        }
    }

    @Test
    void rejectsBadDeviceCount() {
        TopologyBuilder builder = new TopologyBuilder(1L);

        assertThatThrownBy(() -> builder.build(EnvironmentProfile.LAB, 0))
                .isInstanceOf(ConfigurationException.class)
                .extracting("field").isEqualTo("deviceCount");
        assertThatThrownBy(() -> builder.build(EnvironmentProfile.LAB, Topology.MAX_DEVICE_COUNT + 1))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> builder.build(null, 5))
                .isInstanceOf(ConfigurationException.class)
                .extracting("field").isEqualTo("environment");
    }
}
