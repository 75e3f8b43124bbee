package com.netsim.telemetry.datagen.topology;

import com.netsim.telemetry.datagen.identity.ModuleKeyGenerator;
import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.topology.Device;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.EnvironmentProfile;
import com.netsim.telemetry.shared.model.topology.LinkSpeed;
import com.netsim.telemetry.shared.model.topology.OpticalModule;
import com.netsim.telemetry.shared.model.topology.Topology;
import net.datafaker.Faker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds the virtual fleet for one run.
 *
 * LAYOUT:
 *   datacenters -> rooms -> racks come from the environment profile.
 *   Devices are placed round-robin over the racks, so every rack fills
 *   evenly before any rack gets a second device.
 *
 * CORRELATED FIELDS:
 *   - vendor drawn 70/30 in favour of the profile's primary vendors
 *   - interface names follow the device vendor's naming convention
 *   - port 1 always carries an optic; other optic-capable ports carry one
 *     with probability 0.7, so the optical tables are never empty
 *   - module baselines stay well inside the alarm thresholds
 *
 * Deterministic: one builder per seed; the same seed and inputs yield the
 * same devices, interfaces and module_ids.
 *
 * USAGE:
 *   Topology topology = new TopologyBuilder(42L).build(EnvironmentProfile.LAB, 5);
 */
public class TopologyBuilder {

    private static final Logger log = LoggerFactory.getLogger(TopologyBuilder.class);

    private static final double PRIMARY_VENDOR_WEIGHT = 0.7;
    private static final double OTHER_VENDOR_WEIGHT = 0.3;
    private static final double OPTIC_PROBABILITY = 0.7;
    private static final int HOSTS_PER_SUBNET = 254;
    private static final int[] MTUS = {1500, 9000, 9216};

    private final Faker faker;
    private final Random random;

    public TopologyBuilder(long seed) {
        this.faker = new Faker(new Random(seed));
        this.random = new Random(seed);
    }

    public Topology build(EnvironmentProfile profile, int deviceCount) {
        if (profile == null) {
            throw new ConfigurationException("environment", "is required");
        }
        if (deviceCount <= 0 || deviceCount > Topology.MAX_DEVICE_COUNT) {
            throw new ConfigurationException("deviceCount",
                    "must be in [1, " + Topology.MAX_DEVICE_COUNT + "], was " + deviceCount);
        }

        List<Device> devices = new ArrayList<>(deviceCount);
        List<DeviceInterface> interfaces = new ArrayList<>();
        for (int i = 0; i < deviceCount; i++) {
            Device device = buildDevice(profile, i);
            devices.add(device);
            interfaces.addAll(buildInterfaces(profile, device));
        }

        Topology topology = new Topology(profile, devices, interfaces);
        log.info("Built topology: profile={}, devices={}, interfaces={}, optical={}",
                profile.getLabel(), devices.size(), interfaces.size(), topology.getOpticalInterfaces().size());
        return topology;
    }

    // ===== DEVICES =====

    private Device buildDevice(EnvironmentProfile profile, int index) {
        int rackSlot = index % profile.getTotalRacks();
        int racksPerDc = profile.getRoomsPerDatacenter() * profile.getRacksPerRoom();
        int dc = rackSlot / racksPerDc;
        int room = (rackSlot % racksPerDc) / profile.getRacksPerRoom();
        int rack = rackSlot % profile.getRacksPerRoom();

        String prefix = pick(profile.getDevicePrefixes());
        String hostname = String.format("%s-%02d-%03d", prefix, dc + 1, index + 1);
        String vendor = pickVendor(profile);
        String version = faker.numerify("#.#.#");
        long uptime = 86_400L + (long) (random.nextDouble() * 400 * 86_400L);
        int macSize = profile.getMinMacTable()
                + random.nextInt(profile.getMaxMacTable() - profile.getMinMacTable() + 1);

        return new Device(hostname, managementIp(profile, index), vendor, prefix,
                String.format("DC%d", dc + 1),
                String.format("Room%02d", room + 1),
                String.format("Rack%02d", rack + 1),
                VendorCatalog.systemDescription(vendor, version),
                uptime, profile.getMaxMacTable(), macSize);
    }

    /**
     * Weighted vendor draw over the full catalog: primary vendors weigh 0.7,
     * the rest 0.3.
     */
    private String pickVendor(EnvironmentProfile profile) {
        List<String> vendors = VendorCatalog.DEVICE_VENDORS;
        double total = 0;
        for (String v : vendors) {
            total += weightOf(profile, v);
        }
        double roll = random.nextDouble() * total;
        for (String v : vendors) {
            roll -= weightOf(profile, v);
            if (roll < 0) {
                return v;
            }
        }
        return vendors.get(vendors.size() - 1);
    }

    private double weightOf(EnvironmentProfile profile, String vendor) {
        return profile.getPrimaryVendors().contains(vendor) ? PRIMARY_VENDOR_WEIGHT : OTHER_VENDOR_WEIGHT;
    }

    /**
     * Sequential host addresses in the profile's management network,
     * 254 hosts per /24.
     */
    private String managementIp(EnvironmentProfile profile, int index) {
        String[] octets = profile.getManagementNetwork().split("\\.");
        long base = (Long.parseLong(octets[0]) << 24) | (Long.parseLong(octets[1]) << 16)
                | (Long.parseLong(octets[2]) << 8) | Long.parseLong(octets[3]);
        long address = base + (long) (index / HOSTS_PER_SUBNET) * 256 + (index % HOSTS_PER_SUBNET) + 1;
        return ((address >> 24) & 0xFF) + "." + ((address >> 16) & 0xFF) + "."
                + ((address >> 8) & 0xFF) + "." + (address & 0xFF);
    }

    // ===== INTERFACES & OPTICS =====

    private List<DeviceInterface> buildInterfaces(EnvironmentProfile profile, Device device) {
        int ports = profile.getMinPorts() + random.nextInt(profile.getMaxPorts() - profile.getMinPorts() + 1);
        List<LinkSpeed> opticCapable = profile.getSpeeds().stream()
                .filter(LinkSpeed::supportsPluggableOptics)
                .toList();

        List<DeviceInterface> result = new ArrayList<>(ports);
        for (int port = 1; port <= ports; port++) {
            boolean first = port == 1;
            LinkSpeed speed = first ? pick(opticCapable) : pick(profile.getSpeeds());
            boolean optical = speed.supportsPluggableOptics() && (first || random.nextDouble() < OPTIC_PROBABILITY);

            String name = VendorCatalog.interfaceName(device.getVendor(), speed, port);
            OpticalModule module = optical ? buildModule(speed) : null;
            String keyVendor = module != null ? module.getVendor() : device.getVendor();
            String moduleId = ModuleKeyGenerator.moduleIdOf(keyVendor, device, name, speed);

            result.add(new DeviceInterface(device, port, name, aliasFor(port), speed,
                    MTUS[random.nextInt(MTUS.length)], 0.05 + random.nextDouble() * 0.55,
                    module, moduleId));
        }
        return result;
    }

    private String aliasFor(int port) {
        if (random.nextDouble() < 0.2) {
            return "";
        }
        return "to-" + faker.regexify("[a-z]{4}-[0-9]{2}") + "-port" + port;
    }

    private OpticalModule buildModule(LinkSpeed speed) {
        String vendor = pick(VendorCatalog.OPTICAL_VENDORS);
        return new OpticalModule(
                vendor,
                faker.regexify("[A-Z0-9]{10}"),
                speed.getFormFactor() + "-" + speed.getLabel() + "-" + faker.numerify("####"),
                30 + random.nextInt(1_600),
                round2(30 + random.nextDouble() * 25),
                round2(3.25 + random.nextDouble() * 0.15),
                round2(20 + random.nextDouble() * 40),
                round2(-1.5 + random.nextDouble() * 3.0),
                round2(-4.0 + random.nextDouble() * 4.5));
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
