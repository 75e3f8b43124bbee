package com.netsim.telemetry.shared.model.topology;

import com.netsim.telemetry.shared.error.ConfigurationException;

import java.util.List;
import java.util.Locale;

import static com.netsim.telemetry.shared.model.topology.LinkSpeed.*;

/**
 * Size/shape classes for the simulated fleet.
 *
 * Each profile fixes the placement hierarchy (datacenters, rooms, racks),
 * naming, addressing, vendor preference and port density. The device count
 * is the only dimension a request can override.
 */
public enum EnvironmentProfile {

    LAB("lab", 5, 1, 1, 2,
            List.of("lab-sw", "lab-rtr"), "192.168.100.0",
            List.of("Cisco", "Arista"), 4, 8,
            List.of(G1, G10, G25, G100), 500, 5_000),

    DATACENTER("datacenter", 100, 3, 4, 5,
            List.of("spine", "leaf", "border", "core"), "10.0.0.0",
            List.of("Cisco", "Arista", "Juniper"), 24, 64,
            List.of(G10, G25, G100, G200, G400, G800), 10_000, 100_000),

    ENTERPRISE("enterprise", 50, 2, 3, 4,
            List.of("core", "dist", "access", "edge"), "192.168.0.0",
            List.of("Cisco", "Huawei", "Juniper"), 8, 48,
            List.of(G1, G10, G25, G100), 1_000, 20_000),

    ISP("isp", 80, 3, 2, 6,
            List.of("edge", "agg", "core", "pe", "p"), "100.64.0.0",
            List.of("Cisco", "Juniper", "Huawei"), 4, 32,
            List.of(G10, G100, G400), 1_000, 10_000),

    CAMPUS("campus", 60, 1, 4, 4,
            List.of("bb", "dist", "access", "wifi"), "172.16.0.0",
            List.of("Cisco", "Huawei"), 24, 48,
            List.of(G1, G10, G25), 5_000, 20_000),

    COMPLETE("complete", 100, 4, 4, 6,
            List.of("spine", "leaf", "border", "core", "edge", "pe", "p", "agg"), "10.0.0.0",
            List.of("Cisco", "Huawei", "Juniper", "Arista", "Dell", "Broadcom Sonic", "Community Sonic"), 24, 64,
            List.of(G1, G10, G25, G40, G100, G200, G400, G800), 10_000, 100_000);

    private final String label;
    private final int defaultDeviceCount;
    private final int datacenters;
    private final int roomsPerDatacenter;
    private final int racksPerRoom;
    private final List<String> devicePrefixes;
    private final String managementNetwork;
    private final List<String> primaryVendors;
    private final int minPorts;
    private final int maxPorts;
    private final List<LinkSpeed> speeds;
    private final int minMacTable;
    private final int maxMacTable;

    EnvironmentProfile(String label, int defaultDeviceCount, int datacenters, int roomsPerDatacenter,
                       int racksPerRoom, List<String> devicePrefixes, String managementNetwork,
                       List<String> primaryVendors, int minPorts, int maxPorts, List<LinkSpeed> speeds,
                       int minMacTable, int maxMacTable) {
        this.label = label;
        this.defaultDeviceCount = defaultDeviceCount;
        this.datacenters = datacenters;
        this.roomsPerDatacenter = roomsPerDatacenter;
        this.racksPerRoom = racksPerRoom;
        this.devicePrefixes = devicePrefixes;
        this.managementNetwork = managementNetwork;
        this.primaryVendors = primaryVendors;
        this.minPorts = minPorts;
        this.maxPorts = maxPorts;
        this.speeds = speeds;
        this.minMacTable = minMacTable;
        this.maxMacTable = maxMacTable;
    }

    public String getLabel() { return label; }
    public int getDefaultDeviceCount() { return defaultDeviceCount; }
    public int getDatacenters() { return datacenters; }
    public int getRoomsPerDatacenter() { return roomsPerDatacenter; }
    public int getRacksPerRoom() { return racksPerRoom; }
    public List<String> getDevicePrefixes() { return devicePrefixes; }
    public String getManagementNetwork() { return managementNetwork; }
    public List<String> getPrimaryVendors() { return primaryVendors; }
    public int getMinPorts() { return minPorts; }
    public int getMaxPorts() { return maxPorts; }
    public List<LinkSpeed> getSpeeds() { return speeds; }
    public int getMinMacTable() { return minMacTable; }
    public int getMaxMacTable() { return maxMacTable; }

    public int getTotalRacks() {
        return datacenters * roomsPerDatacenter * racksPerRoom;
    }

    /**
     * Resolve a profile by label or constant name. Accepts "large datacenter",
     * "large-datacenter" and "DATACENTER" alike; the "small"/"large" qualifiers
     * are cosmetic aliases for LAB and DATACENTER.
     */
    public static EnvironmentProfile fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("environment", "must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        switch (normalized) {
            case "small lab", "lab" -> {
                return LAB;
            }
            case "large datacenter", "datacenter", "data center" -> {
                return DATACENTER;
            }
            default -> {
                for (EnvironmentProfile profile : values()) {
                    if (profile.label.equals(normalized)) {
                        return profile;
                    }
                }
                throw new ConfigurationException("environment",
                        "unknown profile '" + name + "', expected one of " + List.of(values()));
            }
        }
    }
}
