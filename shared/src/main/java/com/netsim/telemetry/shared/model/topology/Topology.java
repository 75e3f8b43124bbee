package com.netsim.telemetry.shared.model.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fixed virtual fleet for one generation run: datacenters, rooms and racks
 * populated with devices, their interfaces and optical modules.
 *
 * Immutable once constructed, so generation workers can share it without
 * locking. Interfaces keep their build order; that order is the iteration
 * order the scheduler uses when it spreads rows across keys.
 */
public final class Topology {

    /** Upper bound on devices per run, checked before anything is allocated. */
    public static final int MAX_DEVICE_COUNT = 10_000;

    private final EnvironmentProfile profile;
    private final List<Device> devices;
    private final List<DeviceInterface> interfaces;
    private final List<DeviceInterface> opticalInterfaces;
    private final Map<String, DeviceInterface> byModuleId;
    private final Map<String, List<DeviceInterface>> byHostname;

    public Topology(EnvironmentProfile profile, List<Device> devices, List<DeviceInterface> interfaces) {
        this.profile = profile;
        this.devices = List.copyOf(devices);
        this.interfaces = List.copyOf(interfaces);

        Map<String, DeviceInterface> index = new LinkedHashMap<>();
        Map<String, List<DeviceInterface>> perHost = new LinkedHashMap<>();
        List<DeviceInterface> optical = new ArrayList<>();
        for (DeviceInterface iface : this.interfaces) {
            if (index.put(iface.getModuleId(), iface) != null) {
                throw new IllegalStateException("Duplicate module_id in topology: " + iface.getModuleId());
            }
            perHost.computeIfAbsent(iface.getDevice().getHostname(), h -> new ArrayList<>()).add(iface);
            if (iface.hasModule()) {
                optical.add(iface);
            }
        }
        perHost.replaceAll((host, list) -> Collections.unmodifiableList(list));

        this.byModuleId = Collections.unmodifiableMap(index);
        this.byHostname = Collections.unmodifiableMap(perHost);
        this.opticalInterfaces = Collections.unmodifiableList(optical);
    }

    public EnvironmentProfile getProfile() { return profile; }

    public List<Device> getDevices() { return devices; }

    public List<DeviceInterface> getInterfaces() { return interfaces; }

    /** Interfaces that carry an optical module, in build order. */
    public List<DeviceInterface> getOpticalInterfaces() { return opticalInterfaces; }

    public Set<String> getModuleIds() {
        return byModuleId.keySet();
    }

    public boolean containsKey(String moduleId) {
        return byModuleId.containsKey(moduleId);
    }

    /**
     * Look up an interface by its composite key.
     *
     * @throws IllegalArgumentException if the key is not part of this topology
     */
    public DeviceInterface getInterface(String moduleId) {
        DeviceInterface iface = byModuleId.get(moduleId);
        if (iface == null) {
            throw new IllegalArgumentException("module_id not in topology: " + moduleId);
        }
        return iface;
    }

    public List<DeviceInterface> interfacesOf(Device device) {
        return byHostname.getOrDefault(device.getHostname(), List.of());
    }

    @Override
    public String toString() {
        return "Topology{profile=" + profile + ", devices=" + devices.size()
                + ", interfaces=" + interfaces.size() + ", optical=" + opticalInterfaces.size() + "}";
    }
}
