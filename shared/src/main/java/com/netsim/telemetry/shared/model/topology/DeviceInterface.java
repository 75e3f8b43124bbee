package com.netsim.telemetry.shared.model.topology;

import java.util.Objects;

/**
 * A physical port on a {@link Device}, optionally carrying an {@link OpticalModule}.
 *
 * The {@code moduleId} is assigned once, when the topology is built, and is
 * the join key every generated table shares.
 */
public final class DeviceInterface {

    private final Device device;
    private final int portIndex;
    private final String name;
    private final String alias;
    private final LinkSpeed speed;
    private final int mtu;
    private final double baselineUtilization;
    private final OpticalModule module;
    private final String moduleId;

    public DeviceInterface(Device device, int portIndex, String name, String alias, LinkSpeed speed,
                           int mtu, double baselineUtilization, OpticalModule module, String moduleId) {
        this.device = Objects.requireNonNull(device, "device");
        this.portIndex = portIndex;
        this.name = Objects.requireNonNull(name, "name");
        this.alias = alias == null ? "" : alias;
        this.speed = Objects.requireNonNull(speed, "speed");
        this.mtu = mtu;
        this.baselineUtilization = baselineUtilization;
        this.module = module;
        this.moduleId = Objects.requireNonNull(moduleId, "moduleId");
    }

    public Device getDevice() { return device; }
    public int getPortIndex() { return portIndex; }
    public String getName() { return name; }
    public String getAlias() { return alias; }
    public LinkSpeed getSpeed() { return speed; }
    public int getMtu() { return mtu; }
    public double getBaselineUtilization() { return baselineUtilization; }
    public OpticalModule getModule() { return module; }
    public String getModuleId() { return moduleId; }

    public boolean hasModule() {
        return module != null;
    }

    @Override
    public String toString() {
        return "DeviceInterface{moduleId='" + moduleId + "'}";
    }
}
