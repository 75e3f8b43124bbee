package com.netsim.telemetry.datagen.identity;

import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.topology.Device;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.LinkSpeed;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.LocalDateTime;

/**
 * Derives the shared join key and the common column block for a topology
 * entry. Pure: the result depends only on the interface and the timestamp,
 * never on fault or schema state, so every table renders the same key.
 *
 * module_id format:
 *   vendor-datacenter-room-rack-hostname-interface-speed
 * where vendor is the optic vendor for optical ports and the device vendor
 * otherwise. Spaces in vendor names become underscores.
 */
public class ModuleKeyGenerator {

    private final Topology topology;

    public ModuleKeyGenerator(Topology topology) {
        this.topology = topology;
    }

    public static String moduleIdOf(String vendor, Device device, String interfaceName, LinkSpeed speed) {
        return String.join("-",
                vendor.replace(' ', '_'),
                device.getDatacenter(),
                device.getRoom(),
                device.getRack(),
                device.getHostname(),
                interfaceName,
                speed.getLabel());
    }

    /**
     * Common block for one row.
     *
     * @throws IllegalStateException if the interface does not belong to this
     *         run's topology or its stored key no longer matches its attributes
     */
    public CommonFields commonFieldsFor(DeviceInterface iface, LocalDateTime timestamp) {
        if (!topology.containsKey(iface.getModuleId()) || topology.getInterface(iface.getModuleId()) != iface) {
            throw new IllegalStateException("Interface is not part of this topology: " + iface.getModuleId());
        }
        Device device = iface.getDevice();
        String vendor = iface.hasModule() ? iface.getModule().getVendor() : device.getVendor();
        String expected = moduleIdOf(vendor, device, iface.getName(), iface.getSpeed());
        if (!expected.equals(iface.getModuleId())) {
            throw new IllegalStateException("Malformed topology entry: stored key " + iface.getModuleId()
                    + " does not match derived key " + expected);
        }

        CommonFields common = new CommonFields();
        common.setTimestamp(timestamp);
        common.setModuleId(iface.getModuleId());
        common.setDatacenter(device.getDatacenter());
        common.setRoom(device.getRoom());
        common.setRack(device.getRack());
        common.setDeviceHostname(device.getHostname());
        common.setDeviceIp(device.getIp());
        common.setDeviceVendor(device.getVendor());
        common.setInterfaceName(iface.getName());
        common.setSpeed(iface.getSpeed().getLabel());
        return common;
    }

    public Topology getTopology() {
        return topology;
    }
}
