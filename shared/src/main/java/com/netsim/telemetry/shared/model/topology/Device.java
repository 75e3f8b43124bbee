package com.netsim.telemetry.shared.model.topology;

import java.util.Objects;

/**
 * A network device of the simulated fleet. Created once per run by the
 * topology builder and immutable afterwards.
 *
 * Uptime is expressed relative to the start of the generation window, so
 * counters derived from it stay monotonic across the whole date range.
 */
public final class Device {

    private final String hostname;
    private final String ip;
    private final String vendor;
    private final String role;
    private final String datacenter;
    private final String room;
    private final String rack;
    private final String systemDescription;
    private final long uptimeAtStartSeconds;
    private final int macTableCapacity;
    private final int macTableSize;

    public Device(String hostname, String ip, String vendor, String role,
                  String datacenter, String room, String rack, String systemDescription,
                  long uptimeAtStartSeconds, int macTableCapacity, int macTableSize) {
        this.hostname = Objects.requireNonNull(hostname, "hostname");
        this.ip = Objects.requireNonNull(ip, "ip");
        this.vendor = Objects.requireNonNull(vendor, "vendor");
        this.role = role;
        this.datacenter = Objects.requireNonNull(datacenter, "datacenter");
        this.room = Objects.requireNonNull(room, "room");
        this.rack = Objects.requireNonNull(rack, "rack");
        this.systemDescription = systemDescription;
        this.uptimeAtStartSeconds = uptimeAtStartSeconds;
        this.macTableCapacity = macTableCapacity;
        this.macTableSize = macTableSize;
    }

    public String getHostname() { return hostname; }
    public String getIp() { return ip; }
    public String getVendor() { return vendor; }
    public String getRole() { return role; }
    public String getDatacenter() { return datacenter; }
    public String getRoom() { return room; }
    public String getRack() { return rack; }
    public String getSystemDescription() { return systemDescription; }
    public long getUptimeAtStartSeconds() { return uptimeAtStartSeconds; }
    public int getMacTableCapacity() { return macTableCapacity; }
    public int getMacTableSize() { return macTableSize; }

    @Override
    public String toString() {
        return "Device{hostname='" + hostname + "', ip='" + ip + "', vendor='" + vendor
                + "', placement=" + datacenter + "/" + room + "/" + rack + "}";
    }
}
