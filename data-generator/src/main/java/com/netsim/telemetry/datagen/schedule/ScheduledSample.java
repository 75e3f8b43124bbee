package com.netsim.telemetry.datagen.schedule;

import com.netsim.telemetry.shared.model.topology.DeviceInterface;

import java.time.LocalDateTime;

/**
 * One (key, timestamp) slot of a sample plan. {@code sequence} is the
 * position in plan order, starting at 0.
 */
public final class ScheduledSample {

    private final DeviceInterface iface;
    private final LocalDateTime timestamp;
    private final long sequence;

    public ScheduledSample(DeviceInterface iface, LocalDateTime timestamp, long sequence) {
        this.iface = iface;
        this.timestamp = timestamp;
        this.sequence = sequence;
    }

    public DeviceInterface getInterface() { return iface; }

    public String getModuleId() { return iface.getModuleId(); }

    public LocalDateTime getTimestamp() { return timestamp; }

    public long getSequence() { return sequence; }

    @Override
    public String toString() {
        return "ScheduledSample{" + iface.getModuleId() + " @ " + timestamp + ", #" + sequence + "}";
    }
}
