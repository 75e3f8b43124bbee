package com.netsim.telemetry.datagen.synth;

import java.time.LocalDateTime;

/**
 * What the lifecycle model remembers of one DDM row: when it was taken, the
 * fault severity behind it and how many channels were in alarm.
 */
public final class DdmObservation {

    private final LocalDateTime timestamp;
    private final double severity;
    private final int alarmCount;

    public DdmObservation(LocalDateTime timestamp, double severity, int alarmCount) {
        this.timestamp = timestamp;
        this.severity = severity;
        this.alarmCount = alarmCount;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public double getSeverity() { return severity; }
    public int getAlarmCount() { return alarmCount; }
}
