package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.DdmMetricRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the last {@code capacity} DDM observations per module_id, fed in
 * emission order by the pass that generates DDM rows.
 */
public class BoundedDdmHistory implements DdmHistoryView {

    public static final int DEFAULT_CAPACITY = 12;

    private final int capacity;
    private final Map<String, Deque<DdmObservation>> byModule = new HashMap<>();

    public BoundedDdmHistory() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedDdmHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void record(DdmMetricRecord row, FaultState fault) {
        Deque<DdmObservation> window = byModule.computeIfAbsent(row.getModuleId(), k -> new ArrayDeque<>(capacity));
        if (window.size() == capacity) {
            window.removeFirst();
        }
        window.addLast(new DdmObservation(row.getTimestamp(), fault.getSeverity(), row.alarmCount()));
    }

    @Override
    public List<DdmObservation> recent(String moduleId) {
        Deque<DdmObservation> window = byModule.get(moduleId);
        return window == null ? List.of() : List.copyOf(window);
    }
}
