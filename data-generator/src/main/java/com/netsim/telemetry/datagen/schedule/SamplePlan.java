package com.netsim.telemetry.datagen.schedule;

import com.netsim.telemetry.shared.model.request.DateRange;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;

import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A lazy, restartable sequence of (key, timestamp) samples.
 *
 * Keys are visited round-robin: sample 0 of every key, then sample 1 of every
 * key that has one, and so on, so output never dwells on one device. Within a
 * key timestamps strictly increase. Every call to {@link #iterator()} starts a
 * fresh pass that yields exactly the same order; callers may stop pulling at
 * any point.
 *
 * Only the key list, one phase offset per key and a few counters are held;
 * nothing scales with the requested row count.
 */
public final class SamplePlan implements Iterable<ScheduledSample> {

    private final DateRange range;
    private final List<DeviceInterface> keys;
    private final long baseRowsPerKey;
    private final int keysWithExtraRow;
    private final long totalRows;
    private final int granularitySeconds;
    private final boolean dense;
    private final int[] phases;

    SamplePlan(DateRange range, List<DeviceInterface> keys, long totalRows,
               int granularitySeconds, boolean dense, int[] phases) {
        this.range = range;
        this.keys = List.copyOf(keys);
        this.totalRows = totalRows;
        this.baseRowsPerKey = keys.isEmpty() ? 0 : totalRows / keys.size();
        this.keysWithExtraRow = keys.isEmpty() ? 0 : (int) (totalRows % keys.size());
        this.granularitySeconds = granularitySeconds;
        this.dense = dense;
        this.phases = phases;
    }

    public long getTotalRows() { return totalRows; }

    public int getKeyCount() { return keys.size(); }

    public List<DeviceInterface> getKeys() { return keys; }

    public int getGranularitySeconds() { return granularitySeconds; }

    /** True when samples are spaced at whole seconds instead of the native granularity. */
    public boolean isDense() { return dense; }

    /**
     * Rows assigned to the key at {@code keyIndex}: the even share plus one
     * for each of the first (total mod keys) keys.
     */
    public long rowsForKey(int keyIndex) {
        return baseRowsPerKey + (keyIndex < keysWithExtraRow ? 1 : 0);
    }

    /**
     * Timestamp of the {@code sampleIndex}-th sample of a key. Samples spread
     * evenly across the range: native slots are chosen proportionally and
     * shifted by the key's phase, or, in dense mode, seconds are.
     */
    LocalDateTime timestampOf(int keyIndex, long sampleIndex) {
        long n = rowsForKey(keyIndex);
        long seconds = range.getSeconds();
        long offset;
        if (dense) {
            offset = Math.floorDiv(Math.multiplyExact(sampleIndex, seconds), n);
        } else {
            long slots = seconds / granularitySeconds;
            long slot = Math.floorDiv(Math.multiplyExact(sampleIndex, slots), n);
            offset = slot * granularitySeconds + phases[keyIndex];
        }
        return range.getStart().plusSeconds(offset);
    }

    @Override
    public Iterator<ScheduledSample> iterator() {
        return new Iterator<>() {
            private long round = 0;
            private int keyIndex = 0;
            private long emitted = 0;

            @Override
            public boolean hasNext() {
                return emitted < totalRows;
            }

            @Override
            public ScheduledSample next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                // Keys beyond the remainder have no sample in the last round.
                if (rowsForKey(keyIndex) <= round) {
                    keyIndex = 0;
                    round++;
                }
                ScheduledSample sample = new ScheduledSample(keys.get(keyIndex), timestampOf(keyIndex, round), emitted);
                emitted++;
                keyIndex++;
                if (keyIndex == keys.size()) {
                    keyIndex = 0;
                    round++;
                }
                return sample;
            }
        };
    }

    @Override
    public String toString() {
        return "SamplePlan{rows=" + totalRows + ", keys=" + keys.size() + ", granularity="
                + granularitySeconds + "s, dense=" + dense + ", range=" + range + "}";
    }
}
