package com.netsim.telemetry.datagen.schedule;

import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.request.DateRange;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Turns a date range and a row target into a {@link SamplePlan}.
 *
 * DISTRIBUTION:
 *   With K keys and V rows every key gets V / K samples and the first V mod K
 *   keys (topology order) get one more.
 *
 * SPACING:
 *   Samples sit on the table's native grid (gNMI 60 s, SNMP 300 s, ...) with a
 *   per-key phase inside one grid step. A key that needs more samples than the
 *   grid offers is spaced at whole seconds instead; when even that is not
 *   enough the request is rejected.
 *
 * All checks run when the plan is built, before any row exists.
 */
public class TimeSeriesScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesScheduler.class);

    private final long seed;

    public TimeSeriesScheduler(long seed) {
        this.seed = seed;
    }

    public SamplePlan plan(DateRange range, long targetRows, Topology topology, TableType table) {
        List<DeviceInterface> keys = table.isOpticalOnly() ? topology.getOpticalInterfaces() : topology.getInterfaces();
        return plan(range, targetRows, keys, table.getGranularitySeconds());
    }

    public SamplePlan plan(DateRange range, long targetRows, List<DeviceInterface> keys, int granularitySeconds) {
        if (range == null) {
            throw new ConfigurationException("dateRange", "is required");
        }
        if (targetRows < 0) {
            throw new ConfigurationException("rowsPerTable", "must be >= 0, was " + targetRows);
        }
        if (granularitySeconds <= 0) {
            throw new IllegalArgumentException("granularity must be positive: " + granularitySeconds);
        }
        long seconds = range.getSeconds();
        if (seconds < granularitySeconds) {
            throw new ConfigurationException("dateRange",
                    "range of " + seconds + "s is shorter than the " + granularitySeconds + "s sampling interval");
        }
        if (targetRows > 0 && keys.isEmpty()) {
            throw new ConfigurationException("rowsPerTable", "no eligible interfaces to sample");
        }

        long maxPerKey = keys.isEmpty() ? 0 : (targetRows + keys.size() - 1) / keys.size();
        long nativeSlots = seconds / granularitySeconds;
        boolean dense = maxPerKey > nativeSlots;
        if (maxPerKey > seconds) {
            throw new ConfigurationException("rowsPerTable",
                    targetRows + " rows need " + maxPerKey + " samples per interface but the range only has "
                            + seconds + " seconds");
        }

        int[] phases = new int[keys.size()];
        if (!dense) {
            Random random = new Random(seed);
            for (int i = 0; i < phases.length; i++) {
                phases[i] = random.nextInt(granularitySeconds);
            }
        }

        SamplePlan plan = new SamplePlan(range, keys, targetRows, granularitySeconds, dense, phases);
        if (dense) {
            log.warn("{} rows over {} keys exceed the {}s grid; spacing at 1s", targetRows, keys.size(), granularitySeconds);
        }
        log.debug("Planned {}", plan);
        return plan;
    }
}
