package com.netsim.telemetry.datagen.fault;

import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.fault.FaultKind;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Decides whether a (module_id, timestamp) pair is anomalous.
 *
 * HOW DECISIONS ARE SHARED ACROSS TABLES:
 *   Timestamps are grouped into 5-minute buckets. The random draws for a
 *   (module_id, bucket) pair are a pure function of the run seed, the key and
 *   the bucket, so gRPC, SNMP, syslog and DDM all see the same fault for the
 *   same key and bucket, whichever worker asks first. Draws are memoized in a
 *   small LRU; the configured ratio is applied at decide time, so one cache
 *   serves any ratio.
 *
 * A bucket is anomalous when its first draw falls below the fault ratio. The
 * kind is drawn by weight among the kinds that apply to the interface (optical
 * kinds only where a module is seated); severity is uniform in the kind's range.
 *
 * Thread-safe: the only mutable state is the synchronized cache.
 */
public class FaultInjector {

    public static final int BUCKET_SECONDS = 300;
    private static final int CACHE_SIZE = 65_536;

    private static final List<FaultKind> ALL_KINDS = anomalyKinds(true);
    private static final List<FaultKind> ELECTRICAL_KINDS = anomalyKinds(false);

    private final long seed;
    private final Topology topology;
    private final Map<BucketKey, Draws> cache = Collections.synchronizedMap(
            new LinkedHashMap<>(1_024, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<BucketKey, Draws> eldest) {
                    return size() > CACHE_SIZE;
                }
            });

    public FaultInjector(long seed, Topology topology) {
        this.seed = seed;
        this.topology = topology;
    }

    public static double validateRatio(double faultRatio) {
        if (Double.isNaN(faultRatio) || faultRatio < 0.0 || faultRatio > 1.0) {
            throw new ConfigurationException("faultRatio", "must be in [0, 1], was " + faultRatio);
        }
        return faultRatio;
    }

    public static long bucketOf(LocalDateTime timestamp) {
        return Math.floorDiv(timestamp.toEpochSecond(ZoneOffset.UTC), BUCKET_SECONDS);
    }

    public FaultState decide(String moduleId, LocalDateTime timestamp, double faultRatio) {
        return decide(topology.getInterface(moduleId), timestamp, faultRatio);
    }

    public FaultState decide(DeviceInterface iface, LocalDateTime timestamp, double faultRatio) {
        validateRatio(faultRatio);
        if (faultRatio == 0.0) {
            return FaultState.NORMAL;
        }
        BucketKey key = new BucketKey(iface.getModuleId(), bucketOf(timestamp));
        Draws draws = cache.computeIfAbsent(key, this::draw);
        if (draws.trigger >= faultRatio) {
            return FaultState.NORMAL;
        }
        FaultKind kind = pickKind(iface.hasModule() ? ALL_KINDS : ELECTRICAL_KINDS, draws.kindRoll);
        double severity = kind.getMinSeverity() + draws.severityRoll * (kind.getMaxSeverity() - kind.getMinSeverity());
        return FaultState.of(kind, Math.max(severity, 0.01));
    }

    int cachedBuckets() {
        return cache.size();
    }

    // ===== DRAWS =====

    private Draws draw(BucketKey key) {
        SplittableRandom rng = new SplittableRandom(bucketSeed(seed, key.moduleId, key.bucket));
        return new Draws(rng.nextDouble(), rng.nextDouble(), rng.nextDouble());
    }

    static long bucketSeed(long seed, String moduleId, long bucket) {
        long mixed = seed;
        mixed = mixed * 0x9E3779B97F4A7C15L + moduleIdHash(moduleId);
        mixed = mixed * 0xC2B2AE3D27D4EB4FL + bucket;
        return mixed;
    }

    /** 64-bit FNV-1a over the UTF-8 bytes of the module_id. */
    static long moduleIdHash(String moduleId) {
        long hash = 0xCBF29CE484222325L;
        for (byte b : moduleId.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xFF;
            hash *= 0x100000001B3L;
        }
        return hash;
    }

    private static FaultKind pickKind(List<FaultKind> kinds, double roll) {
        int total = 0;
        for (FaultKind kind : kinds) {
            total += kind.getWeight();
        }
        double target = roll * total;
        for (FaultKind kind : kinds) {
            target -= kind.getWeight();
            if (target < 0) {
                return kind;
            }
        }
        return kinds.get(kinds.size() - 1);
    }

    private static List<FaultKind> anomalyKinds(boolean includeOptical) {
        List<FaultKind> kinds = new ArrayList<>();
        for (FaultKind kind : FaultKind.values()) {
            if (kind != FaultKind.NONE && (includeOptical || !kind.isOptical())) {
                kinds.add(kind);
            }
        }
        return List.copyOf(kinds);
    }

    private static final class BucketKey {
        private final String moduleId;
        private final long bucket;

        BucketKey(String moduleId, long bucket) {
            this.moduleId = moduleId;
            this.bucket = bucket;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BucketKey)) return false;
            BucketKey other = (BucketKey) o;
            return bucket == other.bucket && moduleId.equals(other.moduleId);
        }

        @Override
        public int hashCode() {
            return 31 * moduleId.hashCode() + Long.hashCode(bucket);
        }
    }

    private static final class Draws {
        private final double trigger;
        private final double kindRoll;
        private final double severityRoll;

        Draws(double trigger, double kindRoll, double severityRoll) {
            this.trigger = trigger;
            this.kindRoll = kindRoll;
            this.severityRoll = severityRoll;
        }
    }
}
