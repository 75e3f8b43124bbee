package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.util.Random;

/**
 * Base for synthesizers that draw from a per-table random stream. The stream
 * is owned by one synthesizer and never shared across workers.
 */
public abstract class SeededRecordSynthesizer<R extends TelemetryRecord> extends AbstractRecordSynthesizer<R> {

    protected final Random random;

    protected SeededRecordSynthesizer(Topology topology, long seed) {
        super(topology);
        this.random = new Random(seed);
    }

    /** Multiplicative jitter around 1.0, never below {@code 1 - spread}. */
    protected double jitter(double spread) {
        return 1.0 + (random.nextDouble() * 2 - 1) * spread;
    }
}
