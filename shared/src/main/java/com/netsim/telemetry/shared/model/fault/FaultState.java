package com.netsim.telemetry.shared.model.fault;

import java.util.Objects;

/**
 * Fault decision for one (module_id, time bucket): either {@link #NORMAL} or an
 * anomaly kind with a severity in (0, 1]. Never persisted on its own; it only
 * parametrizes the values a synthesizer produces.
 */
public final class FaultState {

    public static final FaultState NORMAL = new FaultState(FaultKind.NONE, 0.0);

    private final FaultKind kind;
    private final double severity;

    private FaultState(FaultKind kind, double severity) {
        this.kind = kind;
        this.severity = severity;
    }

    public static FaultState of(FaultKind kind, double severity) {
        Objects.requireNonNull(kind, "kind");
        if (kind == FaultKind.NONE) {
            return NORMAL;
        }
        if (!(severity > 0.0 && severity <= 1.0)) {
            throw new IllegalArgumentException("severity must be in (0, 1]: " + severity);
        }
        return new FaultState(kind, severity);
    }

    public FaultKind getKind() { return kind; }

    public double getSeverity() { return severity; }

    public boolean isAnomalous() {
        return kind != FaultKind.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FaultState)) return false;
        FaultState that = (FaultState) o;
        return kind == that.kind && Double.compare(severity, that.severity) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity);
    }

    @Override
    public String toString() {
        return isAnomalous() ? kind.getLabel() + "(" + String.format("%.2f", severity) + ")" : "normal";
    }
}
