package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One evaluator's vote for one cycle.
 *
 * <p>Invariants enforced at construction:
 * <ul>
 *   <li>{@code strength} in [0, 1]</li>
 *   <li>{@code weight} finite and &ge; 0</li>
 *   <li>{@code direction == NEUTRAL} exactly when {@code strength == 0}</li>
 * </ul>
 */
public record SubSignalResult(
    @JsonProperty("signal")      SignalKind signal,
    @JsonProperty("direction")   SignalDirection direction,
    @JsonProperty("strength")    double strength,
    @JsonProperty("weight")      double weight,
    @JsonProperty("explanation") String explanation
) {

    public SubSignalResult {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(direction, "direction");
        if (Double.isNaN(strength) || strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("strength must be in [0,1], was " + strength + " for " + signal);
        }
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("weight must be finite and >= 0, was " + weight + " for " + signal);
        }
        if ((direction == SignalDirection.NEUTRAL) != (strength == 0.0)) {
            throw new IllegalArgumentException(
                "NEUTRAL must carry strength 0 and a directional vote a positive strength: "
                + signal + " " + direction + " " + strength);
        }
        explanation = explanation == null ? "" : explanation;
    }

    public static SubSignalResult neutral(SignalKind signal, double weight, String explanation) {
        return new SubSignalResult(signal, SignalDirection.NEUTRAL, 0.0, weight, explanation);
    }

    /**
     * Directional vote; a strength that rounds to zero degrades to a NEUTRAL vote.
     */
    public static SubSignalResult vote(SignalKind signal, SignalDirection direction,
                                       double strength, double weight, String explanation) {
        double clamped = Math.max(0.0, Math.min(1.0, strength));
        if (clamped == 0.0 || direction == SignalDirection.NEUTRAL) {
            return neutral(signal, weight, explanation);
        }
        return new SubSignalResult(signal, direction, clamped, weight, explanation);
    }

    @JsonProperty("sourceName")
    public String sourceName() {
        return signal.sourceName();
    }

    /** weight × strength × sign(direction). */
    public double contribution() {
        return weight * strength * direction.sign();
    }
}
