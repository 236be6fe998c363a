package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable output of one decision-engine run.
 *
 * <p>{@code contributingSignals} is in canonical {@link SignalKind} order and unmodifiable.
 * {@code insufficientData} is set only when no signal carried weight; such a verdict is
 * always SKIP with confidence 0.
 */
public record Verdict(
    @JsonProperty("direction")            VerdictDirection direction,
    @JsonProperty("confidence")           double confidence,
    @JsonProperty("weightedScore")        double weightedScore,
    @JsonProperty("normalizedScore")      double normalizedScore,
    @JsonProperty("totalAvailableWeight") double totalAvailableWeight,
    @JsonProperty("contributingSignals")  List<SubSignalResult> contributingSignals,
    @JsonProperty("upCount")              int upCount,
    @JsonProperty("downCount")            int downCount,
    @JsonProperty("neutralCount")         int neutralCount,
    @JsonProperty("insufficientData")     boolean insufficientData,
    @JsonProperty("timestamp")            Instant timestamp
) {

    public Verdict {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(timestamp, "timestamp");
        contributingSignals = contributingSignals == null ? List.of() : List.copyOf(contributingSignals);
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0,1], was " + confidence);
        }
        if (insufficientData && (direction != VerdictDirection.SKIP || confidence != 0.0)) {
            throw new IllegalArgumentException("insufficient-data verdict must be SKIP with confidence 0");
        }
    }

    /** Number of signals that produced a vote this cycle (failed sources excluded). */
    @JsonProperty("availableSignals")
    public int availableSignals() {
        return contributingSignals.size();
    }
}
