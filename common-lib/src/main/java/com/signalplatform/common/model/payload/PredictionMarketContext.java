package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The most relevant active BTC prediction market and its outcome share prices, keyed by
 * outcome label ("Up", "Down", "Yes", ...).
 */
public record PredictionMarketContext(
    String question,
    String endDate,
    String slug,
    Map<String, Outcome> outcomes
) implements SnapshotPayload {

    public PredictionMarketContext {
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    /** Case-insensitive outcome lookup. */
    public Optional<Outcome> outcome(String label) {
        return outcomes.entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase(label))
            .map(Map.Entry::getValue)
            .findFirst();
    }

    /** {@code price} is {@code null} when the market listed fewer prices than outcomes. */
    public record Outcome(String tokenId, Double price) {}
}
