package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One past verdict together with the BTC price seen in the same cycle ({@code null} when the
 * price source failed).
 */
public record HistoryEntry(
    @JsonProperty("verdict")        Verdict verdict,
    @JsonProperty("btcPriceAtTime") Double btcPriceAtTime
) {
    public HistoryEntry {
        Objects.requireNonNull(verdict, "verdict");
    }
}
