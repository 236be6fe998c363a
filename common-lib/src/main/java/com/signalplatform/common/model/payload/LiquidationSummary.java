package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

import java.util.List;

/**
 * Recent filled liquidations split by position side, valued in USD (bankruptcy price × size).
 * {@code recentEvents} is newest first.
 */
public record LiquidationSummary(
    double longLiquidationUsd,
    double shortLiquidationUsd,
    int longCount,
    int shortCount,
    double totalUsd,
    List<Event> recentEvents
) implements SnapshotPayload {

    public LiquidationSummary {
        recentEvents = recentEvents == null ? List.of() : List.copyOf(recentEvents);
    }

    public record Event(String side, double price, double sizeBtc, double valueUsd, long time) {}
}
