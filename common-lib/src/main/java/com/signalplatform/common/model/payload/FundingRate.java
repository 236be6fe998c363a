package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

import java.util.List;

/**
 * Perpetual-swap funding rate per 8h settlement. {@code currentRate} is {@code null} when the
 * venue answered without a current rate.
 */
public record FundingRate(
    String instrument,
    Double currentRate,
    Long nextFundingTime,
    List<Settlement> recentRates
) implements SnapshotPayload {

    public FundingRate {
        recentRates = recentRates == null ? List.of() : List.copyOf(recentRates);
    }

    public record Settlement(double rate, long time) {}
}
