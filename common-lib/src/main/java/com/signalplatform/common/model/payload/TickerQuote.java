package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

public record TickerQuote(
    String pair,
    double lastPrice
) implements SnapshotPayload {}
