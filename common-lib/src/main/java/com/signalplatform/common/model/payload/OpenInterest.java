package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

public record OpenInterest(
    String instrument,
    double contracts,
    double btc,
    long timestamp
) implements SnapshotPayload {}
