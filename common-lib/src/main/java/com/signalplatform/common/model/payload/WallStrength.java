package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

/**
 * Aggregated order-book volume inside a fixed band around the mid price.
 *
 * <p>{@code wallRatio = bidWallVolume / askWallVolume}; {@link Double#POSITIVE_INFINITY} when
 * the ask side is empty inside the band.
 */
public record WallStrength(
    double bidWallVolume,
    double askWallVolume,
    double wallRatio,
    double midPrice,
    double bandFraction
) implements SnapshotPayload {}
