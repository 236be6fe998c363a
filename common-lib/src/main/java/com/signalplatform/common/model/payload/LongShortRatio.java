package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

import java.util.List;

/**
 * Long/short account ratio; history is newest first.
 */
public record LongShortRatio(
    Double currentRatio,
    List<Point> history
) implements SnapshotPayload {

    public LongShortRatio {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public record Point(long timestamp, double ratio) {}
}
