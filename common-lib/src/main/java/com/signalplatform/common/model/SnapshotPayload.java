package com.signalplatform.common.model;

/**
 * Marker for the immutable, source-specific body carried by {@link SourceSnapshot.Ok}.
 */
public interface SnapshotPayload {
}
