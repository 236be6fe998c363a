package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one source fetch in one refresh cycle: either an {@link Ok} carrying the payload
 * or a {@link Failed} carrying the reason. Both variants are immutable.
 *
 * <p>Fetch outcomes are collected as values rather than thrown, so a failing source can never
 * short-circuit the rest of the cycle.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SourceSnapshot.Ok.class,     name = "OK"),
    @JsonSubTypes.Type(value = SourceSnapshot.Failed.class, name = "FAILED")
})
public sealed interface SourceSnapshot permits SourceSnapshot.Ok, SourceSnapshot.Failed {

    SourceKind kind();

    @JsonIgnore
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * Returns the payload when this is an {@link Ok} snapshot of the requested type.
     */
    default <P extends SnapshotPayload> Optional<P> payloadAs(Class<P> type) {
        if (this instanceof Ok ok && type.isInstance(ok.payload())) {
            return Optional.of(type.cast(ok.payload()));
        }
        return Optional.empty();
    }

    static Ok ok(SourceKind kind, SnapshotPayload payload, Instant fetchedAt) {
        return new Ok(kind, payload, fetchedAt);
    }

    static Failed failed(SourceKind kind, FetchFailure reason, String detail, Instant attemptedAt) {
        return new Failed(kind, reason, detail, attemptedAt);
    }

    record Ok(SourceKind kind, SnapshotPayload payload, Instant fetchedAt) implements SourceSnapshot {
        public Ok {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(payload, "payload");
            Objects.requireNonNull(fetchedAt, "fetchedAt");
        }
    }

    record Failed(SourceKind kind, FetchFailure reason, String detail, Instant attemptedAt)
            implements SourceSnapshot {
        public Failed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(attemptedAt, "attemptedAt");
            detail = detail == null ? reason.name() : detail;
        }
    }
}
