package com.signalplatform.signal.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.Verdict;
import com.signalplatform.common.odds.OddsAssessment;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one refresh cycle produced, published as a single immutable value.
 *
 * @param cycle        monotonically increasing cycle number, starting at 1
 * @param btcPrice     last BTC price, {@code null} when the ticker source failed
 * @param lastUpdated  when the cycle finished
 */
public record CacheState(
    @JsonProperty("cycle")       long cycle,
    @JsonProperty("cycleId")     String cycleId,
    @JsonProperty("verdict")     Verdict verdict,
    @JsonProperty("sources")     Map<SourceKind, SourceSnapshot> snapshots,
    @JsonProperty("btcPrice")    Double btcPrice,
    @JsonProperty("odds")        OddsAssessment odds,
    @JsonProperty("lastUpdated") Instant lastUpdated
) {

    public CacheState {
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(odds, "odds");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        EnumMap<SourceKind, SourceSnapshot> copy = new EnumMap<>(SourceKind.class);
        if (snapshots != null) {
            copy.putAll(snapshots);
        }
        snapshots = Collections.unmodifiableMap(copy);
    }

    public Optional<SourceSnapshot> snapshot(SourceKind kind) {
        return Optional.ofNullable(snapshots.get(kind));
    }

    /** Payload of {@code kind} when that source succeeded this cycle. */
    public <P extends SnapshotPayload> Optional<P> payload(SourceKind kind, Class<P> type) {
        return snapshot(kind).flatMap(s -> s.payloadAs(type));
    }

    @JsonIgnore
    public long ageSeconds(Instant now) {
        return Math.max(0L, now.getEpochSecond() - lastUpdated.getEpochSecond());
    }
}
