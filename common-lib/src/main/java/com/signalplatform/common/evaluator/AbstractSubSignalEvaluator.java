package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalDirection;
import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.SubSignalResult;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unwraps the snapshot of the evaluator's source and hands a typed payload to {@link #assess}.
 * Failed, missing or mistyped snapshots yield an empty result, and so does a payload that
 * carries no measurement ({@link #noData()}): the source answered but had nothing to vote on.
 *
 * @param <P> payload type read by the evaluator
 */
public abstract class AbstractSubSignalEvaluator<P extends SnapshotPayload> implements SubSignalEvaluator {

    private final SignalKind signal;
    private final Class<P> payloadType;
    private final double weight;

    protected AbstractSubSignalEvaluator(SignalKind signal, Class<P> payloadType, double weight) {
        this.signal      = Objects.requireNonNull(signal, "signal");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("weight must be finite and >= 0, was " + weight);
        }
        this.weight = weight;
    }

    @Override
    public final SignalKind signal() {
        return signal;
    }

    @Override
    public final double weight() {
        return weight;
    }

    @Override
    public final Optional<SubSignalResult> evaluate(Map<SourceKind, SourceSnapshot> snapshots) {
        if (snapshots == null) {
            return Optional.empty();
        }
        SourceSnapshot snapshot = snapshots.get(signal.source());
        if (snapshot == null) {
            return Optional.empty();
        }
        return snapshot.payloadAs(payloadType).flatMap(this::assess);
    }

    protected abstract Optional<SubSignalResult> assess(P payload);

    protected Optional<SubSignalResult> up(double strength, String explanation) {
        return Optional.of(SubSignalResult.vote(signal, SignalDirection.UP, strength, weight, explanation));
    }

    protected Optional<SubSignalResult> down(double strength, String explanation) {
        return Optional.of(SubSignalResult.vote(signal, SignalDirection.DOWN, strength, weight, explanation));
    }

    protected Optional<SubSignalResult> neutral(String explanation) {
        return Optional.of(SubSignalResult.neutral(signal, weight, explanation));
    }

    /** The payload holds no measurement; the signal is left out like a failed source. */
    protected Optional<SubSignalResult> noData() {
        return Optional.empty();
    }

    protected static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
