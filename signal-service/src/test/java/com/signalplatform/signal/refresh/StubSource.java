package com.signalplatform.signal.refresh;

import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.marketdata.source.SourceClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Source client answering from a supplier; counts how often it was asked. */
final class StubSource<P extends SnapshotPayload> implements SourceClient<P> {

    private final SourceKind kind;
    private final Supplier<Mono<P>> answer;
    private final AtomicInteger calls = new AtomicInteger();

    private StubSource(SourceKind kind, Supplier<Mono<P>> answer) {
        this.kind   = kind;
        this.answer = answer;
    }

    static <P extends SnapshotPayload> StubSource<P> of(SourceKind kind, P payload) {
        return new StubSource<>(kind, () -> Mono.just(payload));
    }

    static <P extends SnapshotPayload> StubSource<P> answering(SourceKind kind, Supplier<Mono<P>> answer) {
        return new StubSource<>(kind, answer);
    }

    static StubSource<SnapshotPayload> failing(SourceKind kind, Throwable error) {
        return new StubSource<>(kind, () -> Mono.error(error));
    }

    static StubSource<SnapshotPayload> hanging(SourceKind kind) {
        return new StubSource<>(kind, Mono::never);
    }

    @Override
    public SourceKind kind() {
        return kind;
    }

    @Override
    public Mono<P> fetch() {
        calls.incrementAndGet();
        return answer.get();
    }

    int calls() {
        return calls.get();
    }
}
