package com.signalplatform.signal.refresh;

import com.signalplatform.common.decision.DecisionEngine;
import com.signalplatform.common.evaluator.SubSignalEvaluator;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.history.HistoryLog;
import com.signalplatform.common.model.FetchFailure;
import com.signalplatform.common.model.HistoryEntry;
import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.Verdict;
import com.signalplatform.common.model.payload.PredictionMarketContext;
import com.signalplatform.common.model.payload.TickerQuote;
import com.signalplatform.common.odds.OddsAssessment;
import com.signalplatform.common.odds.OddsValueAssessor;
import com.signalplatform.common.trace.TraceContextUtil;
import com.signalplatform.marketdata.source.SourceClient;
import com.signalplatform.signal.cache.CacheState;
import com.signalplatform.signal.cache.ReadCache;
import com.signalplatform.signal.logger.RefreshFlowLogger;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one refresh cycle end to end:
 * <pre>
 *   fetch all sources concurrently (each bounded by sourceTimeout)
 *     → evaluate sub-signals → decide → assess odds
 *     → publish CacheState → append history
 * </pre>
 *
 * <p>Every source ends the fetch stage as a {@link SourceSnapshot}: a timeout, transport error
 * or unreadable payload becomes a {@code Failed} snapshot and never aborts the cycle. An
 * unexpected error after the fetch stage is logged and the previously published state stays
 * in place.
 *
 * <p>Called by {@link RefreshScheduler}, which guarantees at most one cycle at a time.
 */
@Component
public class RefreshCoordinator {

    private final List<SourceClient<?>> clients;
    private final List<SubSignalEvaluator> evaluators;
    private final DecisionEngine decisionEngine;
    private final OddsValueAssessor oddsAssessor;
    private final ReadCache readCache;
    private final HistoryLog historyLog;
    private final RefreshFlowLogger flowLogger;
    private final RefreshSettings settings;
    private final Clock clock;

    private final AtomicLong cycleCounter = new AtomicLong();

    public RefreshCoordinator(List<SourceClient<?>> clients,
                              List<SubSignalEvaluator> evaluators,
                              DecisionEngine decisionEngine,
                              OddsValueAssessor oddsAssessor,
                              ReadCache readCache,
                              HistoryLog historyLog,
                              RefreshFlowLogger flowLogger,
                              RefreshSettings settings,
                              Clock clock) {
        this.clients        = List.copyOf(clients);
        this.evaluators     = List.copyOf(evaluators);
        this.decisionEngine = decisionEngine;
        this.oddsAssessor   = oddsAssessor;
        this.readCache      = readCache;
        this.historyLog     = historyLog;
        this.flowLogger     = flowLogger;
        this.settings       = settings;
        this.clock          = clock;
        requireDistinctKinds(this.clients);
    }

    /**
     * Runs one cycle. Emits the published state, or completes empty when the cycle failed and
     * the previous state was kept. Never errors.
     */
    public Mono<CacheState> runCycle() {
        long cycle = cycleCounter.incrementAndGet();
        String cycleId = "cycle-" + cycle + "-" + Long.toHexString(clock.millis());

        Mono<CacheState> pipeline = Mono.defer(() -> {
                flowLogger.refreshStarted(cycleId, cycle, clients.size());
                return fetchAll();
            })
            .map(snapshots -> assemble(cycle, cycleId, snapshots))
            .doOnNext(this::publish)
            .onErrorResume(e -> {
                flowLogger.refreshFailed(cycleId, e);
                return Mono.empty();
            });

        return TraceContextUtil.withCycleId(pipeline, cycleId);
    }

    /** Latest cycle number handed out; 0 before the first cycle. */
    public long lastCycle() {
        return cycleCounter.get();
    }

    // ── fetch stage ──────────────────────────────────────────────────────────

    private Mono<Map<SourceKind, SourceSnapshot>> fetchAll() {
        return Flux.fromIterable(clients)
            .flatMap(this::fetchSnapshot, Math.max(1, clients.size()))
            .doOnEach(flowLogger.sourceOutcome())
            .collectMap(SourceSnapshot::kind, s -> s, () -> new EnumMap<>(SourceKind.class));
    }

    /** Always emits exactly one snapshot for the client. */
    private Mono<SourceSnapshot> fetchSnapshot(SourceClient<?> client) {
        SourceKind kind = client.kind();
        return Mono.defer(client::fetch)
            .timeout(settings.sourceTimeout())
            .<SourceSnapshot>map(payload -> SourceSnapshot.ok(kind, payload, clock.instant()))
            .switchIfEmpty(Mono.fromSupplier(() ->
                SourceSnapshot.failed(kind, FetchFailure.MALFORMED_PAYLOAD, "Source returned no payload", clock.instant())))
            .onErrorResume(e -> Mono.just(toFailure(kind, e)));
    }

    private SourceSnapshot toFailure(SourceKind kind, Throwable e) {
        Instant now = clock.instant();
        if (e instanceof TimeoutException) {
            return SourceSnapshot.failed(kind, FetchFailure.TIMEOUT,
                "No response within " + settings.sourceTimeout().toMillis() + "ms", now);
        }
        if (e instanceof SourceFetchException sfe) {
            return SourceSnapshot.failed(kind, sfe.getReason(), sfe.getMessage(), now);
        }
        return SourceSnapshot.failed(kind, FetchFailure.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage(), now);
    }

    // ── evaluate / decide / publish ──────────────────────────────────────────

    private CacheState assemble(long cycle, String cycleId, Map<SourceKind, SourceSnapshot> snapshots) {
        List<SubSignalResult> results = evaluators.stream()
            .map(e -> e.evaluate(snapshots))
            .flatMap(Optional::stream)
            .toList();

        Instant now = clock.instant();
        Verdict verdict = decisionEngine.decide(results, now);
        flowLogger.verdictComputed(cycleId, verdict);

        Double btcPrice = payload(snapshots, SourceKind.PRICE_TICKER, TickerQuote.class)
            .map(TickerQuote::lastPrice)
            .orElse(null);
        PredictionMarketContext market = payload(snapshots, SourceKind.PREDICTION_MARKET, PredictionMarketContext.class)
            .orElse(null);
        OddsAssessment odds = oddsAssessor.assess(market, verdict.direction());

        return new CacheState(cycle, cycleId, verdict, snapshots, btcPrice, odds, now);
    }

    private void publish(CacheState state) {
        readCache.publish(state);
        historyLog.append(new HistoryEntry(state.verdict(), state.btcPrice()));
        flowLogger.cachePublished(state);
    }

    private static <P extends SnapshotPayload> Optional<P> payload(
            Map<SourceKind, SourceSnapshot> snapshots, SourceKind kind, Class<P> type) {
        return Optional.ofNullable(snapshots.get(kind)).flatMap(s -> s.payloadAs(type));
    }

    private static void requireDistinctKinds(List<SourceClient<?>> clients) {
        Set<SourceKind> seen = EnumSet.noneOf(SourceKind.class);
        for (SourceClient<?> client : clients) {
            if (!seen.add(client.kind())) {
                throw new IllegalArgumentException("More than one source client for " + client.kind());
            }
        }
    }
}
