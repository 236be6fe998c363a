package com.signalplatform.signal.controller;

import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.Verdict;
import com.signalplatform.common.model.payload.PredictionMarketContext;
import com.signalplatform.common.odds.OddsAssessment;
import com.signalplatform.signal.cache.CacheState;
import com.signalplatform.signal.cache.ReadCache;
import com.signalplatform.signal.controller.dto.BetSuggestionResponse;
import com.signalplatform.signal.controller.dto.BetSuggestionResponse.Recommendation;
import com.signalplatform.signal.controller.dto.DashboardResponse;
import com.signalplatform.signal.controller.dto.DerivativesResponse;
import com.signalplatform.signal.controller.dto.HealthResponse;
import com.signalplatform.signal.controller.dto.HistoryResponse;
import com.signalplatform.signal.controller.dto.LatestSignalResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Read-only API over the published refresh state. No handler fetches from a source; every
 * response reflects the last completed cycle.
 *
 * <p>Before the first cycle completes, {@link ReadCache#get()} throws and
 * {@link ApiExceptionHandler} answers 503. {@code /history} and {@code /health} are the
 * exceptions.
 */
@RestController
@RequestMapping("/api/v1/signal")
public class SignalController {

    private static final Logger log = LoggerFactory.getLogger(SignalController.class);

    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final ReadCache readCache;
    private final Clock clock;

    public SignalController(ReadCache readCache, Clock clock) {
        this.readCache = readCache;
        this.clock     = clock;
    }

    @GetMapping("/dashboard")
    public Mono<ResponseEntity<DashboardResponse>> dashboard() {
        return Mono.fromSupplier(readCache::get)
            .map(state -> new DashboardResponse(state, state.ageSeconds(clock.instant())))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<LatestSignalResponse>> latest() {
        return Mono.fromSupplier(readCache::get)
            .map(state -> new LatestSignalResponse(
                state.btcPrice(),
                state.verdict(),
                state.verdict().contributingSignals(),
                state.odds(),
                state.lastUpdated()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<HistoryResponse>> history(
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        log.debug("History query received. limit={}", limit);
        return Mono.fromSupplier(() -> HistoryResponse.of(readCache.getHistory(limit)))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/sources/{kind}")
    public Mono<ResponseEntity<SourceSnapshot>> source(@PathVariable("kind") String kind) {
        return Mono.fromSupplier(() -> SourceKind.fromKey(kind))
            .flatMap(sourceKind -> Mono.justOrEmpty(readCache.get().snapshot(sourceKind)))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/derivatives")
    public Mono<ResponseEntity<DerivativesResponse>> derivatives() {
        return Mono.fromSupplier(readCache::get)
            .map(state -> new DerivativesResponse(
                state.snapshots().get(SourceKind.FUNDING_RATE),
                state.snapshots().get(SourceKind.OPEN_INTEREST),
                state.snapshots().get(SourceKind.LONG_SHORT_RATIO),
                state.snapshots().get(SourceKind.LIQUIDATIONS),
                state.lastUpdated()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/bet-suggestion")
    public Mono<ResponseEntity<BetSuggestionResponse>> betSuggestion() {
        return Mono.fromSupplier(readCache::get)
            .map(SignalController::suggest)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return readCache.current()
            .map(state -> ResponseEntity.ok(new HealthResponse(
                HealthResponse.UP,
                state.lastUpdated(),
                state.ageSeconds(clock.instant()),
                state.cycle())))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthResponse.starting()));
    }

    static BetSuggestionResponse suggest(CacheState state) {
        Verdict verdict = state.verdict();
        OddsAssessment odds = state.odds();
        String market = state.payload(SourceKind.PREDICTION_MARKET, PredictionMarketContext.class)
            .map(PredictionMarketContext::question)
            .orElse(null);

        Recommendation recommendation;
        String reason;
        if (!verdict.direction().isDirectional()) {
            recommendation = Recommendation.NO_BET;
            reason = verdict.insufficientData() ? "Insufficient data" : "Signals are mixed - sit this window out";
        } else if (!odds.hasValue()) {
            recommendation = Recommendation.NO_BET;
            reason = odds.detail();
        } else {
            recommendation = Recommendation.RECOMMEND;
            reason = "Bet " + verdict.direction() + ": " + odds.detail();
        }

        return new BetSuggestionResponse(
            verdict.direction(),
            verdict.confidence(),
            verdict.upCount(),
            verdict.downCount(),
            market,
            odds,
            recommendation,
            reason);
    }
}
