package com.signalplatform.signal.logger;

import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.Verdict;
import com.signalplatform.common.trace.TraceContextUtil;
import com.signalplatform.signal.cache.CacheState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a refresh cycle. Pure side effects; never changes pipeline behavior.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REFRESH_STARTED}: the scheduler started a cycle</li>
 *   <li>{@link #SOURCE_FETCHED} / {@link #SOURCE_FAILED}: one per source</li>
 *   <li>{@link #VERDICT_COMPUTED}: evaluators and decision engine ran</li>
 *   <li>{@link #CACHE_PUBLISHED}: new state visible to readers</li>
 * </ol>
 * plus {@link #REFRESH_SKIPPED_OVERLAP} and {@link #REFRESH_FAILED} outside the normal path.
 *
 * <p>The cycle id is read from the Reactor Context inside pipelines and bridged into MDC only
 * for the duration of each log call.
 */
@Component
public class RefreshFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RefreshFlowLogger.class);

    public static final String REFRESH_STARTED         = "REFRESH_STARTED";
    public static final String SOURCE_FETCHED          = "SOURCE_FETCHED";
    public static final String SOURCE_FAILED           = "SOURCE_FAILED";
    public static final String VERDICT_COMPUTED        = "VERDICT_COMPUTED";
    public static final String CACHE_PUBLISHED         = "CACHE_PUBLISHED";
    public static final String REFRESH_SKIPPED_OVERLAP = "REFRESH_SKIPPED_OVERLAP";
    public static final String REFRESH_FAILED          = "REFRESH_FAILED";

    public void refreshStarted(String cycleId, long cycle, int sources) {
        TraceContextUtil.withMdc(cycleId, () ->
            log.info("{} cycle={} sources={} cycleId={}", REFRESH_STARTED, cycle, sources, cycleId)
        );
    }

    /**
     * Returns a {@code doOnEach} consumer logging each snapshot as it arrives. Successful fetches
     * log at INFO, failures at WARN with the failure reason.
     */
    public Consumer<Signal<SourceSnapshot>> sourceOutcome() {
        return signal -> {
            if (!signal.isOnNext()) return;
            SourceSnapshot snapshot = signal.get();
            String cycleId = TraceContextUtil.getCycleId(signal.getContextView());
            TraceContextUtil.withMdc(cycleId, () -> {
                if (snapshot instanceof SourceSnapshot.Failed failed) {
                    log.warn("{} source={} reason={} detail={} cycleId={}",
                             SOURCE_FAILED, failed.kind().key(), failed.reason(), failed.detail(), cycleId);
                } else {
                    log.info("{} source={} cycleId={}", SOURCE_FETCHED, snapshot.kind().key(), cycleId);
                }
            });
        };
    }

    public void verdictComputed(String cycleId, Verdict verdict) {
        TraceContextUtil.withMdc(cycleId, () ->
            log.info("{} direction={} confidence={} normalizedScore={} availableWeight={} "
                     + "up={} down={} neutral={} insufficientData={} cycleId={}",
                     VERDICT_COMPUTED, verdict.direction(),
                     String.format(java.util.Locale.ROOT, "%.3f", verdict.confidence()),
                     String.format(java.util.Locale.ROOT, "%.4f", verdict.normalizedScore()),
                     verdict.totalAvailableWeight(),
                     verdict.upCount(), verdict.downCount(), verdict.neutralCount(),
                     verdict.insufficientData(), cycleId)
        );
    }

    public void cachePublished(CacheState state) {
        long failed = state.snapshots().values().stream().filter(s -> !s.isOk()).count();
        TraceContextUtil.withMdc(state.cycleId(), () ->
            log.info("{} cycle={} btcPrice={} failedSources={} cycleId={}",
                     CACHE_PUBLISHED, state.cycle(), state.btcPrice(), failed, state.cycleId())
        );
    }

    public void refreshSkipped(long tick) {
        log.warn("{} tick={} reason=previous cycle still running", REFRESH_SKIPPED_OVERLAP, tick);
    }

    public void refreshFailed(String cycleId, Throwable error) {
        TraceContextUtil.withMdc(cycleId, () ->
            log.error("{} cycleId={} keeping previous state", REFRESH_FAILED, cycleId, error)
        );
    }
}
