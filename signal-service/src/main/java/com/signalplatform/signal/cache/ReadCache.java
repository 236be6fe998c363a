package com.signalplatform.signal.cache;

import com.signalplatform.common.exception.CacheUnpopulatedException;
import com.signalplatform.common.history.HistoryLog;
import com.signalplatform.common.model.HistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The last fully published {@link CacheState} plus read access to the verdict history.
 *
 * <p>Written by the refresh coordinator only, read by any number of request handlers. The
 * state is replaced with a single reference swap, so a reader sees either the previous cycle
 * or the new one in full. No read blocks or triggers a fetch.
 */
@Component
public class ReadCache {

    private static final Logger log = LoggerFactory.getLogger(ReadCache.class);

    private final AtomicReference<CacheState> state = new AtomicReference<>();
    private final HistoryLog historyLog;

    public ReadCache(HistoryLog historyLog) {
        this.historyLog = historyLog;
    }

    /**
     * @throws CacheUnpopulatedException before the first cycle has been published
     */
    public CacheState get() {
        CacheState current = state.get();
        if (current == null) {
            throw new CacheUnpopulatedException();
        }
        return current;
    }

    public Optional<CacheState> current() {
        return Optional.ofNullable(state.get());
    }

    public boolean isPopulated() {
        return state.get() != null;
    }

    /** Up to {@code limit} past verdicts, most recent first; empty for {@code limit <= 0}. */
    public List<HistoryEntry> getHistory(int limit) {
        return historyLog.latest(limit);
    }

    /** Replaces the published state. Cycles must be published in order. */
    public void publish(CacheState next) {
        Objects.requireNonNull(next, "next");
        CacheState previous = state.getAndSet(next);
        if (previous != null && previous.cycle() >= next.cycle()) {
            log.warn("CACHE_OUT_OF_ORDER previousCycle={} publishedCycle={}", previous.cycle(), next.cycle());
        }
    }
}
