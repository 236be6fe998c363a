package com.signalplatform.common.model;

/**
 * The five sub-signals that vote in the decision engine, each bound to the source it reads.
 *
 * <p>Declaration order is the canonical signal order: the engine sums contributions in this
 * order and verdicts list their contributing signals in it, so a verdict never depends on the
 * order in which sources happened to answer.
 */
public enum SignalKind {

    FUNDING_RATE("funding", SourceKind.FUNDING_RATE),
    LIQUIDATIONS("liquidations", SourceKind.LIQUIDATIONS),
    ORDER_BOOK("order_book", SourceKind.ORDER_BOOK),
    LONG_SHORT_RATIO("long_short_ratio", SourceKind.LONG_SHORT_RATIO),
    NEWS_SENTIMENT("news", SourceKind.NEWS);

    private final String sourceName;
    private final SourceKind source;

    SignalKind(String sourceName, SourceKind source) {
        this.sourceName = sourceName;
        this.source     = source;
    }

    public String sourceName() {
        return sourceName;
    }

    public SourceKind source() {
        return source;
    }
}
