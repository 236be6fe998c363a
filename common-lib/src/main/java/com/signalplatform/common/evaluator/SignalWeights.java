package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;

/**
 * Fixed per-signal voting weights. Funding and liquidations are primary, the order book is
 * secondary, long/short ratio and news are confirming signals.
 */
public record SignalWeights(
    double funding,
    double liquidations,
    double orderBook,
    double longShortRatio,
    double news
) {

    public static final double DEFAULT_FUNDING          = 1.5;
    public static final double DEFAULT_LIQUIDATIONS     = 1.5;
    public static final double DEFAULT_ORDER_BOOK       = 1.0;
    public static final double DEFAULT_LONG_SHORT_RATIO = 0.5;
    public static final double DEFAULT_NEWS             = 0.5;

    public SignalWeights {
        requireWeight("funding", funding);
        requireWeight("liquidations", liquidations);
        requireWeight("orderBook", orderBook);
        requireWeight("longShortRatio", longShortRatio);
        requireWeight("news", news);
    }

    public static SignalWeights defaults() {
        return new SignalWeights(DEFAULT_FUNDING, DEFAULT_LIQUIDATIONS, DEFAULT_ORDER_BOOK,
                                 DEFAULT_LONG_SHORT_RATIO, DEFAULT_NEWS);
    }

    public double weightOf(SignalKind signal) {
        return switch (signal) {
            case FUNDING_RATE     -> funding;
            case LIQUIDATIONS     -> liquidations;
            case ORDER_BOOK       -> orderBook;
            case LONG_SHORT_RATIO -> longShortRatio;
            case NEWS_SENTIMENT   -> news;
        };
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException("Signal weight '" + name + "' must be finite and >= 0, was " + value);
        }
    }
}
