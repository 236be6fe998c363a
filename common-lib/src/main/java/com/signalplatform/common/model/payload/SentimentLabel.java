package com.signalplatform.common.model.payload;

public enum SentimentLabel {
    BULLISH,
    BEARISH,
    NEUTRAL;

    /** Labels a score using an exclusive band: above {@code bullishAbove} or below {@code bearishBelow}. */
    public static SentimentLabel of(double score, double bullishAbove, double bearishBelow) {
        if (score > bullishAbove) return BULLISH;
        if (score < bearishBelow) return BEARISH;
        return NEUTRAL;
    }
}
