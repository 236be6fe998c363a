package com.signalplatform.common.model;

import java.util.Locale;

/**
 * One category of raw market data, fetched by exactly one source client per refresh cycle.
 *
 * <p>{@link #key()} is the stable lower-case name used in logs and in the read API
 * (e.g. {@code /sources/funding_rate}).
 */
public enum SourceKind {

    PRICE_TICKER,
    ORDER_BOOK,
    FUNDING_RATE,
    OPEN_INTEREST,
    LONG_SHORT_RATIO,
    LIQUIDATIONS,
    NEWS,
    PREDICTION_MARKET;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; accepts both {@code ORDER_BOOK} and {@code order-book}. */
    public static SourceKind fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Source kind must not be blank");
        }
        String normalized = key.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + key);
    }
}
