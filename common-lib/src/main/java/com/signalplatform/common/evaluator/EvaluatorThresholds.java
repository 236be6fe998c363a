package com.signalplatform.common.evaluator;

/**
 * Neutral-band boundaries for the five sub-signal evaluators.
 *
 * <pre>
 *   fundingHigh / fundingLow          per-8h funding rate, e.g. 0.0001 = 0.01 %
 *   liquidationDominance              one side's USD volume / the other's
 *   wallBidStrong / wallAskStrong     bid/ask wall ratio
 *   longShortHigh / longShortLow      long/short account ratio
 *   newsBullish / newsBearish         average headline score in [-1, 1]
 * </pre>
 */
public record EvaluatorThresholds(
    double fundingHigh,
    double fundingLow,
    double liquidationDominance,
    double wallBidStrong,
    double wallAskStrong,
    double longShortHigh,
    double longShortLow,
    double newsBullish,
    double newsBearish
) {

    public EvaluatorThresholds {
        if (!(fundingHigh > 0.0) || !(fundingLow < 0.0)) {
            throw new IllegalArgumentException(
                "fundingHigh must be > 0 and fundingLow < 0, were " + fundingHigh + " / " + fundingLow);
        }
        if (!(liquidationDominance > 1.0)) {
            throw new IllegalArgumentException("liquidationDominance must be > 1, was " + liquidationDominance);
        }
        if (!(wallAskStrong > 0.0 && wallAskStrong < 1.0 && wallBidStrong > 1.0)) {
            throw new IllegalArgumentException(
                "wall thresholds must satisfy 0 < ask < 1 < bid, were " + wallAskStrong + " / " + wallBidStrong);
        }
        if (!(longShortLow > 0.0 && longShortLow < 1.0 && longShortHigh > 2.0)) {
            throw new IllegalArgumentException(
                "long/short thresholds must satisfy 0 < low < 1 and high > 2, were "
                + longShortLow + " / " + longShortHigh);
        }
        if (!(newsBearish < newsBullish) || newsBullish < 0.0 || newsBearish > 0.0) {
            throw new IllegalArgumentException(
                "news thresholds must satisfy bearish <= 0 <= bullish, were " + newsBearish + " / " + newsBullish);
        }
    }

    public static EvaluatorThresholds defaults() {
        return new EvaluatorThresholds(
            0.0001, -0.0001,
            1.5,
            1.3, 0.77,
            2.5, 0.7,
            0.1, -0.1);
    }
}
