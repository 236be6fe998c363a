package com.signalplatform.common.odds;

import com.signalplatform.common.model.VerdictDirection;
import com.signalplatform.common.model.payload.PredictionMarketContext;

import java.util.Locale;
import java.util.Optional;

/**
 * Checks the prediction-market share price of the outcome matching a verdict.
 *
 * <pre>
 *   UP   → "Up" outcome,  DOWN → "Down" outcome,  SKIP → never a bet
 *   value when price &le; maxSharePrice; payout = 1 / price
 * </pre>
 *
 * Stateless and thread-safe.
 */
public class OddsValueAssessor {

    public static final double DEFAULT_MAX_SHARE_PRICE = 0.55;

    private final double maxSharePrice;

    public OddsValueAssessor(double maxSharePrice) {
        if (!(maxSharePrice > 0.0 && maxSharePrice <= 1.0)) {
            throw new IllegalArgumentException("maxSharePrice must be in (0, 1], was " + maxSharePrice);
        }
        this.maxSharePrice = maxSharePrice;
    }

    public OddsAssessment assess(PredictionMarketContext market, VerdictDirection direction) {
        if (market == null) {
            return OddsAssessment.noValue("No prediction market data");
        }
        if (!direction.isDirectional()) {
            return OddsAssessment.noValue("Signal is SKIP - no bet");
        }

        String label = direction == VerdictDirection.UP ? "Up" : "Down";
        Optional<Double> price = market.outcome(label).map(PredictionMarketContext.Outcome::price);
        if (price.isEmpty() || price.get() <= 0.0) {
            return OddsAssessment.noValue("No price for target outcome");
        }

        double p = price.get();
        if (p <= maxSharePrice) {
            double payout = Math.round((1.0 / p) * 100.0) / 100.0;
            return new OddsAssessment(true, p, payout,
                String.format(Locale.ROOT, "%s shares at $%.2f -> %.2fx payout if correct", direction, p, 1.0 / p));
        }
        return new OddsAssessment(false, p, null,
            String.format(Locale.ROOT, "%s shares at $%.2f - too expensive (max $%.2f)", direction, p, maxSharePrice));
    }
}
