package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.payload.LiquidationSummary;

import java.util.Optional;

/**
 * Exhaustion read of recent liquidations: the side that was just liquidated has already been
 * forced out, so pressure in its direction is spent.
 *
 * <pre>
 *   long USD / short USD  &ge; dominance → UP     longs flushed, bounce likely
 *   short USD / long USD  &ge; dominance → DOWN   shorts squeezed, pullback likely
 *   strength = min(1, (ratio − 1) / 3); a one-sided book counts as full strength
 * </pre>
 */
public class LiquidationEvaluator extends AbstractSubSignalEvaluator<LiquidationSummary> {

    private final double dominance;

    public LiquidationEvaluator(double weight, EvaluatorThresholds thresholds) {
        super(SignalKind.LIQUIDATIONS, LiquidationSummary.class, weight);
        this.dominance = thresholds.liquidationDominance();
    }

    @Override
    protected Optional<SubSignalResult> assess(LiquidationSummary liqs) {
        double longUsd  = liqs.longLiquidationUsd();
        double shortUsd = liqs.shortLiquidationUsd();

        if (liqs.totalUsd() <= 0.0 || (longUsd <= 0.0 && shortUsd <= 0.0)) {
            return noData();
        }

        double longOverShort = shortUsd > 0.0 ? longUsd / shortUsd : Double.POSITIVE_INFINITY;
        double shortOverLong = longUsd  > 0.0 ? shortUsd / longUsd : Double.POSITIVE_INFINITY;

        if (longOverShort >= dominance) {
            return up(strength(longOverShort),
                fmt("Long liqs $%,.0f vs short $%,.0f (ratio %s) - longs flushed, bounce likely",
                    longUsd, shortUsd, ratioText(longOverShort)));
        }
        if (shortOverLong >= dominance) {
            return down(strength(shortOverLong),
                fmt("Short liqs $%,.0f vs long $%,.0f (ratio %s) - shorts squeezed, pullback likely",
                    shortUsd, longUsd, ratioText(shortOverLong)));
        }
        return neutral(fmt("Liquidations balanced - long $%,.0f vs short $%,.0f", longUsd, shortUsd));
    }

    private static double strength(double ratio) {
        return Double.isInfinite(ratio) ? 1.0 : Math.min(1.0, (ratio - 1.0) / 3.0);
    }

    private static String ratioText(double ratio) {
        return Double.isInfinite(ratio) ? "one-sided" : fmt("%.1fx", ratio);
    }
}
