package com.signalplatform.common.evaluator;

import java.util.List;

/**
 * Factory for the standard five-evaluator set, in canonical signal order.
 */
public final class SubSignalEvaluators {

    private SubSignalEvaluators() {}

    public static List<SubSignalEvaluator> standard(SignalWeights weights, EvaluatorThresholds thresholds) {
        return List.of(
            new FundingRateEvaluator(weights.funding(), thresholds),
            new LiquidationEvaluator(weights.liquidations(), thresholds),
            new OrderBookWallEvaluator(weights.orderBook(), thresholds),
            new LongShortRatioEvaluator(weights.longShortRatio(), thresholds),
            new NewsSentimentEvaluator(weights.news(), thresholds)
        );
    }

    public static List<SubSignalEvaluator> standard() {
        return standard(SignalWeights.defaults(), EvaluatorThresholds.defaults());
    }
}
