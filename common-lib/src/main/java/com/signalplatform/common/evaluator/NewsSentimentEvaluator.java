package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.payload.NewsSummary;

import java.util.Optional;

/**
 * Headline sentiment as a confirming signal; strength is the magnitude of the average score.
 */
public class NewsSentimentEvaluator extends AbstractSubSignalEvaluator<NewsSummary> {

    private final double bullish;
    private final double bearish;

    public NewsSentimentEvaluator(double weight, EvaluatorThresholds thresholds) {
        super(SignalKind.NEWS_SENTIMENT, NewsSummary.class, weight);
        this.bullish = thresholds.newsBullish();
        this.bearish = thresholds.newsBearish();
    }

    @Override
    protected Optional<SubSignalResult> assess(NewsSummary news) {
        double score = news.avgScore();
        if (news.headlines().isEmpty() || !Double.isFinite(score)) {
            return noData();
        }
        String counts = fmt("%d bullish, %d bearish headlines", news.bullishCount(), news.bearishCount());
        if (score > bullish) {
            return up(Math.min(1.0, Math.abs(score)),
                fmt("News sentiment bullish (score: %.3f) - %s", score, counts));
        }
        if (score < bearish) {
            return down(Math.min(1.0, Math.abs(score)),
                fmt("News sentiment bearish (score: %.3f) - %s", score, counts));
        }
        return neutral(fmt("News sentiment neutral (score: %.3f)", score));
    }
}
