package com.signalplatform.common.model.payload;

import com.signalplatform.common.model.SnapshotPayload;

import java.util.List;

/**
 * Aggregated sentiment over the latest scored headlines.
 */
public record NewsSummary(
    SentimentLabel overallSentiment,
    double avgScore,
    int bullishCount,
    int bearishCount,
    int neutralCount,
    List<Headline> headlines
) implements SnapshotPayload {

    public NewsSummary {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }

    public record Headline(
        String title,
        String source,
        long publishedAt,
        String url,
        HeadlineSentiment sentiment
    ) {}

    public record HeadlineSentiment(
        double score,
        SentimentLabel label,
        double polarity,
        int bullishKeywords,
        int bearishKeywords
    ) {}
}
