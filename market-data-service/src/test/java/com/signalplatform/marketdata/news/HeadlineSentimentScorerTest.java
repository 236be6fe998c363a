package com.signalplatform.marketdata.news;

import com.signalplatform.common.model.payload.NewsSummary;
import com.signalplatform.common.model.payload.SentimentLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeadlineSentimentScorerTest {

    private final HeadlineSentimentScorer scorer = new HeadlineSentimentScorer();

    @Test
    @DisplayName("bullish keywords push the score up by 0.2 per hit")
    void bullishKeywords() {
        NewsSummary.HeadlineSentiment s = scorer.score("Bitcoin rally continues as ETF inflow grows", "");

        assertEquals(2, s.bullishKeywords());
        assertEquals(0, s.bearishKeywords());
        assertEquals(0.4, s.score(), 1e-9);
        assertEquals(SentimentLabel.BULLISH, s.label());
    }

    @Test
    @DisplayName("bearish keywords in the body prefix count too")
    void bearishKeywordsInBody() {
        NewsSummary.HeadlineSentiment s = scorer.score("Exchange update", "A major hack drained hot wallets.");

        assertEquals(1, s.bearishKeywords());
        assertEquals(-0.2, s.score(), 1e-9);
        assertEquals(SentimentLabel.BEARISH, s.label());
    }

    @Test
    @DisplayName("keywords past the first 200 body characters are ignored")
    void bodyBeyondPrefixIgnored() {
        String body = "x".repeat(HeadlineSentimentScorer.BODY_PREFIX) + " crash";
        assertEquals(0, scorer.score("Market update", body).bearishKeywords());
    }

    @Test
    @DisplayName("keywords match whole words only")
    void wholeWordMatching() {
        NewsSummary.HeadlineSentiment s = scorer.score("Second path to bandwidth", "");

        assertEquals(0, s.bearishKeywords());
        assertEquals(0, s.bullishKeywords());
    }

    @Test
    @DisplayName("lexicon polarity averages matched words; negation flips and damps")
    void lexiconPolarity() {
        assertEquals(0.75, scorer.polarity("Good and great news"), 1e-9);
        assertEquals(-0.35, scorer.polarity("Not good"), 1e-9);
        assertEquals(0.0, scorer.polarity("Bitcoin trades sideways"));
    }

    @Test
    @DisplayName("combined score is clamped to [-1, 1]")
    void clamped() {
        NewsSummary.HeadlineSentiment s = scorer.score(
            "Terrible crash, hack and fraud as ban and lawsuit hit exchange", "");
        assertEquals(-1.0, s.score());
    }

    @Test
    @DisplayName("summary averages scores and counts labels")
    void summarize() {
        List<NewsSummary.Headline> headlines = List.of(
            headline(0.4, SentimentLabel.BULLISH),
            headline(-0.2, SentimentLabel.BEARISH),
            headline(0.0, SentimentLabel.NEUTRAL),
            headline(0.3, SentimentLabel.BULLISH));

        NewsSummary summary = scorer.summarize(headlines);

        assertEquals(0.125, summary.avgScore(), 1e-9);
        assertEquals(SentimentLabel.BULLISH, summary.overallSentiment());
        assertEquals(2, summary.bullishCount());
        assertEquals(1, summary.bearishCount());
        assertEquals(1, summary.neutralCount());
        assertEquals(4, summary.headlines().size());
    }

    private static NewsSummary.Headline headline(double score, SentimentLabel label) {
        return new NewsSummary.Headline("t", "s", 0L, "",
            new NewsSummary.HeadlineSentiment(score, label, 0.0, 0, 0));
    }
}
