package com.signalplatform.marketdata.news;

import com.signalplatform.common.model.payload.NewsSummary;
import com.signalplatform.common.model.payload.SentimentLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores crypto headlines in [-1, 1].
 *
 * <pre>
 *   polarity = mean polarity of lexicon words in the title (a preceding negation scales by −0.5)
 *   keywords = bullish hits − bearish hits over title + first 200 chars of body
 *   score    = clamp(polarity + 0.2 × keywords, −1, 1)
 *   label    = BULLISH above +0.1, BEARISH below −0.1
 * </pre>
 *
 * Keywords match whole words only, so "sec" does not fire on "second". Stateless.
 */
public class HeadlineSentimentScorer {

    public static final double LABEL_BAND = 0.1;

    static final double KEYWORD_WEIGHT = 0.2;
    static final int BODY_PREFIX = 200;

    private static final double NEGATION_FACTOR = -0.5;

    private static final List<String> BULLISH_KEYWORDS = List.of(
        "etf approved", "etf approval", "institutional", "adoption",
        "bullish", "rally", "surge", "breakout", "all-time high", "ath",
        "accumulation", "buying", "inflow");

    private static final List<String> BEARISH_KEYWORDS = List.of(
        "hack", "hacked", "exploit", "ban", "banned", "crackdown",
        "bearish", "crash", "plunge", "dump", "sell-off", "selloff",
        "liquidation", "outflow", "sec", "lawsuit", "fraud");

    private static final Set<String> NEGATIONS = Set.of("not", "no", "never", "isn't", "won't", "don't", "can't");

    private static final Map<String, Double> LEXICON = Map.ofEntries(
        Map.entry("good", 0.7), Map.entry("great", 0.8), Map.entry("best", 1.0),
        Map.entry("better", 0.5), Map.entry("strong", 0.43), Map.entry("stronger", 0.45),
        Map.entry("positive", 0.23), Map.entry("optimistic", 0.5), Map.entry("confident", 0.5),
        Map.entry("success", 0.3), Map.entry("successful", 0.75), Map.entry("record", 0.2),
        Map.entry("high", 0.16), Map.entry("higher", 0.25), Map.entry("huge", 0.4),
        Map.entry("massive", 0.2), Map.entry("win", 0.8), Map.entry("gains", 0.3),
        Map.entry("soars", 0.4), Map.entry("jumps", 0.25), Map.entry("rises", 0.2),
        Map.entry("boost", 0.35), Map.entry("recovery", 0.3), Map.entry("safe", 0.5),
        Map.entry("approve", 0.3), Map.entry("approved", 0.3), Map.entry("support", 0.2),
        Map.entry("bad", -0.7), Map.entry("worse", -0.4), Map.entry("worst", -1.0),
        Map.entry("weak", -0.38), Map.entry("weaker", -0.4), Map.entry("negative", -0.3),
        Map.entry("fear", -0.4), Map.entry("fears", -0.4), Map.entry("panic", -0.6),
        Map.entry("risk", -0.2), Map.entry("risky", -0.4), Map.entry("low", -0.15),
        Map.entry("lower", -0.2), Map.entry("falls", -0.3), Map.entry("drops", -0.3),
        Map.entry("slumps", -0.5), Map.entry("tumbles", -0.5), Map.entry("loss", -0.4),
        Map.entry("losses", -0.4), Map.entry("warning", -0.3), Map.entry("uncertain", -0.3),
        Map.entry("volatile", -0.2), Map.entry("terrible", -1.0), Map.entry("collapse", -0.6),
        Map.entry("illegal", -0.5), Map.entry("scam", -0.8), Map.entry("stolen", -0.6));

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9']+");

    private final List<Pattern> bullishPatterns = compile(BULLISH_KEYWORDS);
    private final List<Pattern> bearishPatterns = compile(BEARISH_KEYWORDS);

    public NewsSummary.HeadlineSentiment score(String title, String body) {
        String safeTitle = title == null ? "" : title;
        String safeBody  = body == null ? "" : body;
        String text = (safeTitle + " " + safeBody.substring(0, Math.min(BODY_PREFIX, safeBody.length())))
            .toLowerCase(Locale.ROOT);

        double polarity = round3(polarity(safeTitle));
        int bullishHits = countHits(bullishPatterns, text);
        int bearishHits = countHits(bearishPatterns, text);

        double combined = polarity + (bullishHits - bearishHits) * KEYWORD_WEIGHT;
        double score = round3(Math.max(-1.0, Math.min(1.0, combined)));
        return new NewsSummary.HeadlineSentiment(score, label(score), polarity, bullishHits, bearishHits);
    }

    /** Aggregates already-scored headlines; the average is rounded to 3 decimals. */
    public NewsSummary summarize(List<NewsSummary.Headline> headlines) {
        if (headlines.isEmpty()) {
            return new NewsSummary(SentimentLabel.NEUTRAL, 0.0, 0, 0, 0, List.of());
        }
        double sum = 0.0;
        int bullish = 0, bearish = 0, neutral = 0;
        for (NewsSummary.Headline h : headlines) {
            sum += h.sentiment().score();
            switch (h.sentiment().label()) {
                case BULLISH -> bullish++;
                case BEARISH -> bearish++;
                case NEUTRAL -> neutral++;
            }
        }
        double avg = round3(sum / headlines.size());
        return new NewsSummary(label(avg), avg, bullish, bearish, neutral, headlines);
    }

    double polarity(String title) {
        String[] tokens = TOKEN_SPLIT.split(title.toLowerCase(Locale.ROOT));
        double sum = 0.0;
        int matched = 0;
        boolean negate = false;
        for (String token : tokens) {
            if (token.isEmpty()) continue;
            if (NEGATIONS.contains(token)) {
                negate = true;
                continue;
            }
            Double value = LEXICON.get(token);
            if (value != null) {
                sum += negate ? value * NEGATION_FACTOR : value;
                matched++;
                negate = false;
            }
        }
        return matched == 0 ? 0.0 : sum / matched;
    }

    private static SentimentLabel label(double score) {
        return SentimentLabel.of(score, LABEL_BAND, -LABEL_BAND);
    }

    private static int countHits(List<Pattern> patterns, String text) {
        int hits = 0;
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) hits++;
        }
        return hits;
    }

    private static List<Pattern> compile(List<String> keywords) {
        List<Pattern> patterns = new ArrayList<>(keywords.size());
        for (String kw : keywords) {
            patterns.add(Pattern.compile("(?<![a-z0-9])" + Pattern.quote(kw) + "(?![a-z0-9])"));
        }
        return List.copyOf(patterns);
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
