package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.FetchFailure;
import com.signalplatform.common.model.SignalDirection;
import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.SourceSnapshot;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.payload.FundingRate;
import com.signalplatform.common.model.payload.LiquidationSummary;
import com.signalplatform.common.model.payload.LongShortRatio;
import com.signalplatform.common.model.payload.NewsSummary;
import com.signalplatform.common.model.payload.SentimentLabel;
import com.signalplatform.common.model.payload.TickerQuote;
import com.signalplatform.common.model.payload.WallStrength;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SubSignalEvaluatorsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final EvaluatorThresholds T = EvaluatorThresholds.defaults();
    private static final double EPS = 1e-9;

    private static Map<SourceKind, SourceSnapshot> ok(SourceKind kind, SnapshotPayload payload) {
        return Map.of(kind, SourceSnapshot.ok(kind, payload, NOW));
    }

    private static SubSignalResult present(Optional<SubSignalResult> result) {
        assertTrue(result.isPresent(), "expected a vote");
        return result.get();
    }

    private static void assertVote(SubSignalResult r, SignalDirection direction, double strength) {
        assertEquals(direction, r.direction());
        assertEquals(strength, r.strength(), EPS);
    }

    @Test
    @DisplayName("standard set → five evaluators in canonical order with default weights")
    void standardSet_canonicalOrder() {
        List<SubSignalEvaluator> evaluators = SubSignalEvaluators.standard();

        assertEquals(List.of(SignalKind.values()), evaluators.stream().map(SubSignalEvaluator::signal).toList());
        assertEquals(List.of(1.5, 1.5, 1.0, 0.5, 0.5), evaluators.stream().map(SubSignalEvaluator::weight).toList());
    }

    @Test
    @DisplayName("failed or missing snapshot → no vote, never a fabricated NEUTRAL")
    void failedOrMissingSnapshot_noVote() {
        FundingRateEvaluator evaluator = new FundingRateEvaluator(1.5, T);

        assertTrue(evaluator.evaluate(Map.of()).isEmpty());
        assertTrue(evaluator.evaluate(null).isEmpty());
        assertTrue(evaluator.evaluate(Map.of(SourceKind.FUNDING_RATE,
            SourceSnapshot.failed(SourceKind.FUNDING_RATE, FetchFailure.TIMEOUT, "timed out", NOW))).isEmpty());
    }

    @Test
    @DisplayName("snapshot of the wrong payload type → no vote")
    void mistypedPayload_noVote() {
        Map<SourceKind, SourceSnapshot> snapshots =
            ok(SourceKind.FUNDING_RATE, new TickerQuote("XBTUSD", 65_000.0));
        assertTrue(new FundingRateEvaluator(1.5, T).evaluate(snapshots).isEmpty());
    }

    @Nested
    @DisplayName("funding rate")
    class FundingRateTests {

        private final FundingRateEvaluator evaluator = new FundingRateEvaluator(1.5, T);

        private Optional<SubSignalResult> eval(Double rate) {
            return evaluator.evaluate(ok(SourceKind.FUNDING_RATE, new FundingRate("BTC-USDT-SWAP", rate, null, null)));
        }

        @Test
        @DisplayName("high positive funding → DOWN, strength scales to 3× threshold")
        void highFunding_down() {
            assertVote(present(eval(0.00015)), SignalDirection.DOWN, 0.5);
            assertVote(present(eval(0.001)), SignalDirection.DOWN, 1.0);
        }

        @Test
        @DisplayName("negative funding → UP")
        void negativeFunding_up() {
            assertVote(present(eval(-0.00015)), SignalDirection.UP, 0.5);
        }

        @Test
        @DisplayName("inside the band → NEUTRAL with full weight")
        void insideBand_neutral() {
            SubSignalResult r = present(eval(0.00005));
            assertVote(r, SignalDirection.NEUTRAL, 0.0);
            assertEquals(1.5, r.weight());
        }

        @Test
        @DisplayName("no current rate → no vote")
        void noRate_noVote() {
            assertTrue(eval(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("liquidations")
    class LiquidationTests {

        private final LiquidationEvaluator evaluator = new LiquidationEvaluator(1.5, T);

        private Optional<SubSignalResult> eval(double longUsd, double shortUsd) {
            return evaluator.evaluate(ok(SourceKind.LIQUIDATIONS,
                new LiquidationSummary(longUsd, shortUsd, 1, 1, longUsd + shortUsd, List.of())));
        }

        @Test
        @DisplayName("longs dominate → UP (longs flushed)")
        void longsDominate_up() {
            assertVote(present(eval(300_000, 100_000)), SignalDirection.UP, 2.0 / 3.0);
        }

        @Test
        @DisplayName("shorts dominate → DOWN (shorts squeezed)")
        void shortsDominate_down() {
            assertVote(present(eval(100_000, 250_000)), SignalDirection.DOWN, 0.5);
        }

        @Test
        @DisplayName("balanced → NEUTRAL")
        void balanced_neutral() {
            assertVote(present(eval(120_000, 100_000)), SignalDirection.NEUTRAL, 0.0);
        }

        @Test
        @DisplayName("one-sided book → full strength")
        void oneSided_fullStrength() {
            assertVote(present(eval(50_000, 0)), SignalDirection.UP, 1.0);
            assertVote(present(eval(0, 50_000)), SignalDirection.DOWN, 1.0);
        }

        @Test
        @DisplayName("no liquidations in the window → no vote")
        void empty_noVote() {
            assertTrue(eval(0, 0).isEmpty());
        }
    }

    @Nested
    @DisplayName("order book walls")
    class OrderBookTests {

        private final OrderBookWallEvaluator evaluator = new OrderBookWallEvaluator(1.0, T);

        private Optional<SubSignalResult> eval(double bids, double asks, double ratio) {
            return evaluator.evaluate(ok(SourceKind.ORDER_BOOK, new WallStrength(bids, asks, ratio, 65_000, 0.01)));
        }

        @Test
        @DisplayName("bid wall dominant → UP")
        void bidWall_up() {
            assertVote(present(eval(20, 10, 2.0)), SignalDirection.UP, 0.5);
        }

        @Test
        @DisplayName("ask wall dominant → DOWN")
        void askWall_down() {
            assertVote(present(eval(5, 10, 0.5)), SignalDirection.DOWN, 1.0);
        }

        @Test
        @DisplayName("balanced → NEUTRAL")
        void balanced_neutral() {
            assertVote(present(eval(10, 10, 1.0)), SignalDirection.NEUTRAL, 0.0);
        }

        @Test
        @DisplayName("empty ask side → UP at full strength")
        void emptyAsks_fullStrength() {
            assertVote(present(eval(12, 0, Double.POSITIVE_INFINITY)), SignalDirection.UP, 1.0);
        }

        @Test
        @DisplayName("both sides empty → no vote")
        void emptyBook_noVote() {
            assertTrue(eval(0, 0, Double.NaN).isEmpty());
        }
    }

    @Nested
    @DisplayName("long/short ratio")
    class LongShortTests {

        private final LongShortRatioEvaluator evaluator = new LongShortRatioEvaluator(0.5, T);

        private Optional<SubSignalResult> eval(Double ratio) {
            return evaluator.evaluate(ok(SourceKind.LONG_SHORT_RATIO, new LongShortRatio(ratio, List.of())));
        }

        @Test
        @DisplayName("crowded longs → DOWN")
        void crowdedLongs_down() {
            assertVote(present(eval(3.0)), SignalDirection.DOWN, 0.5);
        }

        @Test
        @DisplayName("crowded shorts → UP")
        void crowdedShorts_up() {
            assertVote(present(eval(0.6)), SignalDirection.UP, 0.8);
        }

        @Test
        @DisplayName("normal range → NEUTRAL")
        void normal_neutral() {
            assertVote(present(eval(1.5)), SignalDirection.NEUTRAL, 0.0);
        }

        @Test
        @DisplayName("no ratio → no vote")
        void noRatio_noVote() {
            assertTrue(eval(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("news sentiment")
    class NewsTests {

        private final NewsSentimentEvaluator evaluator = new NewsSentimentEvaluator(0.5, T);

        private Optional<SubSignalResult> eval(double avg, int headlines) {
            List<NewsSummary.Headline> items = java.util.stream.IntStream.range(0, headlines)
                .mapToObj(i -> new NewsSummary.Headline("headline " + i, "wire", 0L, null,
                    new NewsSummary.HeadlineSentiment(avg, SentimentLabel.NEUTRAL, avg, 0, 0)))
                .toList();
            return evaluator.evaluate(ok(SourceKind.NEWS,
                new NewsSummary(SentimentLabel.of(avg, 0.1, -0.1), avg, 0, 0, headlines, items)));
        }

        @Test
        @DisplayName("bullish average → UP with strength |avg|")
        void bullish_up() {
            assertVote(present(eval(0.4, 3)), SignalDirection.UP, 0.4);
        }

        @Test
        @DisplayName("bearish average → DOWN")
        void bearish_down() {
            assertVote(present(eval(-0.25, 3)), SignalDirection.DOWN, 0.25);
        }

        @Test
        @DisplayName("inside the band → NEUTRAL")
        void neutralBand() {
            assertVote(present(eval(0.05, 3)), SignalDirection.NEUTRAL, 0.0);
        }

        @Test
        @DisplayName("no headlines → no vote")
        void noHeadlines_noVote() {
            assertTrue(eval(0.0, 0).isEmpty());
        }
    }

    @Test
    @DisplayName("invalid thresholds and weights → rejected")
    void invalidConfiguration_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SignalWeights(-1, 1, 1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new SignalWeights(1, Double.NaN, 1, 1, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new EvaluatorThresholds(0.0001, -0.0001, 1.5, 1.3, 0.77, 1.8, 0.7, 0.1, -0.1));
        assertThrows(IllegalArgumentException.class,
            () -> new EvaluatorThresholds(0.0001, -0.0001, 0.9, 1.3, 0.77, 2.5, 0.7, 0.1, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new FundingRateEvaluator(-0.5, T));
    }
}
