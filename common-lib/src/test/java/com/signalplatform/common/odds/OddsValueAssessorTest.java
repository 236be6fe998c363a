package com.signalplatform.common.odds;

import com.signalplatform.common.model.VerdictDirection;
import com.signalplatform.common.model.payload.PredictionMarketContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OddsValueAssessorTest {

    private final OddsValueAssessor assessor = new OddsValueAssessor(OddsValueAssessor.DEFAULT_MAX_SHARE_PRICE);

    private static PredictionMarketContext market(Double upPrice, Double downPrice) {
        Map<String, PredictionMarketContext.Outcome> outcomes = new LinkedHashMap<>();
        outcomes.put("Up", new PredictionMarketContext.Outcome("tok-up", upPrice));
        outcomes.put("Down", new PredictionMarketContext.Outcome("tok-down", downPrice));
        return new PredictionMarketContext("Bitcoin Up or Down - 3PM ET?", "2026-03-01T20:00:00Z",
                                           "btc-up-or-down", outcomes);
    }

    @Test
    @DisplayName("cheap matching share → value with payout 1/price")
    void cheapShare_hasValue() {
        OddsAssessment a = assessor.assess(market(0.40, 0.60), VerdictDirection.UP);

        assertTrue(a.hasValue());
        assertEquals(0.40, a.sharePrice());
        assertEquals(2.5, a.potentialPayout());
    }

    @Test
    @DisplayName("expensive matching share → no value, price still reported")
    void expensiveShare_noValue() {
        OddsAssessment a = assessor.assess(market(0.40, 0.60), VerdictDirection.DOWN);

        assertFalse(a.hasValue());
        assertEquals(0.60, a.sharePrice());
        assertNull(a.potentialPayout());
        assertTrue(a.detail().contains("too expensive"));
    }

    @Test
    @DisplayName("price equal to the maximum → value")
    void priceAtMaximum_hasValue() {
        assertTrue(assessor.assess(market(0.55, 0.45), VerdictDirection.UP).hasValue());
    }

    @Test
    @DisplayName("SKIP verdict → never a bet")
    void skip_noBet() {
        OddsAssessment a = assessor.assess(market(0.10, 0.90), VerdictDirection.SKIP);
        assertFalse(a.hasValue());
        assertNull(a.sharePrice());
    }

    @Test
    @DisplayName("missing market or price → no value")
    void missingData_noValue() {
        assertFalse(assessor.assess(null, VerdictDirection.UP).hasValue());
        assertFalse(assessor.assess(market(null, 0.5), VerdictDirection.UP).hasValue());
    }

    @Test
    @DisplayName("outcome lookup ignores case")
    void outcomeLookup_caseInsensitive() {
        Map<String, PredictionMarketContext.Outcome> outcomes =
            Map.of("DOWN", new PredictionMarketContext.Outcome("t", 0.3));
        PredictionMarketContext ctx = new PredictionMarketContext("q", null, "s", outcomes);

        assertTrue(assessor.assess(ctx, VerdictDirection.DOWN).hasValue());
    }

    @Test
    @DisplayName("max share price outside (0, 1] → rejected")
    void invalidMaxPrice() {
        assertThrows(IllegalArgumentException.class, () -> new OddsValueAssessor(0.0));
        assertThrows(IllegalArgumentException.class, () -> new OddsValueAssessor(1.2));
    }
}
