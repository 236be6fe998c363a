package com.signalplatform.signal.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.VerdictDirection;
import com.signalplatform.common.odds.OddsAssessment;

/**
 * Verdict and odds combined into one actionable line.
 *
 * <p>{@code market} is {@code null} when the prediction-market source failed.
 */
public record BetSuggestionResponse(
    @JsonProperty("direction")      VerdictDirection direction,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("upCount")        int upCount,
    @JsonProperty("downCount")      int downCount,
    @JsonProperty("market")         String market,
    @JsonProperty("odds")           OddsAssessment odds,
    @JsonProperty("recommendation") Recommendation recommendation,
    @JsonProperty("reason")         String reason
) {

    public enum Recommendation {
        RECOMMEND,
        NO_BET
    }
}
