package com.signalplatform.common.odds;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether the prediction-market share for the verdict's direction is cheap enough to act on.
 * {@code sharePrice} and {@code potentialPayout} are {@code null} when no price was available.
 */
public record OddsAssessment(
    @JsonProperty("hasValue")        boolean hasValue,
    @JsonProperty("sharePrice")      Double sharePrice,
    @JsonProperty("potentialPayout") Double potentialPayout,
    @JsonProperty("detail")          String detail
) {
    public static OddsAssessment noValue(String detail) {
        return new OddsAssessment(false, null, null, detail);
    }
}
