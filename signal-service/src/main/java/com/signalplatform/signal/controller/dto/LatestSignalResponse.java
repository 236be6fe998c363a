package com.signalplatform.signal.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.Verdict;
import com.signalplatform.common.odds.OddsAssessment;

import java.time.Instant;
import java.util.List;

/**
 * Compact view of the latest verdict. {@code btcPrice} is {@code null} when the ticker source
 * failed in that cycle.
 */
public record LatestSignalResponse(
    @JsonProperty("btcPrice")    Double btcPrice,
    @JsonProperty("verdict")     Verdict verdict,
    @JsonProperty("subSignals")  List<SubSignalResult> subSignals,
    @JsonProperty("odds")        OddsAssessment odds,
    @JsonProperty("lastUpdated") Instant lastUpdated
) {}
