package com.signalplatform.signal.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.SourceSnapshot;

import java.time.Instant;

/** The four derivatives-market snapshots of the latest cycle; any of them may be a failure. */
public record DerivativesResponse(
    @JsonProperty("fundingRate")    SourceSnapshot fundingRate,
    @JsonProperty("openInterest")   SourceSnapshot openInterest,
    @JsonProperty("longShortRatio") SourceSnapshot longShortRatio,
    @JsonProperty("liquidations")   SourceSnapshot liquidations,
    @JsonProperty("lastUpdated")    Instant lastUpdated
) {}
