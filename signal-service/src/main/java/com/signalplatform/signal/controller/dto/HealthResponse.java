package com.signalplatform.signal.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    @JsonProperty("status")          String status,
    @JsonProperty("lastUpdated")     Instant lastUpdated,
    @JsonProperty("cacheAgeSeconds") Long cacheAgeSeconds,
    @JsonProperty("cycle")           Long cycle
) {
    public static final String UP       = "UP";
    public static final String STARTING = "STARTING";

    public static HealthResponse starting() {
        return new HealthResponse(STARTING, null, null, null);
    }
}
