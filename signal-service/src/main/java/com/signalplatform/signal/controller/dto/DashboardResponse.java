package com.signalplatform.signal.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.signal.cache.CacheState;

/** The complete published state plus how old it is. */
public record DashboardResponse(
    @JsonProperty("state")           CacheState state,
    @JsonProperty("cacheAgeSeconds") long cacheAgeSeconds
) {}
