package com.signalplatform.signal.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.common.model.HistoryEntry;

import java.util.List;

/** Past verdicts, most recent first. */
public record HistoryResponse(
    @JsonProperty("entries") List<HistoryEntry> entries,
    @JsonProperty("count")   int count
) {
    public static HistoryResponse of(List<HistoryEntry> entries) {
        return new HistoryResponse(entries, entries.size());
    }
}
