package com.signalplatform.marketdata.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;

/**
 * Envelope handling for OKX v5: {@code {"code": "0", "msg": "", "data": [...]}}.
 */
final class OkxResponses {

    private OkxResponses() {}

    /** The {@code data} array; rejects an error code and an empty array. */
    static JsonNode data(SourceKind kind, JsonNode root) {
        JsonNode data = dataAllowEmpty(kind, root);
        if (data.isEmpty()) {
            throw SourceFetchException.malformed(kind, "OKX response has no data");
        }
        return data;
    }

    /** The {@code data} array, which may legitimately be empty (e.g. no liquidations). */
    static JsonNode dataAllowEmpty(SourceKind kind, JsonNode root) {
        String code = root.path("code").asText("");
        if (!"0".equals(code)) {
            throw SourceFetchException.malformed(kind,
                "OKX error code=" + (code.isEmpty() ? "missing" : code) + " msg=" + root.path("msg").asText(""));
        }
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            throw SourceFetchException.malformed(kind, "OKX response has no data array");
        }
        return data;
    }
}
