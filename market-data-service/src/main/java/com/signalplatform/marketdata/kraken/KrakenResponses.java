package com.signalplatform.marketdata.kraken;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Envelope handling for Kraken public endpoints:
 * {@code {"error": [...], "result": {"<pair name>": {...}}}}.
 */
final class KrakenResponses {

    private KrakenResponses() {}

    /**
     * Returns the single pair entry under {@code result}. Kraken answers with its own pair name
     * (e.g. {@code XXBTZUSD} for {@code XBTUSD}), so the first entry is taken rather than
     * looked up by the requested name.
     */
    static JsonNode pairResult(SourceKind kind, JsonNode root) {
        JsonNode errors = root.path("error");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(e -> messages.add(e.asText()));
            throw SourceFetchException.malformed(kind, "Kraken error: " + String.join(", ", messages));
        }
        JsonNode result = root.path("result");
        Iterator<JsonNode> pairs = result.elements();
        if (!result.isObject() || !pairs.hasNext()) {
            throw SourceFetchException.malformed(kind, "Kraken response has no result");
        }
        return pairs.next();
    }
}
