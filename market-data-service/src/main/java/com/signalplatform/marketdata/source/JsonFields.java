package com.signalplatform.marketdata.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;

/**
 * Strict readers for numeric fields. Exchanges send most numbers as strings; a missing, blank
 * or non-numeric value is a malformed payload rather than a silent zero.
 */
public final class JsonFields {

    private JsonFields() {}

    public static double requiredDouble(SourceKind kind, JsonNode node, String field) {
        return parseDouble(kind, node.path(field), field);
    }

    public static long requiredLong(SourceKind kind, JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        String text = value.isValueNode() ? value.asText() : "";
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw SourceFetchException.malformed(kind, "Field '" + field + "' is not an integer: '" + text + "'");
        }
    }

    /** Reads element {@code index} of a JSON array as a double. */
    public static double requiredDouble(SourceKind kind, JsonNode array, int index) {
        return parseDouble(kind, array.path(index), "[" + index + "]");
    }

    private static double parseDouble(SourceKind kind, JsonNode value, String field) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = value.isValueNode() ? value.asText() : "";
        try {
            double parsed = Double.parseDouble(text.trim());
            if (!Double.isFinite(parsed)) {
                throw new NumberFormatException("not finite");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw SourceFetchException.malformed(kind, "Field '" + field + "' is not a number: '" + text + "'");
        }
    }
}
