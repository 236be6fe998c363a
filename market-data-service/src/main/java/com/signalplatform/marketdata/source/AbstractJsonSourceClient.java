package com.signalplatform.marketdata.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SnapshotPayload;
import com.signalplatform.common.model.SourceKind;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Objects;
import java.util.function.Function;

/**
 * Base for clients that read a JSON body and map it to a payload with {@link JsonNode}.
 * Parse failures of any kind surface as MALFORMED_PAYLOAD.
 */
public abstract class AbstractJsonSourceClient<P extends SnapshotPayload> implements SourceClient<P> {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    private final SourceKind kind;

    protected AbstractJsonSourceClient(SourceKind kind, WebClient webClient, ObjectMapper objectMapper) {
        this.kind         = Objects.requireNonNull(kind, "kind");
        this.webClient    = Objects.requireNonNull(webClient, "webClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public final SourceKind kind() {
        return kind;
    }

    protected JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw SourceFetchException.malformed(kind, "Empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw SourceFetchException.malformed(kind, "Response is not valid JSON", e);
        }
    }

    /**
     * Runs {@code parser} and reports anything it throws, other than a
     * {@link SourceFetchException}, as a malformed payload.
     */
    protected <T> T parseGuarded(String body, Function<JsonNode, T> parser) {
        JsonNode root = readTree(body);
        try {
            return parser.apply(root);
        } catch (SourceFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SourceFetchException.malformed(kind, "Unexpected response shape: " + e.getMessage(), e);
        }
    }
}
