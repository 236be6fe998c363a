package com.signalplatform.marketdata.polymarket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.PredictionMarketContext;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks the most relevant active BTC market from Polymarket's Gamma API.
 *
 * <p>Markets come back ordered by 24h volume. Expired markets and markets whose question does
 * not mention BTC are dropped; "up or down" markets move to the front, keeping volume order
 * otherwise. Gamma encodes {@code outcomes}, {@code outcomePrices} and {@code clobTokenIds} as
 * JSON strings holding arrays.
 */
public class PolymarketClient extends AbstractJsonSourceClient<PredictionMarketContext> {

    private static final Logger log = LoggerFactory.getLogger(PolymarketClient.class);

    static final int MARKET_LIMIT = 100;

    private final String tagSlug;
    private final Clock clock;

    public PolymarketClient(WebClient polymarketWebClient, ObjectMapper objectMapper, String tagSlug, Clock clock) {
        super(SourceKind.PREDICTION_MARKET, polymarketWebClient, objectMapper);
        this.tagSlug = tagSlug;
        this.clock   = clock;
    }

    @Override
    public Mono<PredictionMarketContext> fetch() {
        log.debug("Fetching prediction markets. provider=Polymarket tag={}", tagSlug);
        return webClient.get()
            .uri("/markets?limit={limit}&active=true&closed=false&tag_slug={tag}&order=volume24hr&ascending=false",
                 MARKET_LIMIT, tagSlug)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, this::parse));
    }

    private PredictionMarketContext parse(JsonNode root) {
        JsonNode markets = root.isObject() ? root.path("data") : root;
        if (!markets.isArray()) {
            throw SourceFetchException.malformed(kind(), "Markets response is not a list");
        }

        Instant now = clock.instant();
        List<JsonNode> candidates = new ArrayList<>();
        for (JsonNode market : markets) {
            String question = market.path("question").asText("").toLowerCase(Locale.ROOT);
            if ((question.contains("btc") || question.contains("bitcoin")) && !expired(market, now)) {
                candidates.add(market);
            }
        }
        if (candidates.isEmpty()) {
            throw SourceFetchException.malformed(kind(), "No active BTC market listed");
        }
        // List.sort is stable: volume order is kept within each group.
        candidates.sort(Comparator.comparing(m -> !isUpOrDown(m)));

        JsonNode best = candidates.get(0);
        return new PredictionMarketContext(
            best.path("question").asText(null),
            best.path("endDate").asText(null),
            best.path("slug").asText(null),
            outcomes(best));
    }

    private Map<String, PredictionMarketContext.Outcome> outcomes(JsonNode market) {
        JsonNode tokenIds = embeddedArray(market, "clobTokenIds");
        JsonNode labels   = embeddedArray(market, "outcomes");
        JsonNode prices   = embeddedArray(market, "outcomePrices");

        Map<String, PredictionMarketContext.Outcome> outcomes = new LinkedHashMap<>();
        for (int i = 0; i < tokenIds.size(); i++) {
            String label = i < labels.size() ? labels.get(i).asText() : "Outcome " + i;
            Double price = i < prices.size() ? parsePrice(prices.get(i)) : null;
            outcomes.put(label, new PredictionMarketContext.Outcome(tokenIds.get(i).asText(), price));
        }
        return outcomes;
    }

    private Double parsePrice(JsonNode node) {
        try {
            return node.isNumber() ? node.asDouble() : Double.valueOf(node.asText().trim());
        } catch (NumberFormatException e) {
            throw SourceFetchException.malformed(kind(), "Outcome price is not a number: '" + node.asText() + "'");
        }
    }

    /** Reads a field that is either an array or a string containing a JSON array. */
    private JsonNode embeddedArray(JsonNode market, String field) {
        JsonNode value = market.path(field);
        if (value.isTextual()) {
            try {
                value = objectMapper.readTree(value.asText());
            } catch (JsonProcessingException e) {
                throw SourceFetchException.malformed(kind(), "Field '" + field + "' is not a JSON array", e);
            }
        }
        if (value.isMissingNode() || value.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!value.isArray()) {
            throw SourceFetchException.malformed(kind(), "Field '" + field + "' is not a JSON array");
        }
        return value;
    }

    /** A market without an end date is kept; one with an unreadable end date is skipped. */
    private static boolean expired(JsonNode market, Instant now) {
        String endDate = market.path("endDate").asText("");
        if (endDate.isBlank()) {
            return false;
        }
        try {
            return OffsetDateTime.parse(endDate).toInstant().isBefore(now);
        } catch (DateTimeParseException e) {
            log.debug("Skipping market with unreadable endDate. slug={} endDate={}",
                      market.path("slug").asText(), endDate);
            return true;
        }
    }

    private static boolean isUpOrDown(JsonNode market) {
        return market.path("question").asText("").toLowerCase(Locale.ROOT).contains("up or down");
    }
}
