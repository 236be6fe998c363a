package com.signalplatform.marketdata.kraken;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.WallStrength;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import com.signalplatform.marketdata.source.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Kraken order-book depth reduced to bid/ask wall strength near the mid price.
 * Levels arrive as {@code [price, volume, timestamp]} string triples.
 */
public class KrakenOrderBookClient extends AbstractJsonSourceClient<WallStrength> {

    private static final Logger log = LoggerFactory.getLogger(KrakenOrderBookClient.class);

    private final String pair;
    private final int depth;
    private final WallStrengthCalculator calculator;

    public KrakenOrderBookClient(WebClient krakenWebClient, ObjectMapper objectMapper,
                                 String pair, int depth, WallStrengthCalculator calculator) {
        super(SourceKind.ORDER_BOOK, krakenWebClient, objectMapper);
        if (depth <= 0) {
            throw new IllegalArgumentException("Order book depth must be > 0, was " + depth);
        }
        this.pair       = pair;
        this.depth      = depth;
        this.calculator = calculator;
    }

    @Override
    public Mono<WallStrength> fetch() {
        log.debug("Fetching order book. provider=Kraken pair={} depth={}", pair, depth);
        return webClient.get()
            .uri("/0/public/Depth?pair={pair}&count={count}", pair, depth)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, this::parse));
    }

    private WallStrength parse(JsonNode root) {
        JsonNode book = KrakenResponses.pairResult(kind(), root);
        List<WallStrengthCalculator.Level> bids = levels(book, "bids");
        List<WallStrengthCalculator.Level> asks = levels(book, "asks");
        return calculator.calculate(bids, asks);
    }

    private List<WallStrengthCalculator.Level> levels(JsonNode book, String side) {
        JsonNode array = book.path(side);
        if (!array.isArray()) {
            throw SourceFetchException.malformed(kind(), "Order book has no '" + side + "' array");
        }
        List<WallStrengthCalculator.Level> levels = new ArrayList<>(array.size());
        for (JsonNode level : array) {
            levels.add(new WallStrengthCalculator.Level(
                JsonFields.requiredDouble(kind(), level, 0),
                JsonFields.requiredDouble(kind(), level, 1)));
        }
        return levels;
    }
}
