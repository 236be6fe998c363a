package com.signalplatform.marketdata.kraken;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.TickerQuote;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import com.signalplatform.marketdata.source.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Last trade price from Kraken's public ticker ({@code c[0]} of the pair entry).
 */
public class KrakenTickerClient extends AbstractJsonSourceClient<TickerQuote> {

    private static final Logger log = LoggerFactory.getLogger(KrakenTickerClient.class);

    private final String pair;

    public KrakenTickerClient(WebClient krakenWebClient, ObjectMapper objectMapper, String pair) {
        super(SourceKind.PRICE_TICKER, krakenWebClient, objectMapper);
        this.pair = pair;
    }

    @Override
    public Mono<TickerQuote> fetch() {
        log.debug("Fetching ticker. provider=Kraken pair={}", pair);
        return webClient.get()
            .uri("/0/public/Ticker?pair={pair}", pair)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, this::parse));
    }

    private TickerQuote parse(JsonNode root) {
        JsonNode ticker = KrakenResponses.pairResult(kind(), root);
        double last = JsonFields.requiredDouble(kind(), ticker.path("c"), 0);
        return new TickerQuote(pair, last);
    }
}
