package com.signalplatform.marketdata.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.LiquidationSummary;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import com.signalplatform.marketdata.source.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recent filled liquidations on the perpetual swap, valued at bankruptcy price × size.
 * {@code posSide} tells which side was liquidated; events with another side are listed but not
 * counted in either total. An empty answer is a valid, empty summary.
 */
public class OkxLiquidationClient extends AbstractJsonSourceClient<LiquidationSummary> {

    private static final Logger log = LoggerFactory.getLogger(OkxLiquidationClient.class);

    static final int RECENT_EVENTS = 20;

    private final String underlying;

    public OkxLiquidationClient(WebClient okxWebClient, ObjectMapper objectMapper, String underlying) {
        super(SourceKind.LIQUIDATIONS, okxWebClient, objectMapper);
        this.underlying = underlying;
    }

    @Override
    public Mono<LiquidationSummary> fetch() {
        log.debug("Fetching liquidations. provider=OKX uly={}", underlying);
        return webClient.get()
            .uri("/api/v5/public/liquidation-orders?instType=SWAP&uly={uly}&state=filled", underlying)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, this::parse));
    }

    private LiquidationSummary parse(JsonNode root) {
        double longUsd = 0.0, shortUsd = 0.0;
        int longCount = 0, shortCount = 0;
        List<LiquidationSummary.Event> events = new ArrayList<>();

        for (JsonNode batch : OkxResponses.dataAllowEmpty(kind(), root)) {
            for (JsonNode detail : batch.path("details")) {
                double price = JsonFields.requiredDouble(kind(), detail, "bkPx");
                double size  = JsonFields.requiredDouble(kind(), detail, "sz");
                double value = price * size;
                String side  = detail.path("posSide").asText("");

                if ("long".equals(side)) {
                    longUsd += value;
                    longCount++;
                } else if ("short".equals(side)) {
                    shortUsd += value;
                    shortCount++;
                }
                events.add(new LiquidationSummary.Event(side, price, size, value,
                    JsonFields.requiredLong(kind(), detail, "ts")));
            }
        }

        List<LiquidationSummary.Event> recent = events.stream()
            .sorted(Comparator.comparingLong(LiquidationSummary.Event::time).reversed())
            .limit(RECENT_EVENTS)
            .toList();
        return new LiquidationSummary(longUsd, shortUsd, longCount, shortCount, longUsd + shortUsd, recent);
    }
}
