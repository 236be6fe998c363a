package com.signalplatform.marketdata.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.OpenInterest;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import com.signalplatform.marketdata.source.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

public class OkxOpenInterestClient extends AbstractJsonSourceClient<OpenInterest> {

    private static final Logger log = LoggerFactory.getLogger(OkxOpenInterestClient.class);

    private final String instId;

    public OkxOpenInterestClient(WebClient okxWebClient, ObjectMapper objectMapper, String instId) {
        super(SourceKind.OPEN_INTEREST, okxWebClient, objectMapper);
        this.instId = instId;
    }

    @Override
    public Mono<OpenInterest> fetch() {
        log.debug("Fetching open interest. provider=OKX instId={}", instId);
        return webClient.get()
            .uri("/api/v5/public/open-interest?instType=SWAP&instId={instId}", instId)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, root -> {
                JsonNode item = OkxResponses.data(kind(), root).get(0);
                return new OpenInterest(instId,
                    JsonFields.requiredDouble(kind(), item, "oi"),
                    JsonFields.requiredDouble(kind(), item, "oiCcy"),
                    JsonFields.requiredLong(kind(), item, "ts"));
            }));
    }
}
