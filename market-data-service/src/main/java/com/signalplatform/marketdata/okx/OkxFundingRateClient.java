package com.signalplatform.marketdata.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.FundingRate;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import com.signalplatform.marketdata.source.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Current perpetual funding rate plus the last settlements. The two OKX calls run
 * concurrently; a failed history call degrades to an empty settlement list, a failed current
 * rate fails the fetch.
 */
public class OkxFundingRateClient extends AbstractJsonSourceClient<FundingRate> {

    private static final Logger log = LoggerFactory.getLogger(OkxFundingRateClient.class);

    static final int HISTORY_LIMIT = 10;

    private final String instId;

    public OkxFundingRateClient(WebClient okxWebClient, ObjectMapper objectMapper, String instId) {
        super(SourceKind.FUNDING_RATE, okxWebClient, objectMapper);
        this.instId = instId;
    }

    @Override
    public Mono<FundingRate> fetch() {
        log.debug("Fetching funding rate. provider=OKX instId={}", instId);
        return Mono.zip(fetchCurrent(), fetchHistory())
            .map(t -> new FundingRate(instId, t.getT1().rate(), t.getT1().time(), t.getT2()));
    }

    /** Current rate and the time it settles. */
    private Mono<FundingRate.Settlement> fetchCurrent() {
        return webClient.get()
            .uri("/api/v5/public/funding-rate?instId={instId}", instId)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, root -> settlement(OkxResponses.data(kind(), root).get(0))));
    }

    private Mono<List<FundingRate.Settlement>> fetchHistory() {
        return webClient.get()
            .uri("/api/v5/public/funding-rate-history?instId={instId}&limit={limit}", instId, HISTORY_LIMIT)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, root -> {
                List<FundingRate.Settlement> settlements = new ArrayList<>();
                for (JsonNode item : OkxResponses.dataAllowEmpty(kind(), root)) {
                    settlements.add(settlement(item));
                }
                return settlements;
            }))
            .onErrorResume(e -> {
                log.warn("Funding history unavailable, continuing without it. instId={} reason={}",
                         instId, e.getMessage());
                return Mono.just(List.of());
            });
    }

    private FundingRate.Settlement settlement(JsonNode item) {
        return new FundingRate.Settlement(
            JsonFields.requiredDouble(kind(), item, "fundingRate"),
            JsonFields.requiredLong(kind(), item, "fundingTime"));
    }
}
