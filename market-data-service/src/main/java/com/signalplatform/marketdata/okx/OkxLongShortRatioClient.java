package com.signalplatform.marketdata.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.LongShortRatio;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import com.signalplatform.marketdata.source.JsonFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Hourly long/short account ratio. OKX returns {@code [ts, ratio]} pairs, newest first; the
 * first point is the current ratio.
 */
public class OkxLongShortRatioClient extends AbstractJsonSourceClient<LongShortRatio> {

    private static final Logger log = LoggerFactory.getLogger(OkxLongShortRatioClient.class);

    static final int HISTORY_POINTS = 12;

    private final String ccy;

    public OkxLongShortRatioClient(WebClient okxWebClient, ObjectMapper objectMapper, String ccy) {
        super(SourceKind.LONG_SHORT_RATIO, okxWebClient, objectMapper);
        this.ccy = ccy;
    }

    @Override
    public Mono<LongShortRatio> fetch() {
        log.debug("Fetching long/short ratio. provider=OKX ccy={}", ccy);
        return webClient.get()
            .uri("/api/v5/rubik/stat/contracts/long-short-account-ratio?ccy={ccy}&period=1H", ccy)
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, this::parse));
    }

    private LongShortRatio parse(JsonNode root) {
        JsonNode data = OkxResponses.data(kind(), root);
        List<LongShortRatio.Point> history = new ArrayList<>(HISTORY_POINTS);
        for (int i = 0; i < Math.min(HISTORY_POINTS, data.size()); i++) {
            JsonNode point = data.get(i);
            if (!point.isArray() || point.size() < 2) {
                throw SourceFetchException.malformed(kind(), "Ratio point is not a [ts, ratio] pair");
            }
            history.add(new LongShortRatio.Point(
                (long) JsonFields.requiredDouble(kind(), point, 0),
                JsonFields.requiredDouble(kind(), point, 1)));
        }
        return new LongShortRatio(history.get(0).ratio(), history);
    }
}
