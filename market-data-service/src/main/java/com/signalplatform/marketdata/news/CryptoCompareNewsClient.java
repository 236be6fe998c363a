package com.signalplatform.marketdata.news;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.common.model.payload.NewsSummary;
import com.signalplatform.marketdata.source.AbstractJsonSourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Latest BTC headlines from CryptoCompare's public news feed, each scored by
 * {@link HeadlineSentimentScorer}.
 */
public class CryptoCompareNewsClient extends AbstractJsonSourceClient<NewsSummary> {

    private static final Logger log = LoggerFactory.getLogger(CryptoCompareNewsClient.class);

    public static final int DEFAULT_HEADLINES = 10;

    private final HeadlineSentimentScorer scorer;
    private final int headlineLimit;

    public CryptoCompareNewsClient(WebClient cryptoCompareWebClient, ObjectMapper objectMapper,
                                   HeadlineSentimentScorer scorer, int headlineLimit) {
        super(SourceKind.NEWS, cryptoCompareWebClient, objectMapper);
        if (headlineLimit <= 0) {
            throw new IllegalArgumentException("Headline limit must be > 0, was " + headlineLimit);
        }
        this.scorer        = scorer;
        this.headlineLimit = headlineLimit;
    }

    @Override
    public Mono<NewsSummary> fetch() {
        log.debug("Fetching news. provider=CryptoCompare limit={}", headlineLimit);
        return webClient.get()
            .uri("/data/v2/news/?categories=BTC&lang=EN&sortOrder=latest")
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> parseGuarded(body, this::parse));
    }

    private NewsSummary parse(JsonNode root) {
        JsonNode items = root.path("Data");
        if (!items.isArray()) {
            throw SourceFetchException.malformed(kind(),
                "News response has no Data array: " + root.path("Message").asText("no message"));
        }
        List<NewsSummary.Headline> headlines = new ArrayList<>();
        for (JsonNode item : items) {
            if (headlines.size() >= headlineLimit) break;
            String title = item.path("title").asText("");
            String body  = item.path("body").asText("");
            String source = item.path("source_info").path("name").asText(item.path("source").asText("Unknown"));
            headlines.add(new NewsSummary.Headline(
                title,
                source,
                item.path("published_on").asLong(0L),
                item.path("url").asText(""),
                scorer.score(title, body)));
        }
        return scorer.summarize(headlines);
    }
}
