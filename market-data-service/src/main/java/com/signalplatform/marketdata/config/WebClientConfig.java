package com.signalplatform.marketdata.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One {@link WebClient} per upstream host. Transport timeouts here sit below the refresh
 * coordinator's per-source deadline, so a hung socket surfaces as a transport error first.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    private static final int MAX_BODY_BYTES = 2 * 1024 * 1024;

    @Value("${sources.kraken.base-url:https://api.kraken.com}")
    private String krakenBaseUrl;

    @Value("${sources.okx.base-url:https://www.okx.com}")
    private String okxBaseUrl;

    @Value("${sources.cryptocompare.base-url:https://min-api.cryptocompare.com}")
    private String cryptoCompareBaseUrl;

    @Value("${sources.polymarket.base-url:https://gamma-api.polymarket.com}")
    private String polymarketBaseUrl;

    @Value("${sources.http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${sources.http.read-timeout-seconds:8}")
    private int readTimeoutSeconds;

    @Bean
    public WebClient krakenWebClient(WebClient.Builder builder) {
        return build(builder, "kraken", krakenBaseUrl);
    }

    @Bean
    public WebClient okxWebClient(WebClient.Builder builder) {
        return build(builder, "okx", okxBaseUrl);
    }

    @Bean
    public WebClient cryptoCompareWebClient(WebClient.Builder builder) {
        return build(builder, "cryptocompare", cryptoCompareBaseUrl);
    }

    @Bean
    public WebClient polymarketWebClient(WebClient.Builder builder) {
        return build(builder, "polymarket", polymarketBaseUrl);
    }

    private WebClient build(WebClient.Builder builder, String host, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        log.info("Source WebClient configured. host={} baseUrl={}", host, baseUrl);
        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
            .filter(serverErrorFilter(host))
            .filter(loggingFilter(host))
            .build();
    }

    static ExchangeFilterFunction serverErrorFilter(String host) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.error(new UpstreamServerException(host, clientResponse.statusCode().value())));
            }
            return Mono.just(clientResponse);
        });
    }

    static ExchangeFilterFunction loggingFilter(String host) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: host={} {} {}", host, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
