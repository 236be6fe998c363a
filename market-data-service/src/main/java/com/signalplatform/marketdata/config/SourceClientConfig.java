package com.signalplatform.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.marketdata.kraken.KrakenOrderBookClient;
import com.signalplatform.marketdata.kraken.KrakenTickerClient;
import com.signalplatform.marketdata.kraken.WallStrengthCalculator;
import com.signalplatform.marketdata.news.CryptoCompareNewsClient;
import com.signalplatform.marketdata.news.HeadlineSentimentScorer;
import com.signalplatform.marketdata.okx.OkxFundingRateClient;
import com.signalplatform.marketdata.okx.OkxLiquidationClient;
import com.signalplatform.marketdata.okx.OkxLongShortRatioClient;
import com.signalplatform.marketdata.okx.OkxOpenInterestClient;
import com.signalplatform.marketdata.polymarket.PolymarketClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * The eight source clients. Instruments and pairs are configuration; every client is a
 * {@link com.signalplatform.marketdata.source.SourceClient} bean, collected by the refresh
 * coordinator as a list.
 */
@Configuration
public class SourceClientConfig {

    @Value("${sources.kraken.pair:XBTUSD}")
    private String krakenPair;

    @Value("${sources.order-book.depth:100}")
    private int orderBookDepth;

    @Value("${sources.order-book.band:0.01}")
    private double wallBand;

    @Value("${sources.okx.inst-id:BTC-USDT-SWAP}")
    private String okxInstId;

    @Value("${sources.okx.ccy:BTC}")
    private String okxCcy;

    @Value("${sources.okx.underlying:BTC-USDT}")
    private String okxUnderlying;

    @Value("${sources.cryptocompare.headlines:10}")
    private int headlineLimit;

    @Value("${sources.polymarket.tag-slug:bitcoin}")
    private String polymarketTag;

    @Bean
    public KrakenTickerClient krakenTickerClient(@Qualifier("krakenWebClient") WebClient webClient,
                                                 ObjectMapper objectMapper) {
        return new KrakenTickerClient(webClient, objectMapper, krakenPair);
    }

    @Bean
    public KrakenOrderBookClient krakenOrderBookClient(@Qualifier("krakenWebClient") WebClient webClient,
                                                       ObjectMapper objectMapper) {
        return new KrakenOrderBookClient(webClient, objectMapper, krakenPair, orderBookDepth,
                                         new WallStrengthCalculator(wallBand));
    }

    @Bean
    public OkxFundingRateClient okxFundingRateClient(@Qualifier("okxWebClient") WebClient webClient,
                                                     ObjectMapper objectMapper) {
        return new OkxFundingRateClient(webClient, objectMapper, okxInstId);
    }

    @Bean
    public OkxOpenInterestClient okxOpenInterestClient(@Qualifier("okxWebClient") WebClient webClient,
                                                       ObjectMapper objectMapper) {
        return new OkxOpenInterestClient(webClient, objectMapper, okxInstId);
    }

    @Bean
    public OkxLongShortRatioClient okxLongShortRatioClient(@Qualifier("okxWebClient") WebClient webClient,
                                                           ObjectMapper objectMapper) {
        return new OkxLongShortRatioClient(webClient, objectMapper, okxCcy);
    }

    @Bean
    public OkxLiquidationClient okxLiquidationClient(@Qualifier("okxWebClient") WebClient webClient,
                                                     ObjectMapper objectMapper) {
        return new OkxLiquidationClient(webClient, objectMapper, okxUnderlying);
    }

    @Bean
    public CryptoCompareNewsClient cryptoCompareNewsClient(@Qualifier("cryptoCompareWebClient") WebClient webClient,
                                                           ObjectMapper objectMapper) {
        return new CryptoCompareNewsClient(webClient, objectMapper, new HeadlineSentimentScorer(), headlineLimit);
    }

    @Bean
    public PolymarketClient polymarketClient(@Qualifier("polymarketWebClient") WebClient webClient,
                                             ObjectMapper objectMapper) {
        return new PolymarketClient(webClient, objectMapper, polymarketTag, Clock.systemUTC());
    }
}
