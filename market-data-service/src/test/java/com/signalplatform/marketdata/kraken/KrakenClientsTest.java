package com.signalplatform.marketdata.kraken;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.FetchFailure;
import com.signalplatform.common.model.SourceKind;
import com.signalplatform.marketdata.source.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class KrakenClientsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    @DisplayName("ticker")
    class TickerTests {

        @Test
        @DisplayName("last trade price is read from c[0]")
        void parsesLastPrice() {
            StubExchange stub = StubExchange.create().json("/0/public/Ticker", """
                {"error":[],"result":{"XXBTZUSD":{"a":["65010.1","1","1.000"],"c":["65001.50000","0.0012"]}}}
                """);
            KrakenTickerClient client = new KrakenTickerClient(stub.webClient(), objectMapper, "XBTUSD");

            StepVerifier.create(client.fetch())
                .assertNext(q -> {
                    assertEquals("XBTUSD", q.pair());
                    assertEquals(65_001.5, q.lastPrice());
                })
                .verifyComplete();
            assertEquals("pair=XBTUSD", stub.requests().get(0).getQuery());
        }

        @Test
        @DisplayName("non-empty error array → malformed payload")
        void errorArray_malformed() {
            StubExchange stub = StubExchange.create().json("/0/public/Ticker",
                "{\"error\":[\"EQuery:Unknown asset pair\"],\"result\":{}}");
            KrakenTickerClient client = new KrakenTickerClient(stub.webClient(), objectMapper, "XBTUSD");

            StepVerifier.create(client.fetch())
                .expectErrorSatisfies(e -> {
                    SourceFetchException sfe = assertInstanceOf(SourceFetchException.class, e);
                    assertEquals(FetchFailure.MALFORMED_PAYLOAD, sfe.getReason());
                    assertEquals(SourceKind.PRICE_TICKER, sfe.getKind());
                    assertTrue(sfe.getMessage().contains("Unknown asset pair"));
                })
                .verify();
        }

        @Test
        @DisplayName("invalid JSON → malformed payload")
        void invalidJson_malformed() {
            StubExchange stub = StubExchange.create().json("/0/public/Ticker", "<html>maintenance</html>");
            KrakenTickerClient client = new KrakenTickerClient(stub.webClient(), objectMapper, "XBTUSD");

            StepVerifier.create(client.fetch())
                .expectError(SourceFetchException.class)
                .verify();
        }

        @Test
        @DisplayName("HTTP error → transport error, not a payload error")
        void httpError_transport() {
            StubExchange stub = StubExchange.create().respond("/0/public/Ticker", HttpStatus.BAD_GATEWAY, "");
            KrakenTickerClient client = new KrakenTickerClient(stub.webClient(), objectMapper, "XBTUSD");

            StepVerifier.create(client.fetch())
                .expectError(WebClientResponseException.class)
                .verify();
        }
    }

    @Test
    @DisplayName("order book → wall strength around the mid price")
    void orderBook_wallStrength() {
        StubExchange stub = StubExchange.create().json("/0/public/Depth", """
            {"error":[],"result":{"XXBTZUSD":{
              "bids":[["99.5","2.0",1700000000],["99.0","3.0",1700000000],["90.0","100.0",1700000000]],
              "asks":[["100.5","1.0",1700000000],["101.0","1.5",1700000000],["110.0","100.0",1700000000]]
            }}}
            """);
        KrakenOrderBookClient client = new KrakenOrderBookClient(stub.webClient(), objectMapper, "XBTUSD", 100,
                                                                 new WallStrengthCalculator(0.01));

        StepVerifier.create(client.fetch())
            .assertNext(w -> {
                assertEquals(5.0, w.bidWallVolume(), 1e-9);
                assertEquals(2.5, w.askWallVolume(), 1e-9);
                assertEquals(2.0, w.wallRatio(), 1e-9);
            })
            .verifyComplete();
        assertTrue(stub.requests().get(0).getQuery().contains("count=100"));
    }

    @Test
    @DisplayName("order book level with a non-numeric price → malformed payload")
    void orderBook_badLevel_malformed() {
        StubExchange stub = StubExchange.create().json("/0/public/Depth",
            "{\"error\":[],\"result\":{\"XXBTZUSD\":{\"bids\":[[\"n/a\",\"1\",0]],\"asks\":[]}}}");
        KrakenOrderBookClient client = new KrakenOrderBookClient(stub.webClient(), objectMapper, "XBTUSD", 100,
                                                                 new WallStrengthCalculator(0.01));

        StepVerifier.create(client.fetch())
            .expectErrorMatches(e -> e instanceof SourceFetchException sfe
                && sfe.getReason() == FetchFailure.MALFORMED_PAYLOAD)
            .verify();
    }
}
