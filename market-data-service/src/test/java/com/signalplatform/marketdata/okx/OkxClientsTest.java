package com.signalplatform.marketdata.okx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.SourceFetchException;
import com.signalplatform.common.model.FetchFailure;
import com.signalplatform.common.model.payload.LiquidationSummary;
import com.signalplatform.marketdata.source.StubExchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class OkxClientsTest {

    private static final String INST = "BTC-USDT-SWAP";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static boolean isMalformed(Throwable e) {
        return e instanceof SourceFetchException sfe && sfe.getReason() == FetchFailure.MALFORMED_PAYLOAD;
    }

    @Nested
    @DisplayName("funding rate")
    class FundingRateTests {

        private static final String CURRENT = """
            {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","fundingRate":"0.00008","fundingTime":"1772380800000"}]}
            """;

        @Test
        @DisplayName("current rate and settlement history are combined")
        void currentAndHistory() {
            StubExchange stub = StubExchange.create()
                .json("/api/v5/public/funding-rate", CURRENT)
                .json("/api/v5/public/funding-rate-history", """
                    {"code":"0","msg":"","data":[
                      {"fundingRate":"0.0001","fundingTime":"1772352000000"},
                      {"fundingRate":"-0.00002","fundingTime":"1772323200000"}]}
                    """);
            OkxFundingRateClient client = new OkxFundingRateClient(stub.webClient(), objectMapper, INST);

            StepVerifier.create(client.fetch())
                .assertNext(f -> {
                    assertEquals(INST, f.instrument());
                    assertEquals(0.00008, f.currentRate());
                    assertEquals(1772380800000L, f.nextFundingTime());
                    assertEquals(2, f.recentRates().size());
                    assertEquals(-0.00002, f.recentRates().get(1).rate());
                })
                .verifyComplete();
            assertTrue(stub.requests().stream().anyMatch(u -> u.getQuery().contains("limit=10")));
        }

        @Test
        @DisplayName("history failure → current rate with an empty history")
        void historyFailure_degrades() {
            StubExchange stub = StubExchange.create()
                .json("/api/v5/public/funding-rate", CURRENT)
                .respond("/api/v5/public/funding-rate-history", HttpStatus.SERVICE_UNAVAILABLE, "");
            OkxFundingRateClient client = new OkxFundingRateClient(stub.webClient(), objectMapper, INST);

            StepVerifier.create(client.fetch())
                .assertNext(f -> {
                    assertEquals(0.00008, f.currentRate());
                    assertTrue(f.recentRates().isEmpty());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("OKX error code → malformed payload")
        void errorCode_malformed() {
            StubExchange stub = StubExchange.create()
                .json("/api/v5/public/funding-rate", "{\"code\":\"51001\",\"msg\":\"Instrument ID does not exist\",\"data\":[]}")
                .json("/api/v5/public/funding-rate-history", "{\"code\":\"0\",\"data\":[]}");
            OkxFundingRateClient client = new OkxFundingRateClient(stub.webClient(), objectMapper, INST);

            StepVerifier.create(client.fetch())
                .expectErrorSatisfies(e -> {
                    assertTrue(isMalformed(e));
                    assertTrue(e.getMessage().contains("51001"));
                })
                .verify();
        }

        @Test
        @DisplayName("empty data → malformed payload")
        void emptyData_malformed() {
            StubExchange stub = StubExchange.create()
                .json("/api/v5/public/funding-rate", "{\"code\":\"0\",\"msg\":\"\",\"data\":[]}")
                .json("/api/v5/public/funding-rate-history", "{\"code\":\"0\",\"data\":[]}");
            OkxFundingRateClient client = new OkxFundingRateClient(stub.webClient(), objectMapper, INST);

            StepVerifier.create(client.fetch())
                .expectErrorMatches(OkxClientsTest::isMalformed)
                .verify();
        }
    }

    @Test
    @DisplayName("open interest → contracts, BTC and timestamp")
    void openInterest() {
        StubExchange stub = StubExchange.create().json("/api/v5/public/open-interest", """
            {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","oi":"2851234.5","oiCcy":"28512.345","ts":"1772380000000"}]}
            """);

        StepVerifier.create(new OkxOpenInterestClient(stub.webClient(), objectMapper, INST).fetch())
            .assertNext(oi -> {
                assertEquals(2_851_234.5, oi.contracts());
                assertEquals(28_512.345, oi.btc());
                assertEquals(1772380000000L, oi.timestamp());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("long/short ratio → newest point is current, history capped at 12")
    void longShortRatio() {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < 15; i++) {
            if (i > 0) data.append(',');
            data.append("[\"").append(1772380800000L - i * 3_600_000L).append("\",\"").append(1.5 + i * 0.1).append("\"]");
        }
        StubExchange stub = StubExchange.create().json("/api/v5/rubik/stat/contracts/long-short-account-ratio",
            "{\"code\":\"0\",\"msg\":\"\",\"data\":[" + data + "]}");

        StepVerifier.create(new OkxLongShortRatioClient(stub.webClient(), objectMapper, "BTC").fetch())
            .assertNext(ls -> {
                assertEquals(1.5, ls.currentRatio(), 1e-9);
                assertEquals(12, ls.history().size());
                assertEquals(1772380800000L, ls.history().get(0).timestamp());
            })
            .verifyComplete();
        assertTrue(stub.requests().get(0).getQuery().contains("period=1H"));
    }

    @Nested
    @DisplayName("liquidations")
    class LiquidationTests {

        @Test
        @DisplayName("events are split by position side and valued at bkPx × sz")
        void aggregatesBySide() {
            StubExchange stub = StubExchange.create().json("/api/v5/public/liquidation-orders", """
                {"code":"0","msg":"","data":[{"instId":"BTC-USDT-SWAP","details":[
                  {"posSide":"long","bkPx":"60000","sz":"2","ts":"1000"},
                  {"posSide":"short","bkPx":"61000","sz":"1","ts":"3000"},
                  {"posSide":"long","bkPx":"59000","sz":"1","ts":"2000"},
                  {"posSide":"net","bkPx":"60500","sz":"1","ts":"4000"}
                ]}]}
                """);

            StepVerifier.create(new OkxLiquidationClient(stub.webClient(), objectMapper, "BTC-USDT").fetch())
                .assertNext(l -> {
                    assertEquals(179_000.0, l.longLiquidationUsd(), 1e-6);
                    assertEquals(61_000.0, l.shortLiquidationUsd(), 1e-6);
                    assertEquals(2, l.longCount());
                    assertEquals(1, l.shortCount());
                    assertEquals(240_000.0, l.totalUsd(), 1e-6);
                    assertEquals(4, l.recentEvents().size());
                    assertEquals(4000L, l.recentEvents().get(0).time());
                    assertEquals(1000L, l.recentEvents().get(3).time());
                })
                .verifyComplete();
            assertTrue(stub.requests().get(0).getQuery().contains("state=filled"));
        }

        @Test
        @DisplayName("no liquidations → empty summary, not an error")
        void emptyData_emptySummary() {
            StubExchange stub = StubExchange.create().json("/api/v5/public/liquidation-orders",
                "{\"code\":\"0\",\"msg\":\"\",\"data\":[]}");

            StepVerifier.create(new OkxLiquidationClient(stub.webClient(), objectMapper, "BTC-USDT").fetch())
                .assertNext(l -> {
                    assertEquals(0.0, l.totalUsd());
                    assertTrue(l.recentEvents().isEmpty());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("more than 20 events → newest 20 kept")
        void recentEventsCapped() {
            StringBuilder details = new StringBuilder();
            for (int i = 0; i < 25; i++) {
                if (i > 0) details.append(',');
                details.append("{\"posSide\":\"short\",\"bkPx\":\"100\",\"sz\":\"1\",\"ts\":\"").append(i).append("\"}");
            }
            StubExchange stub = StubExchange.create().json("/api/v5/public/liquidation-orders",
                "{\"code\":\"0\",\"data\":[{\"details\":[" + details + "]}]}");

            LiquidationSummary summary = new OkxLiquidationClient(stub.webClient(), objectMapper, "BTC-USDT")
                .fetch().block();

            assertNotNull(summary);
            assertEquals(25, summary.shortCount());
            assertEquals(20, summary.recentEvents().size());
            assertEquals(24L, summary.recentEvents().get(0).time());
        }
    }
}
