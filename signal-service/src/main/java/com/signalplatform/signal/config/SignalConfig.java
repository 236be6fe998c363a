package com.signalplatform.signal.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalplatform.common.decision.DecisionEngine;
import com.signalplatform.common.decision.DecisionThresholds;
import com.signalplatform.common.decision.WeightedVotingDecisionEngine;
import com.signalplatform.common.evaluator.EvaluatorThresholds;
import com.signalplatform.common.evaluator.SignalWeights;
import com.signalplatform.common.evaluator.SubSignalEvaluator;
import com.signalplatform.common.evaluator.SubSignalEvaluators;
import com.signalplatform.common.history.HistoryLog;
import com.signalplatform.common.odds.OddsValueAssessor;
import com.signalplatform.signal.refresh.RefreshSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Decision-side wiring. Every record validates its own ranges, so a bad value in
 * {@code application.yml} fails the context at startup.
 */
@Configuration
public class SignalConfig {

    @Value("${signal.refresh.interval:45s}")
    private Duration refreshInterval;

    @Value("${signal.refresh.source-timeout:10s}")
    private Duration sourceTimeout;

    @Value("${signal.refresh.shutdown-grace:5s}")
    private Duration shutdownGrace;

    @Value("${signal.history.capacity:50}")
    private int historyCapacity;

    @Value("${signal.decision.up-threshold:0.3}")
    private double upThreshold;

    @Value("${signal.decision.down-threshold:0.3}")
    private double downThreshold;

    @Value("${signal.weights.funding:1.5}")
    private double fundingWeight;

    @Value("${signal.weights.liquidations:1.5}")
    private double liquidationsWeight;

    @Value("${signal.weights.order-book:1.0}")
    private double orderBookWeight;

    @Value("${signal.weights.long-short-ratio:0.5}")
    private double longShortWeight;

    @Value("${signal.weights.news:0.5}")
    private double newsWeight;

    @Value("${signal.thresholds.funding-high:0.0001}")
    private double fundingHigh;

    @Value("${signal.thresholds.funding-low:-0.0001}")
    private double fundingLow;

    @Value("${signal.thresholds.liquidation-dominance:1.5}")
    private double liquidationDominance;

    @Value("${signal.thresholds.wall-bid-strong:1.3}")
    private double wallBidStrong;

    @Value("${signal.thresholds.wall-ask-strong:0.77}")
    private double wallAskStrong;

    @Value("${signal.thresholds.long-short-high:2.5}")
    private double longShortHigh;

    @Value("${signal.thresholds.long-short-low:0.7}")
    private double longShortLow;

    @Value("${signal.thresholds.news-bullish:0.1}")
    private double newsBullish;

    @Value("${signal.thresholds.news-bearish:-0.1}")
    private double newsBearish;

    @Value("${signal.odds.max-share-price:0.55}")
    private double maxSharePrice;

    @Bean
    public SignalWeights signalWeights() {
        return new SignalWeights(fundingWeight, liquidationsWeight, orderBookWeight, longShortWeight, newsWeight);
    }

    @Bean
    public EvaluatorThresholds evaluatorThresholds() {
        return new EvaluatorThresholds(fundingHigh, fundingLow, liquidationDominance,
                                       wallBidStrong, wallAskStrong,
                                       longShortHigh, longShortLow,
                                       newsBullish, newsBearish);
    }

    @Bean
    public List<SubSignalEvaluator> subSignalEvaluators(SignalWeights weights, EvaluatorThresholds thresholds) {
        return SubSignalEvaluators.standard(weights, thresholds);
    }

    @Bean
    public DecisionEngine decisionEngine() {
        return new WeightedVotingDecisionEngine(new DecisionThresholds(upThreshold, downThreshold));
    }

    @Bean
    public OddsValueAssessor oddsValueAssessor() {
        return new OddsValueAssessor(maxSharePrice);
    }

    @Bean
    public HistoryLog historyLog() {
        return new HistoryLog(historyCapacity);
    }

    @Bean
    public RefreshSettings refreshSettings() {
        return new RefreshSettings(refreshInterval, sourceTimeout, shutdownGrace);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
