package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.payload.FundingRate;

import java.util.Optional;

/**
 * Contrarian read of perpetual funding.
 *
 * <pre>
 *   rate &ge; fundingHigh  → DOWN   longs crowded, pullback risk
 *   rate &le; fundingLow   → UP     shorts crowded, squeeze risk
 *   strength = min(1, |rate| / (3 × |threshold|))
 * </pre>
 */
public class FundingRateEvaluator extends AbstractSubSignalEvaluator<FundingRate> {

    private final double high;
    private final double low;

    public FundingRateEvaluator(double weight, EvaluatorThresholds thresholds) {
        super(SignalKind.FUNDING_RATE, FundingRate.class, weight);
        this.high = thresholds.fundingHigh();
        this.low  = thresholds.fundingLow();
    }

    @Override
    protected Optional<SubSignalResult> assess(FundingRate funding) {
        Double rate = funding.currentRate();
        if (rate == null || !Double.isFinite(rate)) {
            return noData();
        }
        double pct = rate * 100;
        if (rate >= high) {
            return down(Math.min(1.0, rate / (high * 3)),
                fmt("Funding %.4f%% - longs crowded, risk of pullback", pct));
        }
        if (rate <= low) {
            return up(Math.min(1.0, Math.abs(rate) / (Math.abs(low) * 3)),
                fmt("Funding %.4f%% - shorts crowded, risk of squeeze up", pct));
        }
        return neutral(fmt("Funding %.4f%% - within normal range", pct));
    }
}
