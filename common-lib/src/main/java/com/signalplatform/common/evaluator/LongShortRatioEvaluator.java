package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.payload.LongShortRatio;

import java.util.Optional;

/**
 * Contrarian read of the long/short account ratio. Typical range is 0.5–3.0.
 */
public class LongShortRatioEvaluator extends AbstractSubSignalEvaluator<LongShortRatio> {

    private final double high;
    private final double low;

    public LongShortRatioEvaluator(double weight, EvaluatorThresholds thresholds) {
        super(SignalKind.LONG_SHORT_RATIO, LongShortRatio.class, weight);
        this.high = thresholds.longShortHigh();
        this.low  = thresholds.longShortLow();
    }

    @Override
    protected Optional<SubSignalResult> assess(LongShortRatio ls) {
        Double ratio = ls.currentRatio();
        if (ratio == null || !Double.isFinite(ratio)) {
            return noData();
        }
        if (ratio >= high) {
            return down(Math.min(1.0, (ratio - 2.0) / 2.0),
                fmt("L/S ratio %.2f - longs very crowded (contrarian bearish)", ratio));
        }
        if (ratio <= low) {
            return up(Math.min(1.0, (1.0 - ratio) / 0.5),
                fmt("L/S ratio %.2f - shorts very crowded (contrarian bullish)", ratio));
        }
        return neutral(fmt("L/S ratio %.2f - within normal range", ratio));
    }
}
