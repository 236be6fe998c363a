package com.signalplatform.common.evaluator;

import com.signalplatform.common.model.SignalKind;
import com.signalplatform.common.model.SubSignalResult;
import com.signalplatform.common.model.payload.WallStrength;

import java.util.Optional;

/**
 * Reads bid/ask wall imbalance near the mid price.
 *
 * <pre>
 *   ratio &ge; wallBidStrong → UP     support below,    strength = min(1, (ratio − 1) / 2)
 *   ratio &le; wallAskStrong → DOWN   resistance above, strength = min(1, (1 − ratio) / 0.5)
 * </pre>
 */
public class OrderBookWallEvaluator extends AbstractSubSignalEvaluator<WallStrength> {

    private final double bidStrong;
    private final double askStrong;

    public OrderBookWallEvaluator(double weight, EvaluatorThresholds thresholds) {
        super(SignalKind.ORDER_BOOK, WallStrength.class, weight);
        this.bidStrong = thresholds.wallBidStrong();
        this.askStrong = thresholds.wallAskStrong();
    }

    @Override
    protected Optional<SubSignalResult> assess(WallStrength walls) {
        double ratio = walls.wallRatio();
        double bids  = walls.bidWallVolume();
        double asks  = walls.askWallVolume();

        if (Double.isNaN(ratio) || (bids <= 0.0 && asks <= 0.0)) {
            return noData();
        }
        if (ratio >= bidStrong) {
            double strength = Double.isInfinite(ratio) ? 1.0 : Math.min(1.0, (ratio - 1.0) / 2.0);
            return up(strength,
                fmt("Bid wall dominant - bids %.2f vs asks %.2f (ratio %.2f) - support below", bids, asks, ratio));
        }
        if (ratio <= askStrong) {
            return down(Math.min(1.0, (1.0 - ratio) / 0.5),
                fmt("Ask wall dominant - bids %.2f vs asks %.2f (ratio %.2f) - resistance above", bids, asks, ratio));
        }
        return neutral(fmt("Walls balanced - ratio %.2f", ratio));
    }
}
