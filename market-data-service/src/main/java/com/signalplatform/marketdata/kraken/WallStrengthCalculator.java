package com.signalplatform.marketdata.kraken;

import com.signalplatform.common.model.payload.WallStrength;

import java.util.List;

/**
 * Sums resting volume within a fixed band around the mid price.
 *
 * <pre>
 *   mid        = (bestBid + bestAsk) / 2
 *   bid volume = Σ volume of bids with price &ge; mid × (1 − band)
 *   ask volume = Σ volume of asks with price &le; mid × (1 + band)
 *   ratio      = bid volume / ask volume, +∞ when ask volume is 0
 * </pre>
 *
 * With one side of the book empty the mid is the best price of the other side. Stateless.
 */
public class WallStrengthCalculator {

    public static final double DEFAULT_BAND = 0.01;

    private final double band;

    public WallStrengthCalculator(double band) {
        if (!(band > 0.0 && band < 1.0)) {
            throw new IllegalArgumentException("Wall band must be in (0, 1), was " + band);
        }
        this.band = band;
    }

    public double band() {
        return band;
    }

    /**
     * @param bids best (highest) first
     * @param asks best (lowest) first
     */
    public WallStrength calculate(List<Level> bids, List<Level> asks) {
        double mid = midPrice(bids, asks);
        double lower = mid * (1.0 - band);
        double upper = mid * (1.0 + band);

        double bidVolume = bids.stream().filter(l -> l.price() >= lower).mapToDouble(Level::volume).sum();
        double askVolume = asks.stream().filter(l -> l.price() <= upper).mapToDouble(Level::volume).sum();

        double ratio = askVolume > 0.0 ? bidVolume / askVolume : Double.POSITIVE_INFINITY;
        return new WallStrength(bidVolume, askVolume, ratio, mid, band);
    }

    private static double midPrice(List<Level> bids, List<Level> asks) {
        if (bids.isEmpty() && asks.isEmpty()) return 0.0;
        if (bids.isEmpty()) return asks.get(0).price();
        if (asks.isEmpty()) return bids.get(0).price();
        return (bids.get(0).price() + asks.get(0).price()) / 2.0;
    }

    /** One price level of the book. */
    public record Level(double price, double volume) {}
}
