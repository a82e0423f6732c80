package com.polybot.mm.strategy.pricing;

/**
 * Everything a pricing engine needs for one market at one instant.
 *
 * @param mid               weighted mid (0-1)
 * @param bookSpreadPts     observed top-of-book spread in points
 * @param imbalance         book imbalance in [-1, 1]
 * @param staleness         0 = fresh, 1 = stale
 * @param trackedVolPts     EWMA volatility in points, 0 when not yet known
 * @param netPosition       YES shares held (positive = long)
 * @param avgEntryPrice     YES average entry, 0 when unknown
 * @param maxPerMarketUsd   capital capacity for this market
 * @param skewDirection     inventory ratio in [-1, 1]
 * @param unwindUrgency     position-age urgency in [0, 1]
 * @param kappa             estimated order-arrival intensity
 * @param daysToResolution  days until the market resolves
 */
public record PricingInput(
        double mid,
        double bookSpreadPts,
        double imbalance,
        double staleness,
        double trackedVolPts,
        double netPosition,
        double avgEntryPrice,
        double maxPerMarketUsd,
        double skewDirection,
        double unwindUrgency,
        double kappa,
        double daysToResolution
) {
    /**
     * Spread-derived volatility proxy, floored at one point.
     */
    public double volProxyPts() {
        return Math.max(bookSpreadPts * 0.5, 1.0);
    }

    public double effectiveVolPts() {
        return trackedVolPts > 0 ? trackedVolPts : volProxyPts();
    }
}
