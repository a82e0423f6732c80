package com.polybot.mm.strategy.pricing;

/**
 * Avellaneda-Stoikov model parameters. Spreads are in points.
 *
 * @param timeRemaining normalized time to resolution in (0, 1]
 */
public record AsParams(
        double gammaBase,
        double gammaAlpha,
        double kappa,
        double timeRemaining,
        double minSpreadPts,
        double maxSpreadPts
) {
    public AsParams withMarket(double newKappa, double newTimeRemaining) {
        return new AsParams(gammaBase, gammaAlpha, newKappa, newTimeRemaining, minSpreadPts, maxSpreadPts);
    }
}
