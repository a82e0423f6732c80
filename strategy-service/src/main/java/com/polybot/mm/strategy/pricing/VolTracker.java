package com.polybot.mm.strategy.pricing;

import java.util.HashMap;
import java.util.Map;

/**
 * Realized volatility per market as an EWMA of squared mid changes, in points. Owned by the loop thread.
 */
public class VolTracker {

    private final double alpha;
    private final Map<String, Double> ewmaVariance = new HashMap<>();
    private final Map<String, Double> lastMid = new HashMap<>();

    public VolTracker(int halflife) {
        this.alpha = 1 - Math.pow(0.5, 1.0 / Math.max(halflife, 1));
    }

    /**
     * Record a mid observation and return the current standard deviation in points; 0 until two valid mids
     * have been seen.
     */
    public double update(String marketId, double mid) {
        Double last = lastMid.put(marketId, mid);
        if (last == null || last <= 0 || mid <= 0) {
            return 0.0;
        }
        double change = (mid - last) * 100;
        double sq = change * change;
        double prev = ewmaVariance.getOrDefault(marketId, sq);
        double next = alpha * sq + (1 - alpha) * prev;
        ewmaVariance.put(marketId, next);
        return Math.sqrt(next);
    }

    public double vol(String marketId) {
        return Math.sqrt(ewmaVariance.getOrDefault(marketId, 0.0));
    }

    double alpha() {
        return alpha;
    }

    public void reset(String marketId) {
        ewmaVariance.remove(marketId);
        lastMid.remove(marketId);
    }
}
