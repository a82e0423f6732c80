package com.polybot.mm.strategy.pricing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * How long a market's mid has gone unchanged, as a 0..1 factor of the stale threshold.
 */
public class StaleTracker {

    private static final double EPSILON = 1e-6;

    private final Clock clock;
    private final Duration threshold;
    private final Map<String, Double> lastMid = new HashMap<>();
    private final Map<String, Instant> lastChange = new HashMap<>();

    public StaleTracker(Clock clock, Duration threshold) {
        this.clock = clock;
        this.threshold = threshold;
    }

    public void updateIfChanged(String marketId, double mid) {
        Double prev = lastMid.put(marketId, mid);
        if (prev == null || Math.abs(mid - prev) > EPSILON) {
            lastChange.put(marketId, clock.instant());
        }
    }

    public double staleness(String marketId) {
        Instant last = lastChange.get(marketId);
        if (last == null || threshold.isZero() || threshold.isNegative()) {
            return 0.0;
        }
        double elapsed = Duration.between(last, clock.instant()).toMillis();
        return Math.min(elapsed / threshold.toMillis(), 1.0);
    }

    public void reset(String marketId) {
        lastMid.remove(marketId);
        lastChange.remove(marketId);
    }
}
