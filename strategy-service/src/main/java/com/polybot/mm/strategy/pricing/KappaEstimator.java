package com.polybot.mm.strategy.pricing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Order-arrival intensity from the fill rate over a sliding window, in fills per minute clamped to [0.5, 10].
 */
public class KappaEstimator {

    private static final double MIN_KAPPA = 0.5;
    private static final double MAX_KAPPA = 10.0;

    private final Clock clock;
    private final Duration window;
    private final double defaultKappa;
    private final Map<String, Deque<Instant>> fills = new HashMap<>();

    public KappaEstimator(Clock clock, Duration window, double defaultKappa) {
        this.clock = clock;
        this.window = window;
        this.defaultKappa = defaultKappa;
    }

    public void recordFill(String marketId) {
        Instant now = clock.instant();
        Deque<Instant> times = fills.computeIfAbsent(marketId, k -> new ArrayDeque<>());
        times.addLast(now);
        evict(times, now);
    }

    public double kappa(String marketId) {
        Deque<Instant> times = fills.get(marketId);
        if (times == null) {
            return defaultKappa;
        }
        evict(times, clock.instant());
        if (times.size() < 2) {
            return defaultKappa;
        }
        double spanSeconds = Duration.between(times.peekFirst(), times.peekLast()).toMillis() / 1000.0;
        if (spanSeconds <= 0) {
            return defaultKappa;
        }
        double ratePerMinute = (times.size() - 1) / (spanSeconds / 60.0);
        return Math.max(MIN_KAPPA, Math.min(MAX_KAPPA, ratePerMinute));
    }

    public void reset(String marketId) {
        fills.remove(marketId);
    }

    private void evict(Deque<Instant> times, Instant now) {
        Instant cutoff = now.minus(window);
        while (!times.isEmpty() && times.peekFirst().isBefore(cutoff)) {
            times.pollFirst();
        }
    }
}
