package com.polybot.mm.strategy.loop;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.strategy.model.QuoteFailure;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-market placement back-off. Repeated post-only crosses put a market on an escalating cooldown; any run of
 * consecutive failures opens the error circuit breaker for a fixed period.
 *
 * Owned by the loop thread.
 */
@Slf4j
@RequiredArgsConstructor
public class QuoteCooldowns {

    private final @NonNull Clock clock;
    private final @NonNull MmProperties.Quoting quoting;
    private final @NonNull MmProperties.CircuitBreaker circuitBreaker;

    private final Map<String, Integer> crossStreak = new HashMap<>();
    private final Map<String, Instant> crossCooldownUntil = new HashMap<>();
    private final Map<String, Integer> errorCount = new HashMap<>();
    private final Map<String, Instant> circuitOpenUntil = new HashMap<>();

    public void registerFailure(String marketId, Optional<QuoteFailure> failure) {
        Instant now = clock.instant();

        int errors = errorCount.merge(marketId, 1, Integer::sum);
        if (errors >= circuitBreaker.threshold() && !circuitOpenUntil.containsKey(marketId)) {
            circuitOpenUntil.put(marketId, now.plusSeconds(circuitBreaker.cooldownSeconds()));
            log.warn("circuit breaker open for {} after {} consecutive errors, cooling down {}s", marketId, errors,
                    circuitBreaker.cooldownSeconds());
        }

        if (failure.isPresent() && failure.get().isPostOnlyCross()) {
            int streak = crossStreak.merge(marketId, 1, Integer::sum);
            long seconds = cooldownSecondsForStreak(streak, quoting.crossRejectThreshold(),
                    quoting.crossCooldownSeconds(), quoting.crossCooldownMaxSeconds());
            if (seconds > 0) {
                crossCooldownUntil.put(marketId, now.plusSeconds(seconds));
                if (streak % quoting.crossRejectThreshold() == 0) {
                    log.warn("post-only cross streak {} on {}, cooling down {}s", streak, marketId, seconds);
                }
            }
        } else {
            crossStreak.remove(marketId);
        }
    }

    public void registerSuccess(String marketId) {
        clear(marketId);
    }

    /**
     * True while either cooldown is running. Expired entries are dropped; an expired circuit breaker also resets
     * the error count.
     */
    public boolean isBlocked(String marketId) {
        Instant now = clock.instant();
        boolean blocked = false;

        Instant crossUntil = crossCooldownUntil.get(marketId);
        if (crossUntil != null) {
            if (now.isBefore(crossUntil)) {
                blocked = true;
            } else {
                crossCooldownUntil.remove(marketId);
            }
        }

        Instant circuitUntil = circuitOpenUntil.get(marketId);
        if (circuitUntil != null) {
            if (now.isBefore(circuitUntil)) {
                blocked = true;
            } else {
                circuitOpenUntil.remove(marketId);
                errorCount.remove(marketId);
                log.info("circuit breaker closed for {}", marketId);
            }
        }
        return blocked;
    }

    public int crossStreak(String marketId) {
        return crossStreak.getOrDefault(marketId, 0);
    }

    public int errorCount(String marketId) {
        return errorCount.getOrDefault(marketId, 0);
    }

    public void clear(String marketId) {
        crossStreak.remove(marketId);
        crossCooldownUntil.remove(marketId);
        errorCount.remove(marketId);
        circuitOpenUntil.remove(marketId);
    }

    /**
     * 0 below the threshold; from there {@code base * level}, where the level rises by one every
     * {@code threshold} further crosses, capped at {@code max}.
     */
    public static long cooldownSecondsForStreak(int streak, int threshold, long base, long max) {
        if (threshold <= 0 || streak < threshold) {
            return 0L;
        }
        int level = 1 + (streak - threshold) / threshold;
        return Math.min(max, base * level);
    }
}
