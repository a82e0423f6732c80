package com.polybot.mm.strategy.pricing;

import com.polybot.mm.strategy.model.QuotePair;

import java.time.Duration;
import java.time.Instant;

public final class QuoteSizing {

    private QuoteSizing() {
    }

    /**
     * Quote size in USDC: 0 at capacity, otherwise the smallest of the base size, the per-market cap, 10% of
     * capital and the remaining capacity.
     */
    public static double computeQuoteSize(double capital, double maxPerMarket, double inventoryUsd,
                                          double maxInventory, double baseSizeUsd) {
        double remaining = maxInventory - Math.abs(inventoryUsd);
        if (remaining <= 0) {
            return 0.0;
        }
        double size = Math.min(Math.min(baseSizeUsd, maxPerMarket), Math.min(capital * 0.1, remaining));
        return Math.max(0.0, TickMath.round2(size));
    }

    /**
     * True when the market mid moved at least {@code thresholdPts} from where the pair was quoted.
     */
    public static boolean shouldRequote(QuotePair pair, double newMid, double thresholdPts) {
        if (pair == null) {
            return true;
        }
        double reference = pair.getQuotedMid() > 0 ? pair.getQuotedMid() : pair.mid();
        return Math.abs(newMid - reference) * 100 >= thresholdPts;
    }

    /**
     * Anti-churn gate: never replace a quote younger than the minimum lifetime.
     */
    public static boolean shouldCancelForRequote(QuotePair pair, double newMid, double thresholdPts,
                                                 Duration minLifetime, Instant now) {
        if (pair.age(now).compareTo(minLifetime) < 0) {
            return false;
        }
        return shouldRequote(pair, newMid, thresholdPts);
    }
}
