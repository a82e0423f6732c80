package com.polybot.mm.strategy.arbitrage;

import java.time.Instant;

/**
 * A mispriced complete set. Prices are the asks for {@link ArbType#BUY_MERGE} and the bids for
 * {@link ArbType#SPLIT_SELL}; {@code maxSize} is the shallower leg's depth in shares.
 */
public record ArbOpportunity(
        String marketId,
        String conditionId,
        String yesTokenId,
        String noTokenId,
        ArbType type,
        double yesPrice,
        double noPrice,
        double grossProfitPct,
        double netProfitPct,
        double maxSize,
        Instant detectedAt
) {
}
