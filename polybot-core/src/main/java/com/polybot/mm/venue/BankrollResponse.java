package com.polybot.mm.venue;

import java.math.BigDecimal;

/**
 * Executor-computed bankroll snapshot: free USDC plus the marked value of held positions.
 */
public record BankrollResponse(
    String mode,
    BigDecimal usdcBalance,
    BigDecimal positionsCurrentValueUsd,
    BigDecimal totalEquityUsd,
    int positionsCount,
    int mergeablePositionsCount,
    long asOfMillis
) {
}
