package com.polybot.mm.advisory;

/**
 * What the bot is about to do, as submitted to the risk officer.
 */
public record TradeIntent(
    String marketId,
    String kind,
    double sizeUsd,
    double expectedProfitPct,
    String description
) {
}
