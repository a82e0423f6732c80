package com.polybot.mm.strategy.risk;

/**
 * Share of total capital committed to open positions, in percent with one decimal.
 */
public record ExposureCheck(boolean withinLimit, double exposurePct) {
}
