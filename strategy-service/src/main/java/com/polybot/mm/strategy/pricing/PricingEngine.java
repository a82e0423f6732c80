package com.polybot.mm.strategy.pricing;

/**
 * Turns a market observation into a bid/ask pair on the tick grid, with {@code bid < ask}.
 */
public interface PricingEngine {

    QuotePrices quote(PricingInput input);

    String name();
}
