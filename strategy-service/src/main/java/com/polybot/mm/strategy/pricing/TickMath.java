package com.polybot.mm.strategy.pricing;

/**
 * Price grid helpers. Polymarket trades on a 0.01 tick between 0.01 and 0.99.
 */
public final class TickMath {

    public static final double TICK = 0.01;
    public static final double MIN_PRICE = 0.01;
    public static final double MAX_PRICE = 0.99;

    private TickMath() {
    }

    public static double roundToTick(double price) {
        return round2(Math.round(price / TICK) * TICK);
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    /**
     * Round to the tick and clamp into the tradable range.
     */
    public static double clampPrice(double price) {
        return clamp(roundToTick(price), MIN_PRICE, MAX_PRICE);
    }
}
