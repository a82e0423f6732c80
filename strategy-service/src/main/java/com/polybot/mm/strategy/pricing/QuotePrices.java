package com.polybot.mm.strategy.pricing;

public record QuotePrices(double bid, double ask) {

    public double spread() {
        return ask - bid;
    }

    public double spreadPts() {
        return (ask - bid) * 100.0;
    }
}
