package com.polybot.mm.strategy.arbitrage;

public record ArbResult(
        ArbType type,
        String marketId,
        boolean success,
        String error,
        double size,
        double yesFilled,
        double noFilled,
        double profitUsd
) {

    static ArbResult failed(ArbOpportunity opp, double size, String error, double yesFilled, double noFilled) {
        return new ArbResult(opp.type(), opp.marketId(), false, error, size, yesFilled, noFilled, 0.0);
    }
}
