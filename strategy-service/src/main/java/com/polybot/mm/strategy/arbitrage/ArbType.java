package com.polybot.mm.strategy.arbitrage;

public enum ArbType {
    /**
     * YES ask + NO ask below 1: buy both legs and merge them into collateral.
     */
    BUY_MERGE,
    /**
     * YES bid + NO bid above 1: split collateral into both legs and sell them.
     */
    SPLIT_SELL
}
