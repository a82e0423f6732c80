package com.polybot.mm.strategy.model;

/**
 * Drawdown regime. REDUCE halves capacity; KILL pauses all quoting.
 */
public enum RiskMode {
    OK,
    REDUCE,
    KILL
}
