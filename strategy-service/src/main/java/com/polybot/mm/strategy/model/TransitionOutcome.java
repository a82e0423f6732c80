package com.polybot.mm.strategy.model;

public enum TransitionOutcome {
    APPLIED,
    NO_CHANGE,
    REJECTED;

    public boolean changed() {
        return this == APPLIED;
    }
}
