package com.polybot.mm.strategy.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of one side of a quote. A fill can still arrive after a cancel was sent, so CANCELLED may move to
 * FILLED; FILLED is the only true terminal state.
 */
public enum OrderState {
    NEW,
    LIVE,
    PARTIAL,
    FILLED,
    CANCELLED,
    UNKNOWN;

    private static final Map<OrderState, Set<OrderState>> TRANSITIONS = Map.of(
            NEW, EnumSet.of(LIVE, FILLED, CANCELLED, UNKNOWN),
            LIVE, EnumSet.of(PARTIAL, FILLED, CANCELLED, UNKNOWN),
            PARTIAL, EnumSet.of(FILLED, CANCELLED, UNKNOWN),
            FILLED, EnumSet.noneOf(OrderState.class),
            CANCELLED, EnumSet.of(FILLED),
            UNKNOWN, EnumSet.of(LIVE, PARTIAL, FILLED, CANCELLED)
    );

    public boolean canTransitionTo(OrderState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * Order still resting (or about to) on the book.
     */
    public boolean isOpen() {
        return this == NEW || this == LIVE || this == PARTIAL;
    }

    public boolean isDone() {
        return this == FILLED || this == CANCELLED;
    }

    public static OrderState fromVenueStatus(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "LIVE", "ACTIVE", "OPEN" -> LIVE;
            case "MATCHED", "FILLED" -> FILLED;
            case "CANCELLED", "CANCELED", "EXPIRED" -> CANCELLED;
            default -> UNKNOWN;
        };
    }
}
