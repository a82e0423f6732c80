package com.polybot.mm.strategy.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-market inventory across both outcome legs.
 */
public record MarketInventory(
        String marketId,
        LegPosition yes,
        LegPosition no,
        Instant openedAt,
        Instant updatedAt
) {
    public MarketInventory {
        if (yes == null) yes = LegPosition.empty(null);
        if (no == null) no = LegPosition.empty(null);
    }

    public static MarketInventory empty(String marketId) {
        return new MarketInventory(marketId, LegPosition.empty(null), LegPosition.empty(null), null, null);
    }

    /**
     * YES+NO pairs that can be merged back into collateral.
     */
    public BigDecimal mergeablePairs() {
        if (yes.position().signum() > 0 && no.position().signum() > 0) {
            return yes.position().min(no.position());
        }
        return BigDecimal.ZERO;
    }

    public BigDecimal netPosition() {
        return yes.position();
    }

    public BigDecimal totalRealizedPnl() {
        return yes.realizedPnl().add(no.realizedPnl());
    }

    public boolean isFlat() {
        return yes.isFlat() && no.isFlat();
    }

    public Duration positionAge(Instant now) {
        if (openedAt == null || isFlat()) {
            return Duration.ZERO;
        }
        return Duration.between(openedAt, now);
    }

    public MarketInventory withLegs(LegPosition newYes, LegPosition newNo, Instant newOpenedAt, Instant now) {
        return new MarketInventory(marketId, newYes, newNo, newOpenedAt, now);
    }
}
