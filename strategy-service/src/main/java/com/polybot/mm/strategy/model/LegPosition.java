package com.polybot.mm.strategy.model;

import com.polybot.mm.domain.OrderSide;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Position in one outcome token with a weighted-average cost basis.
 */
public record LegPosition(
        String tokenId,
        BigDecimal position,
        BigDecimal avgEntryPrice,
        BigDecimal realizedPnl
) {
    private static final MathContext MC = MathContext.DECIMAL64;

    public LegPosition {
        if (position == null) position = BigDecimal.ZERO;
        if (avgEntryPrice == null) avgEntryPrice = BigDecimal.ZERO;
        if (realizedPnl == null) realizedPnl = BigDecimal.ZERO;
    }

    public static LegPosition empty(String tokenId) {
        return new LegPosition(tokenId, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public boolean isFlat() {
        return position.signum() == 0;
    }

    public boolean hasBasis() {
        return avgEntryPrice.signum() > 0;
    }

    public LegPosition withTokenId(String newTokenId) {
        if (newTokenId == null || newTokenId.equals(tokenId)) {
            return this;
        }
        return new LegPosition(newTokenId, position, avgEntryPrice, realizedPnl);
    }

    public LegPosition withPosition(BigDecimal newPosition) {
        return new LegPosition(tokenId, newPosition, avgEntryPrice, realizedPnl);
    }

    /**
     * Weighted-average-cost update. Growing a position re-averages its cost; reducing realizes
     * {@code closed × (price − avg)} on a long or {@code closed × (avg − price)} on a short; a fill that crosses
     * zero re-bases the remainder at the fill price, and a fill that closes it to zero clears the basis.
     */
    public LegPosition applyFill(OrderSide side, BigDecimal price, BigDecimal size) {
        BigDecimal delta = side == OrderSide.BUY ? size : size.negate();
        BigDecimal old = position;
        BigDecimal next = old.add(delta);
        BigDecimal avg = avgEntryPrice;
        BigDecimal realized = realizedPnl;

        if (delta.signum() > 0 && old.signum() >= 0) {
            avg = avg.multiply(old).add(price.multiply(delta)).divide(next, MC);
        } else if (delta.signum() < 0 && old.signum() > 0) {
            BigDecimal closed = delta.abs().min(old);
            realized = realized.add(closed.multiply(price.subtract(avg)));
            if (next.signum() < 0) {
                avg = price;
            }
        } else if (delta.signum() < 0) {
            avg = avg.multiply(old.abs()).add(price.multiply(delta.abs())).divide(next.abs(), MC);
        } else if (delta.signum() > 0) {
            BigDecimal closed = delta.min(old.abs());
            realized = realized.add(closed.multiply(avg.subtract(price)));
            if (next.signum() > 0) {
                avg = price;
            }
        }
        if (next.signum() == 0) {
            avg = BigDecimal.ZERO;
        }
        return new LegPosition(tokenId, next, avg, realized);
    }
}
