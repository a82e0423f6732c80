package com.polybot.mm.store;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted per-token position, keyed by (marketId, tokenId).
 */
public record InventoryRecord(
    String marketId,
    String tokenId,
    BigDecimal netPosition,
    BigDecimal avgEntryPrice,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    Instant updatedAt
) {
  public InventoryRecord {
    netPosition = netPosition == null ? BigDecimal.ZERO : netPosition;
    avgEntryPrice = avgEntryPrice == null ? BigDecimal.ZERO : avgEntryPrice;
    unrealizedPnl = unrealizedPnl == null ? BigDecimal.ZERO : unrealizedPnl;
    realizedPnl = realizedPnl == null ? BigDecimal.ZERO : realizedPnl;
  }
}
