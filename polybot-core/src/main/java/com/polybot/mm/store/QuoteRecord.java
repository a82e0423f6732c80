package com.polybot.mm.store;

import java.time.Instant;

/**
 * Persisted quote pair. Either price (and its order id) may be absent for a one-sided quote.
 */
public record QuoteRecord(
    Long id,
    String marketId,
    String tokenId,
    String bidOrderId,
    String askOrderId,
    Double bidPrice,
    Double askPrice,
    double midPrice,
    double size,
    String status,
    Instant createdAt,
    Instant updatedAt
) {

  public static final String ACTIVE = "active";
  public static final String CANCELLED = "cancelled";
  public static final String FILLED = "filled";
  public static final String REPLACED = "replaced";
  public static final String KILLED_BY_GUARD = "killed_by_guard";

  public QuoteRecord withId(long newId) {
    return new QuoteRecord(newId, marketId, tokenId, bidOrderId, askOrderId, bidPrice, askPrice, midPrice, size,
        status, createdAt, updatedAt);
  }

  public QuoteRecord withStatus(String newStatus, Instant at) {
    return new QuoteRecord(id, marketId, tokenId, bidOrderId, askOrderId, bidPrice, askPrice, midPrice, size,
        newStatus, createdAt, at);
  }

  public boolean isActive() {
    return ACTIVE.equals(status);
  }
}
