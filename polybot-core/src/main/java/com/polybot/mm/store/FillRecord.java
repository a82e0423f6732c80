package com.polybot.mm.store;

import com.polybot.mm.domain.OrderSide;

import java.time.Instant;

public record FillRecord(
    Long id,
    Long quoteId,
    String orderId,
    String marketId,
    String tokenId,
    OrderSide side,
    double price,
    double size,
    double fee,
    Double midAtFill,
    Double midAt30s,
    Double midAt120s,
    Instant filledAt
) {

  public FillRecord withId(long newId) {
    return new FillRecord(newId, quoteId, orderId, marketId, tokenId, side, price, size, fee, midAtFill, midAt30s,
        midAt120s, filledAt);
  }

  public FillRecord withLaterMids(Double at30s, Double at120s) {
    return new FillRecord(id, quoteId, orderId, marketId, tokenId, side, price, size, fee, midAtFill,
        at30s != null ? at30s : midAt30s, at120s != null ? at120s : midAt120s, filledAt);
  }
}
