package com.polybot.mm.venue;

import com.polybot.mm.domain.OrderSide;

public record LimitOrderRequest(
    String tokenId,
    OrderSide side,
    double price,
    double size,
    String orderType,
    boolean postOnly
) {
  public LimitOrderRequest {
    if (orderType == null || orderType.isBlank()) {
      orderType = "GTC";
    }
  }

  public static LimitOrderRequest gtc(String tokenId, OrderSide side, double price, double size, boolean postOnly) {
    return new LimitOrderRequest(tokenId, side, price, size, "GTC", postOnly);
  }
}
