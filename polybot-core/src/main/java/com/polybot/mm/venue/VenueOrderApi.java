package com.polybot.mm.venue;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Order-book venue as seen by the market maker. Expected venue-level rejections are reported through return
 * values, never thrown.
 */
public interface VenueOrderApi {

  OrderSubmission placeLimitOrder(LimitOrderRequest request);

  boolean cancelOrder(String orderId);

  OrderStatusSnapshot getOrderStatus(String orderId);

  Optional<BookSummary> getBookSummary(String tokenId);

  boolean mergePositions(String conditionId, double amount);

  boolean splitPosition(String conditionId, double amount);

  Set<String> getOpenOrderIds();

  /**
   * Spendable collateral (USDC) held by the trading wallet.
   */
  OptionalDouble getAvailableBalance();

  /**
   * Cash plus marked-to-market positions.
   */
  OptionalDouble getPortfolioValue();
}
