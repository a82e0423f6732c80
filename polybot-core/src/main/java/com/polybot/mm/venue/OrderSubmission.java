package com.polybot.mm.venue;

import java.util.Optional;

/**
 * Outcome of a limit order placement: either a venue order id or the error that prevented it.
 */
public record OrderSubmission(
    String orderId,
    OrderError error
) {

  public static OrderSubmission placed(String orderId) {
    return new OrderSubmission(orderId, null);
  }

  public static OrderSubmission rejected(OrderError error) {
    return new OrderSubmission(null, error);
  }

  public boolean isPlaced() {
    return orderId != null && !orderId.isBlank();
  }

  public Optional<OrderError> errorIfAny() {
    return Optional.ofNullable(error);
  }
}
