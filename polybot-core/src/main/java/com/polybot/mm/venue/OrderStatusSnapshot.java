package com.polybot.mm.venue;

/**
 * Normalized view of a venue order, as returned by a status poll.
 *
 * @param filled       true when the venue reports the order fully matched
 * @param status       raw upper-cased venue status (LIVE, MATCHED, CANCELLED, ...)
 * @param sizeMatched  shares matched so far
 * @param avgFillPrice average execution price, when the venue reports one
 * @param feesPaid     fees charged on the matched quantity
 */
public record OrderStatusSnapshot(
    boolean filled,
    String status,
    double sizeMatched,
    Double avgFillPrice,
    double feesPaid
) {

  public static final String UNKNOWN = "UNKNOWN";
  public static final String ERROR = "ERROR";

  public OrderStatusSnapshot {
    if (status == null || status.isBlank()) {
      status = UNKNOWN;
    }
  }

  public static OrderStatusSnapshot unknown() {
    return new OrderStatusSnapshot(false, UNKNOWN, 0.0, null, 0.0);
  }

  public static OrderStatusSnapshot error() {
    return new OrderStatusSnapshot(false, ERROR, 0.0, null, 0.0);
  }
}
