package com.polybot.mm.venue;

import com.polybot.mm.domain.OrderSide;

import java.time.Instant;

/**
 * Structured reason a venue refused or failed an order placement.
 */
public record OrderError(
    String code,
    OrderSide side,
    String tokenId,
    double price,
    double size,
    String details,
    Instant timestamp
) {

  public static final String POST_ONLY_CROSS = "post_only_cross";
  public static final String INSUFFICIENT_BALANCE = "insufficient_balance";
  public static final String INSUFFICIENT_TOKEN_BALANCE = "insufficient_token_balance";
  public static final String API_ERROR = "api_error";
  public static final String TIMEOUT = "timeout";
  public static final String EXCEPTION = "exception";

  public boolean isPostOnlyCross() {
    return POST_ONLY_CROSS.equals(code);
  }
}
