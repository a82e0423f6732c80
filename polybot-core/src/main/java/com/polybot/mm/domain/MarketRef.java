package com.polybot.mm.domain;

/**
 * A binary market selected for quoting. The YES token is the quoted instrument; the NO token and condition id
 * are only needed for split/merge and complete-set arbitrage.
 */
public record MarketRef(
    String marketId,
    String tokenId,
    String noTokenId,
    String conditionId,
    String question,
    Double daysToResolution
) {
  public MarketRef {
    if (daysToResolution == null) {
      daysToResolution = 30.0;
    }
  }

  public boolean supportsCompleteSet() {
    return noTokenId != null && !noTokenId.isBlank() && conditionId != null && !conditionId.isBlank();
  }
}
