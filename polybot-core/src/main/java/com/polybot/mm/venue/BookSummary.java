package com.polybot.mm.venue;

/**
 * Top-of-book summary for one token. Depths are USDC notional summed over the best five levels.
 */
public record BookSummary(
    double bestBid,
    double bestAsk,
    double bidDepth,
    double askDepth,
    double minOrderSize
) {

  public BookSummary {
    if (minOrderSize <= 0) {
      minOrderSize = 5.0;
    }
  }

  public boolean hasMid() {
    return bestBid > 0 && bestAsk > 0;
  }

  public double mid() {
    return (bestBid + bestAsk) / 2.0;
  }

  public double spread() {
    return bestAsk - bestBid;
  }

  /**
   * (bid depth - ask depth) / total depth, in [-1, 1]; 0 for an empty book.
   */
  public double imbalance() {
    double total = bidDepth + askDepth;
    if (total <= 0) {
      return 0.0;
    }
    return (bidDepth - askDepth) / total;
  }
}
