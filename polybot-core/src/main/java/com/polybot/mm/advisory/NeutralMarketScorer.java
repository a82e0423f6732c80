package com.polybot.mm.advisory;

import com.polybot.mm.domain.MarketRef;

public class NeutralMarketScorer implements MarketScorer {

  private final double score;

  public NeutralMarketScorer(double score) {
    this.score = score;
  }

  @Override
  public double score(MarketRef market) {
    return score;
  }
}
