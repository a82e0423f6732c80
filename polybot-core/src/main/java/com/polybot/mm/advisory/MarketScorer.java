package com.polybot.mm.advisory;

import com.polybot.mm.domain.MarketRef;

/**
 * Scores how suitable a market is for market making, on a 0-10 scale.
 */
public interface MarketScorer {

  double score(MarketRef market);
}
