package com.polybot.mm.advisory;

/**
 * Second opinion on a trade before it is sent. Implementations may be slow or remote.
 */
public interface RiskOfficer {

  RiskVerdict review(TradeIntent intent);
}
