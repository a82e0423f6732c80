package com.polybot.mm.advisory;

/**
 * The advisory oracles as seen by the market maker, already wrapped with timeouts and fallbacks.
 */
public record Advisors(
    RiskOfficer riskOfficer,
    MarketScorer marketScorer,
    EventRiskGuard eventRiskGuard
) {
}
