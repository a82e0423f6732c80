package com.polybot.mm.advisory;

/**
 * Approves everything at a reduced size.
 */
public class DefaultRiskOfficer implements RiskOfficer {

  private final double sizeMultiplier;
  private final double riskScore;

  public DefaultRiskOfficer(double sizeMultiplier, double riskScore) {
    this.sizeMultiplier = sizeMultiplier;
    this.riskScore = riskScore;
  }

  @Override
  public RiskVerdict review(TradeIntent intent) {
    return RiskVerdict.approve(sizeMultiplier, riskScore, "default approval");
  }
}
