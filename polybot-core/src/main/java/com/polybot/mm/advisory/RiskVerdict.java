package com.polybot.mm.advisory;

public record RiskVerdict(
    boolean approved,
    double sizeMultiplier,
    double riskScore,
    String reason
) {

  public static RiskVerdict approve(double sizeMultiplier, double riskScore, String reason) {
    return new RiskVerdict(true, sizeMultiplier, riskScore, reason);
  }

  public static RiskVerdict reject(double riskScore, String reason) {
    return new RiskVerdict(false, 0.0, riskScore, reason);
  }
}
