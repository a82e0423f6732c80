package com.polybot.mm.store;

import java.time.Instant;

public record HighWaterMark(
    double peakValue,
    double currentValue,
    double maxDrawdownPct,
    Instant updatedAt
) {

  /**
   * Fold a new portfolio valuation into the mark. The first valuation seeds the peak.
   */
  public static HighWaterMark next(HighWaterMark previous, double currentValue, Instant now) {
    double peak = previous == null ? currentValue : Math.max(previous.peakValue(), currentValue);
    double drawdownPct = peak > 0 ? (peak - currentValue) / peak * 100.0 : 0.0;
    double maxDrawdown = previous == null ? drawdownPct : Math.max(previous.maxDrawdownPct(), drawdownPct);
    return new HighWaterMark(peak, currentValue, maxDrawdown, now);
  }
}
