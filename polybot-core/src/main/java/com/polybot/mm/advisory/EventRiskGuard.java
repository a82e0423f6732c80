package com.polybot.mm.advisory;

import java.util.Set;

/**
 * Flags markets exposed to imminent news or resolution events.
 */
public interface EventRiskGuard {

  /**
   * True when spreads on this market should be widened.
   */
  boolean hasWarning(String marketId);

  /**
   * Markets that must not be quoted at all.
   */
  Set<String> killList();
}
