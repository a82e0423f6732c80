package com.polybot.mm.events;

public final class MmEventTypes {

  private MmEventTypes() {
  }

  public static final String QUOTE_PLACED = "mm.quote.placed";
  public static final String QUOTE_CANCELLED = "mm.quote.cancelled";
  public static final String QUOTE_FAILED = "mm.quote.failed";
  public static final String QUOTE_FILL = "mm.quote.fill";

  public static final String INVENTORY_DIVERGENCE = "mm.inventory.divergence";

  public static final String RISK_MODE_CHANGED = "mm.risk.mode_changed";
  public static final String RISK_RESUMED = "mm.risk.resumed";

  public static final String ARBITRAGE_EXECUTED = "mm.arbitrage.executed";
}
