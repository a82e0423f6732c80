package com.polybot.mm.store;

import java.time.LocalDate;

public record DailyMetricsRecord(
    LocalDate date,
    int marketsQuoted,
    int quotesPlaced,
    int fillsCount,
    int roundTrips,
    double spreadCaptureRate,
    double fillQualityAvgBps,
    double adverseSelectionAvgBps,
    double pnlGross,
    double pnlNet,
    double maxInventory,
    double inventoryTurns,
    double profitFactor,
    double sharpe7d,
    double portfolioValue
) {
}
