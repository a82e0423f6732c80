package com.polybot.mm.strategy.model;

import java.math.BigDecimal;

public record InventorySnapshot(
        String marketId,
        String yesTokenId,
        String noTokenId,
        BigDecimal yesPosition,
        BigDecimal noPosition,
        BigDecimal yesAvgEntry,
        BigDecimal noAvgEntry,
        BigDecimal realizedPnl,
        BigDecimal mergeablePairs
) {
    public static InventorySnapshot of(MarketInventory inv) {
        return new InventorySnapshot(
                inv.marketId(),
                inv.yes().tokenId(),
                inv.no().tokenId(),
                inv.yes().position(),
                inv.no().position(),
                inv.yes().avgEntryPrice(),
                inv.no().avgEntryPrice(),
                inv.totalRealizedPnl(),
                inv.mergeablePairs()
        );
    }
}
