package com.polybot.mm.strategy.model;

import com.polybot.mm.domain.TokenLeg;

import java.math.BigDecimal;

public record InventoryDivergence(
        String marketId,
        String tokenId,
        TokenLeg leg,
        BigDecimal memoryPosition,
        BigDecimal storedPosition
) {
}
