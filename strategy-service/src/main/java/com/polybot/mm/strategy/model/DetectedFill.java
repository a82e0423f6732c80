package com.polybot.mm.strategy.model;

import com.polybot.mm.domain.OrderSide;

/**
 * Shares newly matched on one side of a quote since the previous poll.
 *
 * @param complete true when the venue reports the order fully matched
 */
public record DetectedFill(
        String marketId,
        String tokenId,
        QuoteSide side,
        String orderId,
        double price,
        double size,
        double fee,
        boolean complete,
        Long quoteStoreId
) {
    public OrderSide orderSide() {
        return side.orderSide();
    }
}
