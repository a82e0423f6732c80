package com.polybot.mm.strategy.model;

import com.polybot.mm.domain.OrderSide;

public enum QuoteSide {
    BID(OrderSide.BUY),
    ASK(OrderSide.SELL);

    private final OrderSide orderSide;

    QuoteSide(OrderSide orderSide) {
        this.orderSide = orderSide;
    }

    public OrderSide orderSide() {
        return orderSide;
    }
}
