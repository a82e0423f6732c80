package com.polybot.mm.strategy.proposal;

import com.polybot.mm.domain.OrderSide;

/**
 * One proposed order. Price and size are adjusted in place by the pipeline stages.
 */
public class OrderProposal {

    private final String marketId;
    private final String tokenId;
    private final OrderSide side;
    private final int level;
    private double price;
    private double size;

    public OrderProposal(String marketId, String tokenId, OrderSide side, double price, double size, int level) {
        this.marketId = marketId;
        this.tokenId = tokenId;
        this.side = side;
        this.price = price;
        this.size = size;
        this.level = level;
    }

    /**
     * Collateral this order ties up: {@code size·price} for a bid, {@code size·(1 − price)} for an ask.
     */
    public double cost() {
        return side == OrderSide.BUY ? size * price : size * (1 - price);
    }

    public String getMarketId() {
        return marketId;
    }

    public String getTokenId() {
        return tokenId;
    }

    public OrderSide getSide() {
        return side;
    }

    public int getLevel() {
        return level;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public double getSize() {
        return size;
    }

    public void setSize(double size) {
        this.size = size;
    }

    @Override
    public String toString() {
        return side + " L" + level + " " + size + "@" + price;
    }
}
