package com.polybot.mm.strategy.model;

import com.polybot.mm.domain.MarketRef;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * A bid and an ask resting on one market. Each side carries its own order id and lifecycle state; a side that was
 * never placed is marked CANCELLED. Owned and mutated by the loop thread only.
 */
@Slf4j
public class QuotePair {

    private final String marketId;
    private final String tokenId;
    private final String noTokenId;
    private final String conditionId;

    private double bidPrice;
    private double askPrice;
    private double bidSize;
    private double askSize;
    private String bidOrderId;
    private String askOrderId;
    private OrderState bidState = OrderState.NEW;
    private OrderState askState = OrderState.NEW;
    private double bidReported;
    private double askReported;
    private double quotedMid;
    private Long storeId;
    private final Instant createdAt;
    private Instant updatedAt;

    public QuotePair(MarketRef market, double bidPrice, double askPrice, double bidSize, double askSize, Instant now) {
        this(market.marketId(), market.tokenId(), market.noTokenId(), market.conditionId(),
                bidPrice, askPrice, bidSize, askSize, now);
    }

    public QuotePair(String marketId, String tokenId, String noTokenId, String conditionId,
                     double bidPrice, double askPrice, double bidSize, double askSize, Instant now) {
        this.marketId = marketId;
        this.tokenId = tokenId;
        this.noTokenId = noTokenId;
        this.conditionId = conditionId;
        this.bidPrice = bidPrice;
        this.askPrice = askPrice;
        this.bidSize = bidSize;
        this.askSize = askSize;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public double spread() {
        return askPrice - bidPrice;
    }

    public double mid() {
        return (bidPrice + askPrice) / 2.0;
    }

    public boolean isActive() {
        return bidState.isOpen() || askState.isOpen();
    }

    public boolean isFullyFilled() {
        return bidState == OrderState.FILLED && askState == OrderState.FILLED;
    }

    public boolean isTerminal() {
        return bidState.isDone() && askState.isDone();
    }

    /**
     * Neither resting nor finished: every open side fell into UNKNOWN.
     */
    public boolean isZombie() {
        return !isActive() && !isTerminal();
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public TransitionOutcome updateState(QuoteSide side, OrderState target, Instant now) {
        OrderState current = state(side);
        if (current == target) {
            return TransitionOutcome.NO_CHANGE;
        }
        if (!current.canTransitionTo(target)) {
            log.warn("Invalid {} transition {} -> {} for {}", side, current, target, marketId);
            return TransitionOutcome.REJECTED;
        }
        if (side == QuoteSide.BID) {
            bidState = target;
        } else {
            askState = target;
        }
        updatedAt = now;
        return TransitionOutcome.APPLIED;
    }

    public OrderState state(QuoteSide side) {
        return side == QuoteSide.BID ? bidState : askState;
    }

    public String orderId(QuoteSide side) {
        return side == QuoteSide.BID ? bidOrderId : askOrderId;
    }

    public double price(QuoteSide side) {
        return side == QuoteSide.BID ? bidPrice : askPrice;
    }

    public double size(QuoteSide side) {
        return side == QuoteSide.BID ? bidSize : askSize;
    }

    /**
     * Shares already reported as filled on this side.
     */
    public double reportedSize(QuoteSide side) {
        return side == QuoteSide.BID ? bidReported : askReported;
    }

    public void addReported(QuoteSide side, double size) {
        if (side == QuoteSide.BID) {
            bidReported += size;
        } else {
            askReported += size;
        }
    }

    /**
     * Carry a still-resting order over from a replaced pair, keeping its price, id, state and fill progress.
     */
    public void inheritSide(QuoteSide side, QuotePair from) {
        if (side == QuoteSide.BID) {
            bidPrice = from.bidPrice;
            bidSize = from.bidSize;
            bidOrderId = from.bidOrderId;
            bidState = from.bidState;
            bidReported = from.bidReported;
        } else {
            askPrice = from.askPrice;
            askSize = from.askSize;
            askOrderId = from.askOrderId;
            askState = from.askState;
            askReported = from.askReported;
        }
    }

    /**
     * Initial state after a placement attempt; not a lifecycle transition.
     */
    public void markPlaced(QuoteSide side, String orderId, OrderState state) {
        if (side == QuoteSide.BID) {
            bidOrderId = orderId;
            bidState = state;
        } else {
            askOrderId = orderId;
            askState = state;
        }
    }

    public String getMarketId() {
        return marketId;
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getNoTokenId() {
        return noTokenId;
    }

    public String getConditionId() {
        return conditionId;
    }

    public double getBidPrice() {
        return bidPrice;
    }

    public double getAskPrice() {
        return askPrice;
    }

    public double getBidSize() {
        return bidSize;
    }

    public double getAskSize() {
        return askSize;
    }

    public String getBidOrderId() {
        return bidOrderId;
    }

    public String getAskOrderId() {
        return askOrderId;
    }

    public OrderState getBidState() {
        return bidState;
    }

    public OrderState getAskState() {
        return askState;
    }

    public double getQuotedMid() {
        return quotedMid;
    }

    public void setQuotedMid(double quotedMid) {
        this.quotedMid = quotedMid;
    }

    public Long getStoreId() {
        return storeId;
    }

    public void setStoreId(Long storeId) {
        this.storeId = storeId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "QuotePair{" + marketId + " bid=" + bidPrice + "x" + bidSize + "(" + bidState + ")"
                + " ask=" + askPrice + "x" + askSize + "(" + askState + ")}";
    }
}
