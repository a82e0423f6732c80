package com.polybot.mm.strategy.proposal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Proposed bids and asks for one market, ordered by level (0 = tightest).
 */
public class QuoteProposal {

    private final String marketId;
    private final String tokenId;
    private final double mid;
    private final double reservationPrice;
    private List<OrderProposal> bids = new ArrayList<>();
    private List<OrderProposal> asks = new ArrayList<>();

    public QuoteProposal(String marketId, String tokenId, double mid, double reservationPrice) {
        this.marketId = marketId;
        this.tokenId = tokenId;
        this.mid = mid;
        this.reservationPrice = reservationPrice > 0 ? reservationPrice : mid;
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    public Optional<OrderProposal> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0));
    }

    public Optional<OrderProposal> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0));
    }

    public String getMarketId() {
        return marketId;
    }

    public String getTokenId() {
        return tokenId;
    }

    public double getMid() {
        return mid;
    }

    public double getReservationPrice() {
        return reservationPrice;
    }

    public List<OrderProposal> getBids() {
        return bids;
    }

    public void setBids(List<OrderProposal> bids) {
        this.bids = new ArrayList<>(bids);
    }

    public List<OrderProposal> getAsks() {
        return asks;
    }

    public void setAsks(List<OrderProposal> asks) {
        this.asks = new ArrayList<>(asks);
    }

    @Override
    public String toString() {
        return "QuoteProposal{" + marketId + " mid=" + mid + " bids=" + bids + " asks=" + asks + "}";
    }
}
