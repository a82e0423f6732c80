package com.polybot.mm.strategy.proposal;

import com.polybot.mm.domain.OrderSide;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.polybot.mm.strategy.pricing.TickMath.MAX_PRICE;
import static com.polybot.mm.strategy.pricing.TickMath.MIN_PRICE;
import static com.polybot.mm.strategy.pricing.TickMath.TICK;
import static com.polybot.mm.strategy.pricing.TickMath.clampPrice;
import static com.polybot.mm.strategy.pricing.TickMath.round1;
import static com.polybot.mm.strategy.pricing.TickMath.round2;

/**
 * Proposal transformations. Each stage mutates and returns the proposal it is given.
 */
public final class ProposalStages {

    private ProposalStages() {
    }

    /**
     * Level-0 bid and ask; a side with a non-positive price or size is omitted.
     */
    public static QuoteProposal createBase(String marketId, String tokenId, double bidPrice, double askPrice,
                                           double bidSize, double askSize, double mid, double reservationPrice) {
        QuoteProposal proposal = new QuoteProposal(marketId, tokenId, mid, reservationPrice);
        if (bidSize > 0 && bidPrice > 0) {
            proposal.getBids().add(new OrderProposal(marketId, tokenId, OrderSide.BUY, bidPrice, bidSize, 0));
        }
        if (askSize > 0 && askPrice > 0) {
            proposal.getAsks().add(new OrderProposal(marketId, tokenId, OrderSide.SELL, askPrice, askSize, 0));
        }
        return proposal;
    }

    /**
     * Adds levels 1..n-1 behind level 0, each {@code spreadMult^level} wider and {@code sizeMult^level} larger.
     */
    public static ProposalStage multiLevel(int levels, double spreadMult, double sizeMult) {
        return proposal -> {
            if (levels <= 1 || proposal.isEmpty()) {
                return proposal;
            }
            double mid = proposal.getMid();
            List<OrderProposal> bids = new ArrayList<>(proposal.getBids());
            List<OrderProposal> asks = new ArrayList<>(proposal.getAsks());
            for (int lvl = 1; lvl < levels; lvl++) {
                double mult = Math.pow(spreadMult, lvl);
                double szMult = Math.pow(sizeMult, lvl);
                if (!proposal.getBids().isEmpty()) {
                    OrderProposal base = proposal.getBids().get(0);
                    double price = Math.max(MIN_PRICE, round2(mid - (mid - base.getPrice()) * mult));
                    bids.add(new OrderProposal(base.getMarketId(), base.getTokenId(), OrderSide.BUY, price,
                            round1(base.getSize() * szMult), lvl));
                }
                if (!proposal.getAsks().isEmpty()) {
                    OrderProposal base = proposal.getAsks().get(0);
                    double price = Math.min(MAX_PRICE, round2(mid + (base.getPrice() - mid) * mult));
                    asks.add(new OrderProposal(base.getMarketId(), base.getTokenId(), OrderSide.SELL, price,
                            round1(base.getSize() * szMult), lvl));
                }
            }
            proposal.setBids(bids);
            proposal.setAsks(asks);
            return proposal;
        };
    }

    /**
     * Widens every level by {@code min(2, 1 + (vol − threshold) / threshold)} once vol exceeds the threshold.
     */
    public static ProposalStage volatilityWidening(double volPts, double threshold) {
        return proposal -> {
            if (volPts <= threshold || threshold <= 0) {
                return proposal;
            }
            widen(proposal, Math.min(2.0, 1.0 + (volPts - threshold) / threshold));
            return proposal;
        };
    }

    public static ProposalStage eventRisk(boolean warning, double widenPct) {
        return proposal -> {
            if (warning) {
                widen(proposal, 1.0 + widenPct / 100.0);
            }
            return proposal;
        };
    }

    /**
     * Greedy fit of bids then asks into {@code available − committed}. The first order that does not fit is
     * shrunk to the remaining budget when that leaves at least {@code minViableSize} shares; it and everything
     * after it are otherwise dropped.
     */
    public static ProposalStage budgetCap(double available, double committed, double minViableSize) {
        return proposal -> {
            double remaining = available - committed;
            if (remaining <= 0) {
                proposal.setBids(List.of());
                proposal.setAsks(List.of());
                return proposal;
            }
            double[] used = {0.0};
            proposal.setBids(fit(proposal.getBids(), remaining, used, minViableSize));
            proposal.setAsks(fit(proposal.getAsks(), remaining, used, minViableSize));
            return proposal;
        };
    }

    private static List<OrderProposal> fit(List<OrderProposal> orders, double remaining, double[] used,
                                           double minViableSize) {
        List<OrderProposal> kept = new ArrayList<>();
        for (OrderProposal order : orders) {
            double cost = order.cost();
            if (used[0] + cost > remaining) {
                double unitCost = order.getSide() == OrderSide.BUY ? order.getPrice() : 1 - order.getPrice();
                double maxSize = unitCost > 0 ? floor1((remaining - used[0]) / unitCost) : 0;
                if (maxSize >= minViableSize) {
                    order.setSize(maxSize);
                    kept.add(order);
                    used[0] += order.cost();
                }
                break;
            }
            kept.add(order);
            used[0] += cost;
        }
        return kept;
    }

    private static double floor1(double value) {
        return Math.floor(value * 10.0 + 1e-9) / 10.0;
    }

    /**
     * Moves any bid at or above the best ask to one tick below it, and any ask at or below the best bid to one
     * tick above it.
     */
    public static ProposalStage postOnly(double bestBid, double bestAsk) {
        return new PostOnlyStage(bestBid, bestAsk);
    }

    private static void widen(QuoteProposal proposal, double multiplier) {
        double mid = proposal.getMid();
        for (OrderProposal order : proposal.getBids()) {
            order.setPrice(Math.max(MIN_PRICE, round2(mid - (mid - order.getPrice()) * multiplier)));
        }
        for (OrderProposal order : proposal.getAsks()) {
            order.setPrice(Math.min(MAX_PRICE, round2(mid + (order.getPrice() - mid) * multiplier)));
        }
    }

    record PostOnlyStage(double bestBid, double bestAsk) implements ProposalStage {

        @Override
        public QuoteProposal apply(QuoteProposal proposal) {
            if (bestAsk > 0) {
                for (OrderProposal order : proposal.getBids()) {
                    if (order.getPrice() >= bestAsk) {
                        order.setPrice(Math.max(MIN_PRICE, round2(bestAsk - TICK)));
                    }
                }
            }
            if (bestBid > 0) {
                for (OrderProposal order : proposal.getAsks()) {
                    if (order.getPrice() <= bestBid) {
                        order.setPrice(Math.min(MAX_PRICE, round2(bestBid + TICK)));
                    }
                }
            }
            uncross(proposal);
            return proposal;
        }

        /**
         * Clamping both sides against a one-tick book can leave level 0 crossed; fall back to joining the touch,
         * or to one tick either side of the quote mid.
         */
        private void uncross(QuoteProposal proposal) {
            Optional<OrderProposal> bid = proposal.bestBid();
            Optional<OrderProposal> ask = proposal.bestAsk();
            if (bid.isEmpty() || ask.isEmpty() || bid.get().getPrice() < ask.get().getPrice()) {
                return;
            }
            double newBid;
            double newAsk;
            if (bestBid > 0 && bestAsk > bestBid) {
                newBid = clampPrice(bestBid);
                newAsk = clampPrice(bestAsk);
                if (newBid >= newAsk) {
                    newBid = clampPrice(newAsk - TICK);
                }
            } else {
                double mid = (bid.get().getPrice() + ask.get().getPrice()) / 2.0;
                newBid = clampPrice(mid - TICK);
                newAsk = clampPrice(mid + TICK);
                if (newBid >= newAsk) {
                    newAsk = clampPrice(newBid + TICK);
                }
            }
            bid.get().setPrice(newBid);
            ask.get().setPrice(newAsk);
        }
    }
}
