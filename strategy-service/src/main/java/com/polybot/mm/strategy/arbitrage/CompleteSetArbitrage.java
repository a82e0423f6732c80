package com.polybot.mm.strategy.arbitrage;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.domain.MarketRef;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.domain.TokenLeg;
import com.polybot.mm.events.MmEventPublisher;
import com.polybot.mm.events.MmEventTypes;
import com.polybot.mm.strategy.inventory.InventoryLedger;
import com.polybot.mm.strategy.pricing.TickMath;
import com.polybot.mm.venue.BookSummary;
import com.polybot.mm.venue.LimitOrderRequest;
import com.polybot.mm.venue.OrderStatusSnapshot;
import com.polybot.mm.venue.OrderSubmission;
import com.polybot.mm.venue.VenueOrderApi;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Detects and trades complete-set mispricings. A YES share plus a NO share always redeem for exactly 1 USDC, so
 * asks summing below 1 can be bought and merged, and bids summing above 1 can be split into and sold.
 *
 * <p>Legs are taker orders. Whatever fills is written to the inventory ledger before the trade is judged, so an
 * abandoned arbitrage never leaves untracked shares behind.
 */
@Slf4j
@RequiredArgsConstructor
public class CompleteSetArbitrage {

    private static final double SUCCESS_FILL_RATIO = 0.9;

    private final @NonNull VenueOrderApi venue;
    private final @NonNull InventoryLedger inventory;
    private final @NonNull MmEventPublisher events;
    private final @NonNull MmProperties.Arbitrage config;
    private final @NonNull Duration settleWait;
    private final @NonNull Clock clock;

    public Optional<ArbOpportunity> scan(MarketRef market, BookSummary yesBook, BookSummary noBook) {
        if (yesBook == null || noBook == null || !market.supportsCompleteSet()) {
            return Optional.empty();
        }
        double yesAsk = yesBook.bestAsk();
        double noAsk = noBook.bestAsk();
        double yesBid = yesBook.bestBid();
        double noBid = noBook.bestBid();
        if (yesAsk <= 0 || noAsk <= 0 || yesBid <= 0 || noBid <= 0) {
            return Optional.empty();
        }

        double buyCost = yesAsk + noAsk;
        if (buyCost < 1.0) {
            double gross = 1.0 - buyCost;
            double maxSize = Math.min(depthShares(yesBook.askDepth(), yesAsk), depthShares(noBook.askDepth(), noAsk));
            if (maxSize >= config.minSize()) {
                double netPct = (gross * maxSize - config.gasCostUsd()) / (buyCost * maxSize) * 100.0;
                if (netPct >= config.minProfitPct()) {
                    return Optional.of(opportunity(market, ArbType.BUY_MERGE, yesAsk, noAsk,
                            gross / buyCost * 100.0, netPct, maxSize));
                }
            }
        }

        double sellRevenue = yesBid + noBid;
        if (sellRevenue > 1.0) {
            double gross = sellRevenue - 1.0;
            double maxSize = Math.min(depthShares(yesBook.bidDepth(), yesBid), depthShares(noBook.bidDepth(), noBid));
            if (maxSize >= config.minSize()) {
                double netPct = (gross * maxSize - config.gasCostUsd()) / maxSize * 100.0;
                if (netPct >= config.minProfitPct()) {
                    return Optional.of(opportunity(market, ArbType.SPLIT_SELL, yesBid, noBid,
                            gross * 100.0, netPct, maxSize));
                }
            }
        }
        return Optional.empty();
    }

    public ArbResult execute(ArbOpportunity opp) {
        ArbResult result = switch (opp.type()) {
            case BUY_MERGE -> buyMerge(opp);
            case SPLIT_SELL -> splitSell(opp);
        };
        if (result.success()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", opp.type().name());
            data.put("size", result.size());
            data.put("yesPrice", opp.yesPrice());
            data.put("noPrice", opp.noPrice());
            data.put("profitUsd", result.profitUsd());
            events.publish(MmEventTypes.ARBITRAGE_EXECUTED, opp.marketId(), data);
        }
        return result;
    }

    private ArbResult buyMerge(ArbOpportunity opp) {
        // maxSizeUsd caps the collateral spent on pairs
        double shares = TickMath.round1(Math.min(opp.maxSize(), config.maxSizeUsd() / (opp.yesPrice() + opp.noPrice())));
        if (shares < config.minSize()) {
            return ArbResult.failed(opp, shares, "size_below_minimum", 0, 0);
        }
        log.info("ARB buy-merge {}: YES@{} + NO@{} x{} (net {}%)", opp.marketId(), opp.yesPrice(), opp.noPrice(),
                shares, TickMath.round2(opp.netProfitPct()));

        OrderSubmission yesOrder = take(opp.yesTokenId(), OrderSide.BUY, opp.yesPrice(), shares);
        if (!yesOrder.isPlaced()) {
            log.warn("ARB: YES buy failed for {}: {}", opp.marketId(), yesOrder.error());
            return ArbResult.failed(opp, shares, "yes_buy_failed", 0, 0);
        }
        OrderSubmission noOrder = take(opp.noTokenId(), OrderSide.BUY, opp.noPrice(), shares);
        if (!noOrder.isPlaced()) {
            venue.cancelOrder(yesOrder.orderId());
            double yesFilled = recordFill(opp, TokenLeg.YES, OrderSide.BUY, opp.yesPrice(),
                    venue.getOrderStatus(yesOrder.orderId()));
            log.warn("ARB: NO buy failed for {}, cancelled YES order (filled {})", opp.marketId(), yesFilled);
            return ArbResult.failed(opp, shares, "no_buy_failed", yesFilled, 0);
        }

        settle();
        OrderStatusSnapshot yesStatus = venue.getOrderStatus(yesOrder.orderId());
        OrderStatusSnapshot noStatus = venue.getOrderStatus(noOrder.orderId());
        cancelRemainder(yesOrder.orderId(), yesStatus);
        cancelRemainder(noOrder.orderId(), noStatus);
        double yesFilled = recordFill(opp, TokenLeg.YES, OrderSide.BUY, opp.yesPrice(), yesStatus);
        double noFilled = recordFill(opp, TokenLeg.NO, OrderSide.BUY, opp.noPrice(), noStatus);

        double mergeAmount = TickMath.round1(Math.min(yesFilled, noFilled));
        if (mergeAmount < config.minSize()) {
            log.warn("ARB: insufficient fills for merge on {} (YES={}, NO={})", opp.marketId(), yesFilled, noFilled);
            return ArbResult.failed(opp, shares, "insufficient_fills", yesFilled, noFilled);
        }
        if (!venue.mergePositions(opp.conditionId(), mergeAmount)) {
            log.error("ARB: merge failed for {}, holding {} pairs", opp.marketId(), mergeAmount);
            return ArbResult.failed(opp, shares, "merge_failed", yesFilled, noFilled);
        }
        inventory.processMerge(opp.marketId(), mergeAmount);

        double profit = TickMath.round2((1.0 - opp.yesPrice() - opp.noPrice()) * mergeAmount - config.gasCostUsd());
        log.info("ARB buy-merge SUCCESS on {}: merged {} pairs, profit ${}", opp.marketId(), mergeAmount, profit);
        return new ArbResult(opp.type(), opp.marketId(), true, null, mergeAmount, yesFilled, noFilled, profit);
    }

    private ArbResult splitSell(ArbOpportunity opp) {
        // one pair costs exactly 1 USDC
        double amount = TickMath.round1(Math.min(opp.maxSize(), config.maxSizeUsd()));
        if (amount < config.minSize()) {
            return ArbResult.failed(opp, amount, "size_below_minimum", 0, 0);
        }
        log.info("ARB split-sell {}: split ${} then sell YES@{} + NO@{} (net {}%)", opp.marketId(), amount,
                opp.yesPrice(), opp.noPrice(), TickMath.round2(opp.netProfitPct()));

        if (!venue.splitPosition(opp.conditionId(), amount)) {
            log.warn("ARB: split failed for {}", opp.marketId());
            return ArbResult.failed(opp, amount, "split_failed", 0, 0);
        }
        inventory.processSplit(opp.marketId(), amount, opp.yesTokenId(), opp.noTokenId());

        OrderSubmission yesOrder = take(opp.yesTokenId(), OrderSide.SELL, opp.yesPrice(), amount);
        OrderSubmission noOrder = take(opp.noTokenId(), OrderSide.SELL, opp.noPrice(), amount);
        settle();

        double yesSold = 0.0;
        double noSold = 0.0;
        if (yesOrder.isPlaced()) {
            OrderStatusSnapshot status = venue.getOrderStatus(yesOrder.orderId());
            cancelRemainder(yesOrder.orderId(), status);
            yesSold = recordFill(opp, TokenLeg.YES, OrderSide.SELL, opp.yesPrice(), status);
        }
        if (noOrder.isPlaced()) {
            OrderStatusSnapshot status = venue.getOrderStatus(noOrder.orderId());
            cancelRemainder(noOrder.orderId(), status);
            noSold = recordFill(opp, TokenLeg.NO, OrderSide.SELL, opp.noPrice(), status);
        }

        double profit = TickMath.round2(yesSold * opp.yesPrice() + noSold * opp.noPrice() - amount - config.gasCostUsd());
        boolean complete = yesSold >= amount * SUCCESS_FILL_RATIO && noSold >= amount * SUCCESS_FILL_RATIO;
        if (complete) {
            log.info("ARB split-sell SUCCESS on {}: sold {} YES + {} NO, profit ${}", opp.marketId(), yesSold,
                    noSold, profit);
        } else {
            log.warn("ARB split-sell PARTIAL on {}: YES sold {}/{}, NO sold {}/{}", opp.marketId(), yesSold, amount,
                    noSold, amount);
        }
        return new ArbResult(opp.type(), opp.marketId(), complete, complete ? null : "partial_fills", amount,
                yesSold, noSold, profit);
    }

    private OrderSubmission take(String tokenId, OrderSide side, double price, double size) {
        return venue.placeLimitOrder(LimitOrderRequest.gtc(tokenId, side, price, size, false));
    }

    private void cancelRemainder(String orderId, OrderStatusSnapshot status) {
        if (!status.filled()) {
            venue.cancelOrder(orderId);
        }
    }

    private double recordFill(ArbOpportunity opp, TokenLeg leg, OrderSide side, double limitPrice,
                              OrderStatusSnapshot status) {
        double matched = status.sizeMatched();
        if (matched <= 0) {
            return 0.0;
        }
        double price = status.avgFillPrice() != null ? status.avgFillPrice() : limitPrice;
        String tokenId = leg == TokenLeg.NO ? opp.noTokenId() : opp.yesTokenId();
        inventory.processFill(opp.marketId(), tokenId, side, price, matched, leg);
        return matched;
    }

    private void settle() {
        if (settleWait.isZero() || settleWait.isNegative()) {
            return;
        }
        try {
            Thread.sleep(settleWait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ARB settle wait interrupted, verifying fills now");
        }
    }

    private ArbOpportunity opportunity(MarketRef market, ArbType type, double yesPrice, double noPrice,
                                       double grossPct, double netPct, double maxSize) {
        return new ArbOpportunity(market.marketId(), market.conditionId(), market.tokenId(), market.noTokenId(),
                type, yesPrice, noPrice, grossPct, netPct, maxSize, clock.instant());
    }

    private static double depthShares(double depthUsd, double price) {
        return price > 0 && depthUsd > 0 ? depthUsd / price : 0.0;
    }
}
