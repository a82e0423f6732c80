package com.polybot.mm.strategy.quote;

import com.polybot.mm.domain.MarketRef;
import com.polybot.mm.events.MmEventPublisher;
import com.polybot.mm.events.MmEventTypes;
import com.polybot.mm.strategy.model.DetectedFill;
import com.polybot.mm.strategy.model.OrderState;
import com.polybot.mm.strategy.model.QuoteFailure;
import com.polybot.mm.strategy.model.QuotePair;
import com.polybot.mm.strategy.model.QuoteSide;
import com.polybot.mm.venue.LimitOrderRequest;
import com.polybot.mm.venue.OrderError;
import com.polybot.mm.venue.OrderStatusSnapshot;
import com.polybot.mm.venue.OrderSubmission;
import com.polybot.mm.venue.VenueOrderApi;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Places, cancels, replaces and polls two-sided quotes. Every side is an independent GTC limit order; a side that
 * was skipped or refused is recorded as CANCELLED so the pair can still become terminal.
 *
 * Not thread-safe: one loop thread owns all pairs.
 */
@Slf4j
@RequiredArgsConstructor
public class Quoter {

    private static final double SHARE_EPS = 1e-9;

    private final @NonNull VenueOrderApi venue;
    private final @NonNull MmEventPublisher events;
    private final @NonNull Clock clock;
    private final boolean postOnly;
    private final double hangingPriceThreshold;

    private QuoteFailure lastFailure;

    /**
     * Place the requested sides. Empty when no side ended up on the book; {@link #lastFailure()} then says why.
     */
    public Optional<QuotePair> placeQuotePair(MarketRef market, double bidPrice, double askPrice,
                                              double bidSize, double askSize,
                                              boolean placeBid, boolean placeAsk) {
        lastFailure = null;
        Instant now = clock.instant();
        QuotePair pair = new QuotePair(market, bidPrice, askPrice, bidSize, askSize, now);
        Map<QuoteSide, OrderError> errors = new EnumMap<>(QuoteSide.class);

        placeSide(pair, QuoteSide.BID, placeBid, OrderState.LIVE, errors);
        placeSide(pair, QuoteSide.ASK, placeAsk, OrderState.LIVE, errors);

        if (pair.getBidOrderId() == null && pair.getAskOrderId() == null) {
            fail(pair, placeBid, placeAsk, errors, now);
            return Optional.empty();
        }
        log.info("quote placed ({}) on {}: bid {}x{} / ask {}x{}", mode(placeBid, placeAsk), market.marketId(),
                bidPrice, bidSize, askPrice, askSize);
        events.publish(MmEventTypes.QUOTE_PLACED, market.marketId(), pair.toString());
        return Optional.of(pair);
    }

    public Optional<QuoteFailure> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    /**
     * Cancel every side that is not done, including sides in UNKNOWN. False when any venue cancel failed; that
     * side keeps its state.
     */
    public boolean cancelQuotePair(QuotePair pair) {
        boolean success = true;
        for (QuoteSide side : QuoteSide.values()) {
            if (!cancelSide(pair, side)) {
                success = false;
            }
        }
        if (success) {
            events.publish(MmEventTypes.QUOTE_CANCELLED, pair.getMarketId(), pair.toString());
        }
        return success;
    }

    public Optional<QuotePair> requote(QuotePair pair, MarketRef market, double bidPrice, double askPrice,
                                       double bidSize, double askSize, boolean placeBid, boolean placeAsk) {
        if (!cancelQuotePair(pair)) {
            log.warn("requote on {}: cancel incomplete, placing anyway", pair.getMarketId());
        }
        return placeQuotePair(market, bidPrice, askPrice, bidSize, askSize, placeBid, placeAsk);
    }

    /**
     * Replace a quote but leave hanging orders alone. A partially filled side is always carried over with its
     * original price and order id; a resting side is carried over when it is still wanted and its price moved by
     * less than the hanging threshold. Everything else is cancelled and, when wanted, re-placed as NEW.
     */
    public Optional<QuotePair> requotePreservingHanging(QuotePair pair, MarketRef market,
                                                        double bidPrice, double askPrice,
                                                        double bidSize, double askSize,
                                                        boolean placeBid, boolean placeAsk) {
        lastFailure = null;
        Instant now = clock.instant();
        QuotePair next = new QuotePair(market, bidPrice, askPrice, bidSize, askSize, now);
        Map<QuoteSide, OrderError> errors = new EnumMap<>(QuoteSide.class);

        for (QuoteSide side : QuoteSide.values()) {
            boolean wanted = side == QuoteSide.BID ? placeBid : placeAsk;
            double newPrice = side == QuoteSide.BID ? bidPrice : askPrice;
            if (keepsResting(pair, side, wanted, newPrice) || !cancelSide(pair, side)) {
                next.inheritSide(side, pair);
                continue;
            }
            placeSide(next, side, wanted, OrderState.NEW, errors);
        }

        if (next.getBidOrderId() == null && next.getAskOrderId() == null) {
            fail(next, placeBid, placeAsk, errors, now);
            return Optional.empty();
        }
        log.info("requoted {} keeping hanging orders: {}", market.marketId(), next);
        return Optional.of(next);
    }

    private boolean keepsResting(QuotePair pair, QuoteSide side, boolean wanted, double newPrice) {
        if (pair.orderId(side) == null) {
            return false;
        }
        OrderState state = pair.state(side);
        if (state == OrderState.PARTIAL) {
            return true;
        }
        return state.isOpen() && wanted && Math.abs(pair.price(side) - newPrice) < hangingPriceThreshold;
    }

    /**
     * Poll every side not yet done, UNKNOWN included, and move its state forward. Newly matched shares are reported once: a partial fill
     * reports the increment since the last poll and the final FILLED report carries the remainder.
     */
    public List<DetectedFill> reconcileQuote(QuotePair pair) {
        List<DetectedFill> fills = new ArrayList<>(2);
        for (QuoteSide side : QuoteSide.values()) {
            reconcileSide(pair, side).ifPresent(fills::add);
        }
        return fills;
    }

    private Optional<DetectedFill> reconcileSide(QuotePair pair, QuoteSide side) {
        String orderId = pair.orderId(side);
        if (orderId == null || pair.state(side).isDone()) {
            return Optional.empty();
        }
        OrderStatusSnapshot status = venue.getOrderStatus(orderId);
        if (OrderStatusSnapshot.ERROR.equals(status.status())) {
            log.debug("status poll failed for {} {} {}", pair.getMarketId(), side, orderId);
            return Optional.empty();
        }
        Instant now = clock.instant();
        OrderState target = OrderState.fromVenueStatus(status.status());
        double reported = pair.reportedSize(side);

        if (status.filled() || target == OrderState.FILLED) {
            double total = status.sizeMatched() > 0 ? status.sizeMatched() : pair.size(side);
            pair.updateState(side, OrderState.FILLED, now);
            return report(pair, side, status, total - reported, true);
        }
        if (status.sizeMatched() > reported + SHARE_EPS) {
            pair.updateState(side, target == OrderState.CANCELLED ? OrderState.CANCELLED : OrderState.PARTIAL, now);
            return report(pair, side, status, status.sizeMatched() - reported, false);
        }
        if (target == OrderState.LIVE && pair.state(side) == OrderState.PARTIAL) {
            return Optional.empty();
        }
        pair.updateState(side, target, now);
        return Optional.empty();
    }

    private Optional<DetectedFill> report(QuotePair pair, QuoteSide side, OrderStatusSnapshot status,
                                          double size, boolean complete) {
        if (size <= SHARE_EPS) {
            return Optional.empty();
        }
        pair.addReported(side, size);
        double price = status.avgFillPrice() != null && status.avgFillPrice() > 0
                ? status.avgFillPrice()
                : pair.price(side);
        double fee = status.sizeMatched() > 0 ? status.feesPaid() * size / status.sizeMatched() : status.feesPaid();
        return Optional.of(new DetectedFill(pair.getMarketId(), pair.getTokenId(), side, pair.orderId(side),
                price, size, fee, complete, pair.getStoreId()));
    }

    private void placeSide(QuotePair pair, QuoteSide side, boolean wanted, OrderState placedState,
                           Map<QuoteSide, OrderError> errors) {
        if (!wanted) {
            pair.markPlaced(side, null, OrderState.CANCELLED);
            return;
        }
        OrderSubmission submission = venue.placeLimitOrder(LimitOrderRequest.gtc(
                pair.getTokenId(), side.orderSide(), pair.price(side), pair.size(side), postOnly));
        if (submission.isPlaced()) {
            pair.markPlaced(side, submission.orderId(), placedState);
        } else {
            pair.markPlaced(side, null, OrderState.CANCELLED);
            submission.errorIfAny().ifPresent(e -> errors.put(side, e));
        }
    }

    private boolean cancelSide(QuotePair pair, QuoteSide side) {
        String orderId = pair.orderId(side);
        if (orderId == null || pair.state(side).isDone()) {
            return true;
        }
        if (!venue.cancelOrder(orderId)) {
            log.warn("cancel failed for {} {} {}", pair.getMarketId(), side, orderId);
            return false;
        }
        pair.updateState(side, OrderState.CANCELLED, clock.instant());
        return true;
    }

    private void fail(QuotePair pair, boolean placeBid, boolean placeAsk, Map<QuoteSide, OrderError> errors,
                      Instant now) {
        lastFailure = new QuoteFailure(pair.getMarketId(), pair.getTokenId(), placeBid, placeAsk,
                errors.get(QuoteSide.BID), errors.get(QuoteSide.ASK),
                pair.getBidPrice(), pair.getAskPrice(), pair.getBidSize(), pair.getAskSize(), now);
        log.warn("quote failed for {} (sides={}, bidError={}, askError={})", pair.getMarketId(),
                lastFailure.sides(), codeOf(lastFailure.bidError()), codeOf(lastFailure.askError()));
        events.publish(MmEventTypes.QUOTE_FAILED, pair.getMarketId(), lastFailure);
    }

    private static String codeOf(OrderError error) {
        return error == null ? null : error.code();
    }

    private static String mode(boolean bid, boolean ask) {
        if (bid && ask) {
            return "BID+ASK";
        }
        return bid ? "BID-only" : "ASK-only";
    }
}
