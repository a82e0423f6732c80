package com.polybot.mm.strategy.loop;

import com.polybot.mm.strategy.model.OrderState;
import com.polybot.mm.strategy.model.QuotePair;

import java.time.Instant;

/**
 * Immutable copy of a quote pair for readers outside the loop thread.
 */
public record ActiveQuoteView(
        String marketId,
        String tokenId,
        double bidPrice,
        double askPrice,
        double bidSize,
        double askSize,
        String bidOrderId,
        String askOrderId,
        OrderState bidState,
        OrderState askState,
        double quotedMid,
        Instant createdAt
) {
    public static ActiveQuoteView of(QuotePair pair) {
        return new ActiveQuoteView(pair.getMarketId(), pair.getTokenId(), pair.getBidPrice(), pair.getAskPrice(),
                pair.getBidSize(), pair.getAskSize(), pair.getBidOrderId(), pair.getAskOrderId(),
                pair.getBidState(), pair.getAskState(), pair.getQuotedMid(), pair.getCreatedAt());
    }
}
