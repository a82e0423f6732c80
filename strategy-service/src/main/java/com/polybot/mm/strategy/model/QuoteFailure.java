package com.polybot.mm.strategy.model;

import com.polybot.mm.venue.OrderError;

import java.time.Instant;

/**
 * Why a quote could not be placed on either side.
 */
public record QuoteFailure(
        String marketId,
        String tokenId,
        boolean placeBid,
        boolean placeAsk,
        OrderError bidError,
        OrderError askError,
        double bidPrice,
        double askPrice,
        double bidSize,
        double askSize,
        Instant at
) {
    public boolean isPostOnlyCross() {
        return (bidError != null && bidError.isPostOnlyCross()) || (askError != null && askError.isPostOnlyCross());
    }

    public String sides() {
        if (placeBid && placeAsk) return "bid+ask";
        return placeBid ? "bid" : placeAsk ? "ask" : "none";
    }
}
