package com.polybot.mm.strategy.pricing;

import com.polybot.mm.venue.BookSummary;

import java.util.OptionalDouble;

/**
 * Depth-weighted mid: more resting ask depth pulls the mid toward the bid and vice versa.
 */
public final class WeightedMid {

    private WeightedMid() {
    }

    public static OptionalDouble compute(BookSummary book) {
        if (book == null) {
            return OptionalDouble.empty();
        }
        double bid = book.bestBid();
        double ask = book.bestAsk();
        if (bid <= 0 || ask <= 0 || ask <= bid) {
            return OptionalDouble.empty();
        }
        double total = book.bidDepth() + book.askDepth();
        if (total <= 0) {
            return OptionalDouble.of((bid + ask) / 2.0);
        }
        double wBid = book.askDepth() / total;
        double wAsk = book.bidDepth() / total;
        return OptionalDouble.of(wBid * bid + wAsk * ask);
    }
}
