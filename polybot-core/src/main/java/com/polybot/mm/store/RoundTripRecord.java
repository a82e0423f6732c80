package com.polybot.mm.store;

import java.time.Instant;

/**
 * A closed (or partially closed) position: the realized leg of an entry and exit.
 */
public record RoundTripRecord(
    String marketId,
    String tokenId,
    double entryPrice,
    double exitPrice,
    double size,
    double grossPnl,
    double netPnl,
    Double holdSeconds,
    Instant closedAt
) {
}
