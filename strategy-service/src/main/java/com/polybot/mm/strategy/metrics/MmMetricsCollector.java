package com.polybot.mm.strategy.metrics;

import com.polybot.mm.store.DailyMetricsRecord;
import com.polybot.mm.store.FillRecord;
import com.polybot.mm.store.InventoryRecord;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.store.QuoteRecord;
import com.polybot.mm.store.RoundTripRecord;
import com.polybot.mm.strategy.pricing.TickMath;
import com.polybot.mm.venue.BookSummary;
import com.polybot.mm.venue.VenueOrderApi;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Samples the mid 30s and 120s after each fill and rolls the day's fills, quotes and round trips into a
 * {@link DailyMetricsRecord}.
 */
@Slf4j
@RequiredArgsConstructor
public class MmMetricsCollector {

    static final Duration SAMPLE_30S = Duration.ofSeconds(30);
    static final Duration SAMPLE_120S = Duration.ofSeconds(120);
    static final Duration PENDING_WINDOW = Duration.ofSeconds(180);
    private static final int SHARPE_DAYS = 7;

    private final @NonNull MmStore store;
    private final @NonNull VenueOrderApi venue;
    private final @NonNull MmMetricsService metrics;
    private final @NonNull Clock clock;

    /**
     * Fill in missing later mids for recent fills. Returns the number of samples written.
     */
    public int measureAdverseSelection() {
        Instant now = clock.instant();
        List<FillRecord> pending = store.fillsPendingAdverseSelection(now.minus(PENDING_WINDOW));
        if (pending.isEmpty()) {
            return 0;
        }

        Map<String, OptionalDouble> midByToken = new HashMap<>();
        int measured30 = 0;
        int measured120 = 0;
        List<Double> adverse = new ArrayList<>();
        for (FillRecord fill : pending) {
            if (fill.id() == null || fill.filledAt() == null) {
                continue;
            }
            Duration age = Duration.between(fill.filledAt(), now);
            boolean want30 = fill.midAt30s() == null && age.compareTo(SAMPLE_30S) >= 0;
            boolean want120 = fill.midAt120s() == null && age.compareTo(SAMPLE_120S) >= 0;
            if (!want30 && !want120) {
                continue;
            }
            OptionalDouble mid = midByToken.computeIfAbsent(fill.tokenId(), this::currentMid);
            if (mid.isEmpty()) {
                continue;
            }
            Double at30 = want30 ? mid.getAsDouble() : null;
            Double at120 = want120 ? mid.getAsDouble() : null;
            store.updateFillAdverseSelection(fill.id(), at30, at120);
            if (want30) {
                measured30++;
            }
            if (want120) {
                measured120++;
                double midAtFill = fill.midAtFill() != null ? fill.midAtFill() : fill.price();
                adverse.add(MmPerformanceMetrics.adverseSelection(midAtFill, mid.getAsDouble(), fill.side()));
            }
        }
        if (!adverse.isEmpty()) {
            metrics.recordAdverseSelection(adverse.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
        }
        if (measured30 > 0 || measured120 > 0) {
            log.info("adverse selection: {} sampled at T+30s, {} at T+120s", measured30, measured120);
        }
        return measured30 + measured120;
    }

    /**
     * Aggregate today's (UTC) activity and persist it. Empty days are not written.
     */
    public Optional<DailyMetricsRecord> computeDailyMetrics(double portfolioValue) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant midnight = today.atStartOfDay(ZoneOffset.UTC).toInstant();

        List<FillRecord> fills = store.fillsSince(midnight);
        List<QuoteRecord> quotes = store.quotesSince(midnight);
        List<RoundTripRecord> roundTrips = store.roundTripsSince(midnight);
        if (fills.isEmpty() && quotes.isEmpty()) {
            return Optional.empty();
        }

        MmPerformanceMetrics.PnlSummary pnl = MmPerformanceMetrics.pnlSummary(roundTrips);

        double fqSum = 0.0;
        int fqCount = 0;
        double asSum = 0.0;
        int asCount = 0;
        for (FillRecord f : fills) {
            if (f.midAtFill() != null && f.midAtFill() > 0) {
                fqSum += MmPerformanceMetrics.fillQuality(f.price(), f.midAtFill(), f.side());
                fqCount++;
                if (f.midAt120s() != null) {
                    asSum += MmPerformanceMetrics.adverseSelection(f.midAtFill(), f.midAt120s(), f.side());
                    asCount++;
                }
            }
        }

        double maxInventory = 0.0;
        for (InventoryRecord inv : store.inventory()) {
            maxInventory = Math.max(maxInventory, inv.netPosition().abs().doubleValue());
        }
        double hoursSinceMidnight = Math.max(Duration.between(midnight, now).toSeconds() / 3600.0, 0.1);
        double turns = MmPerformanceMetrics.inventoryTurnRate(fills.size(),
                maxInventory > 0 ? maxInventory / 2.0 : 1.0, hoursSinceMidnight);

        Set<String> markets = new HashSet<>();
        quotes.forEach(q -> markets.add(q.marketId()));

        DailyMetricsRecord record = new DailyMetricsRecord(
                today,
                markets.size(),
                quotes.size(),
                fills.size(),
                pnl.roundTrips(),
                TickMath.round4(MmPerformanceMetrics.spreadCaptureRate(fills, quotes)),
                TickMath.round2(fqCount > 0 ? fqSum / fqCount : 0.0),
                TickMath.round2(asCount > 0 ? asSum / asCount : 0.0),
                pnl.grossPnl(),
                pnl.netPnl(),
                maxInventory,
                TickMath.round2(turns),
                TickMath.round2(MmPerformanceMetrics.profitFactor(roundTrips)),
                TickMath.round2(rollingSharpe(today)),
                portfolioValue
        );
        store.upsertDailyMetrics(record);
        log.info("daily metrics {}: fills={} roundTrips={} pnlNet={} sharpe7d={}", today, record.fillsCount(),
                record.roundTrips(), record.pnlNet(), record.sharpe7d());
        return Optional.of(record);
    }

    /**
     * Sharpe over the last {@value #SHARPE_DAYS} stored days including today, on returns as a fraction of that
     * day's portfolio value. Days without a valuation are left out.
     */
    double rollingSharpe(LocalDate today) {
        List<Double> returns = new ArrayList<>();
        for (DailyMetricsRecord day : store.dailyMetricsSince(today.minusDays(SHARPE_DAYS - 1))) {
            if (day.portfolioValue() > 0) {
                returns.add(day.pnlNet() / day.portfolioValue());
            }
        }
        return MmPerformanceMetrics.sharpeRatio(returns, 0.0);
    }

    private OptionalDouble currentMid(String tokenId) {
        return venue.getBookSummary(tokenId)
                .filter(BookSummary::hasMid)
                .map(book -> OptionalDouble.of(book.mid()))
                .orElse(OptionalDouble.empty());
    }
}
