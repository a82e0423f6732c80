package com.polybot.mm.strategy.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.store.DailyMetricsRecord;
import com.polybot.mm.store.FillRecord;
import com.polybot.mm.store.InMemoryMmStore;
import com.polybot.mm.store.QuoteRecord;
import com.polybot.mm.store.RoundTripRecord;
import com.polybot.mm.strategy.MutableClock;
import com.polybot.mm.venue.BookSummary;
import com.polybot.mm.venue.PaperVenueOrderApi;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MmMetricsCollectorTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private MutableClock clock;
    private InMemoryMmStore store;
    private SimpleMeterRegistry registry;
    private MmMetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryMmStore(clock, new ObjectMapper());
        PaperVenueOrderApi paper = PaperVenueOrderApi.deterministic(clock, 1_000);
        paper.updateBook("yes", new BookSummary(0.46, 0.50, 100, 100, 5));
        registry = new SimpleMeterRegistry();
        collector = new MmMetricsCollector(store, paper, new MmMetricsService(registry), clock);
    }

    @Test
    void samplesLaterMidsOnce() {
        long fillId = store.insertFill(fill(1L, OrderSide.BUY, 0.48));

        assertThat(collector.measureAdverseSelection()).isZero();

        clock.advance(Duration.ofSeconds(30));
        assertThat(collector.measureAdverseSelection()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(90));
        assertThat(collector.measureAdverseSelection()).isEqualTo(1);
        assertThat(collector.measureAdverseSelection()).isZero();

        FillRecord sampled = store.fillsSince(NOW).get(0);
        assertThat(sampled.id()).isEqualTo(fillId);
        assertThat(sampled.midAt30s()).isCloseTo(0.48, within(1e-9));
        assertThat(sampled.midAt120s()).isCloseTo(0.48, within(1e-9));
        assertThat(registry.get("mm.fills.adverse_selection").gauge().value()).isCloseTo(400.0, within(1e-6));
    }

    @Test
    void quietDayWritesNothing() {
        assertThat(collector.computeDailyMetrics(1_000)).isEmpty();
        assertThat(store.dailyMetricsSince(LocalDate.of(2024, 1, 1))).isEmpty();
    }

    @Test
    void rollsUpTodaysActivity() {
        long quoteId = store.insertQuote(new QuoteRecord(null, "m1", "yes", "b", "a", 0.48, 0.52, 0.50, 10,
                QuoteRecord.FILLED, NOW, NOW));
        store.insertFill(fill(quoteId, OrderSide.BUY, 0.48));
        store.insertFill(fill(quoteId, OrderSide.SELL, 0.52));
        store.insertRoundTrip(new RoundTripRecord("m1", "yes", 0.48, 0.52, 10, 0.4, 0.4, 60.0, NOW));

        DailyMetricsRecord day = collector.computeDailyMetrics(1_000).orElseThrow();

        assertThat(day.date()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(day.marketsQuoted()).isEqualTo(1);
        assertThat(day.quotesPlaced()).isEqualTo(1);
        assertThat(day.fillsCount()).isEqualTo(2);
        assertThat(day.roundTrips()).isEqualTo(1);
        assertThat(day.spreadCaptureRate()).isEqualTo(1.0);
        assertThat(day.fillQualityAvgBps()).isCloseTo(400.0, within(0.01));
        assertThat(day.pnlNet()).isCloseTo(0.4, within(1e-9));
        assertThat(day.profitFactor()).isEqualTo(MmPerformanceMetrics.PROFIT_FACTOR_CAP);
        assertThat(store.dailyMetricsSince(LocalDate.of(2024, 1, 15))).containsExactly(day);
    }

    @Test
    void sharpeUsesOnlyValuedDaysOfTheLastWeek() {
        LocalDate today = LocalDate.of(2024, 1, 15);
        store.upsertDailyMetrics(day(today.minusDays(2), 10, 1_000));
        store.upsertDailyMetrics(day(today.minusDays(1), 20, 1_000));
        double expected = MmPerformanceMetrics.sharpeRatio(List.of(0.01, 0.02), 0.0);
        assertThat(collector.rollingSharpe(today)).isCloseTo(expected, within(1e-9));

        store.upsertDailyMetrics(day(today.minusDays(3), 50, 0));
        store.upsertDailyMetrics(day(today.minusDays(7), -100, 1_000));

        assertThat(collector.rollingSharpe(today)).isCloseTo(expected, within(1e-9));
    }

    private static DailyMetricsRecord day(LocalDate date, double pnlNet, double portfolioValue) {
        return new DailyMetricsRecord(date, 1, 1, 1, 1, 0, 0, 0, pnlNet, pnlNet, 0, 0, 0, 0, portfolioValue);
    }

    private static FillRecord fill(Long quoteId, OrderSide side, double price) {
        return new FillRecord(null, quoteId, "o", "m1", "yes", side, price, 10, 0.0, 0.50, null, null, NOW);
    }
}
