package com.polybot.mm.strategy.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.advisory.Advisors;
import com.polybot.mm.advisory.DefaultRiskOfficer;
import com.polybot.mm.advisory.NeutralMarketScorer;
import com.polybot.mm.advisory.StoreEventRiskGuard;
import com.polybot.mm.config.MmProperties;
import com.polybot.mm.domain.MarketRef;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.events.MmEventPublisher;
import com.polybot.mm.events.NoopMmEventPublisher;
import com.polybot.mm.store.FillRecord;
import com.polybot.mm.store.InMemoryMmStore;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.store.QuoteRecord;
import com.polybot.mm.store.RoundTripRecord;
import com.polybot.mm.strategy.arbitrage.CompleteSetArbitrage;
import com.polybot.mm.strategy.inventory.InventoryLedger;
import com.polybot.mm.strategy.metrics.MmMetricsService;
import com.polybot.mm.strategy.model.OrderState;
import com.polybot.mm.strategy.model.QuotePair;
import com.polybot.mm.strategy.model.QuoteSide;
import com.polybot.mm.strategy.pricing.HeuristicPricingEngine;
import com.polybot.mm.strategy.pricing.KappaEstimator;
import com.polybot.mm.strategy.pricing.StaleTracker;
import com.polybot.mm.strategy.pricing.VolTracker;
import com.polybot.mm.strategy.quote.Quoter;
import com.polybot.mm.strategy.risk.MmRiskManager;
import com.polybot.mm.venue.BookSummary;
import com.polybot.mm.venue.LimitOrderRequest;
import com.polybot.mm.venue.PaperVenueOrderApi;
import com.polybot.mm.venue.VenueGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MarketMakingCycleTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final MarketRef MARKET = new MarketRef("m1", "yes", null, null, "Will it rain?", null);
    private static final List<MarketRef> MARKETS = List.of(MARKET);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final MmProperties properties = MmProperties.defaults();

    private PaperVenueOrderApi paper;
    private VenueGateway gateway;
    private MmStore store;
    private InventoryLedger ledger;
    private MmRiskManager risk;
    private MarketMakingCycle cycle;

    @BeforeEach
    void setUp() {
        paper = PaperVenueOrderApi.deterministic(clock, 1_000);
        paper.updateBook("yes", new BookSummary(0.48, 0.52, 100, 100, 5));
        gateway = new VenueGateway(paper, clock, 4, 1_000);
        store = new InMemoryMmStore(clock, new ObjectMapper());
        ledger = new InventoryLedger(clock);
        MmEventPublisher events = new NoopMmEventPublisher();
        risk = new MmRiskManager(properties, store, events, clock);
        Advisors advisors = new Advisors(new DefaultRiskOfficer(0.5, 5.0), new NeutralMarketScorer(5.0),
                new StoreEventRiskGuard(store));
        cycle = new MarketMakingCycle(
                properties,
                gateway,
                new Quoter(gateway, events, clock, true, 0.005),
                ledger,
                risk,
                new HeuristicPricingEngine(properties.pricing()),
                new VolTracker(20),
                new StaleTracker(clock, Duration.ofSeconds(60)),
                new KappaEstimator(clock, Duration.ofMinutes(60), 1.5),
                advisors,
                store,
                events,
                new MmMetricsService(new SimpleMeterRegistry()),
                new CompleteSetArbitrage(gateway, ledger, events, properties.arbitrage(), Duration.ZERO, clock),
                clock);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    void flatInventoryQuotesBidOnly() {
        cycle.run(MARKETS);

        assertThat(cycle.activeQuoteViews()).singleElement().satisfies(view -> {
            assertThat(view.askOrderId()).isNull();
            assertThat(view.bidOrderId()).isNotNull();
            assertThat(view.bidSize()).isEqualTo(10.0);
            assertThat(view.bidPrice()).isLessThan(0.52);
        });
        assertThat(store.activeQuotes()).hasSize(1);
        assertThat(store.botStatusField("mm_cycle")).contains("1");
        assertThat(cycle.cycle()).isEqualTo(1);
    }

    @Test
    void fillsFlowIntoInventoryAndRoundTrips() {
        cycle.run(MARKETS);
        String bidId = cycle.activeQuoteViews().get(0).bidOrderId();

        paper.fill(bidId, 10);
        cycle.reconcileAll();

        assertThat(ledger.get("m1").yes().position()).isEqualByComparingTo("10");
        assertThat(store.fillsSince(NOW)).hasSize(1);
        assertThat(store.activeQuotes()).isEmpty();
        assertThat(store.quotesSince(NOW)).extracting(QuoteRecord::status).containsExactly(QuoteRecord.FILLED);

        cycle.run(MARKETS);
        ActiveQuoteView twoSided = cycle.activeQuoteViews().get(0);
        assertThat(twoSided.askOrderId()).isNotNull();
        assertThat(twoSided.askSize()).isEqualTo(10.0);
        assertThat(twoSided.bidOrderId()).isNotNull();

        paper.fill(twoSided.askOrderId(), 10);
        cycle.reconcileAll();

        List<RoundTripRecord> trips = store.roundTripsSince(NOW);
        assertThat(trips).singleElement().satisfies(trip -> {
            assertThat(trip.size()).isEqualTo(10.0);
            assertThat(trip.netPnl()).isPositive();
        });
        assertThat(ledger.get("m1").isFlat()).isTrue();
        assertThat(store.fillsSince(NOW)).extracting(FillRecord::side)
                .containsExactly(OrderSide.BUY, OrderSide.SELL);
    }

    @Test
    void pausedCycleOnlyReconciles() {
        risk.pause("test");

        cycle.run(MARKETS);

        assertThat(cycle.activeQuoteViews()).isEmpty();
        assertThat(paper.getOpenOrderIds()).isEmpty();
    }

    @Test
    void killListEvictsTheMarket() {
        cycle.run(MARKETS);
        store.updateBotStatus(Map.of(MmStore.GUARD_KILL_LIST_KEY, List.of("m1")));

        cycle.run(MARKETS);

        assertThat(cycle.activeQuoteViews()).isEmpty();
        assertThat(paper.getOpenOrderIds()).isEmpty();
        assertThat(store.quotesSince(NOW)).extracting(QuoteRecord::status)
                .containsExactly(QuoteRecord.KILLED_BY_GUARD);
    }

    @Test
    void cancelAllClosesEveryQuote() {
        cycle.run(MARKETS);

        cycle.cancelAll(QuoteRecord.CANCELLED);

        assertThat(cycle.activeQuoteViews()).isEmpty();
        assertThat(paper.getOpenOrderIds()).isEmpty();
        assertThat(store.activeQuotes()).isEmpty();
    }

    @Test
    void initializeReadoptsOpenQuotesAndCancelsOrphans() {
        String kept = paper.placeLimitOrder(LimitOrderRequest.gtc("yes", OrderSide.BUY, 0.45, 10, true)).orderId();
        String orphan = paper.placeLimitOrder(LimitOrderRequest.gtc("yes", OrderSide.BUY, 0.44, 10, true)).orderId();
        store.insertQuote(new QuoteRecord(null, "m1", "yes", kept, null, 0.45, null, 0.50, 10,
                QuoteRecord.ACTIVE, NOW, NOW));
        long stale = store.insertQuote(new QuoteRecord(null, "m9", "other", "gone", null, 0.30, null, 0.35, 10,
                QuoteRecord.ACTIVE, NOW, NOW));

        cycle.initialize(MARKETS);

        assertThat(cycle.activeQuoteViews()).singleElement().satisfies(view -> {
            assertThat(view.bidOrderId()).isEqualTo(kept);
            assertThat(view.bidState()).isEqualTo(OrderState.LIVE);
            assertThat(view.askState()).isEqualTo(OrderState.CANCELLED);
        });
        assertThat(paper.getOpenOrderIds()).containsExactly(kept);
        assertThat(paper.getOpenOrderIds()).doesNotContain(orphan);
        assertThat(store.activeQuotes()).extracting(QuoteRecord::id).doesNotContain(stale);
    }

    @Test
    void vanishedOrdersAreReportedAsPhantoms() {
        cycle.run(MARKETS);
        paper.cancelOrder(cycle.activeQuoteViews().get(0).bidOrderId());

        assertThat(cycle.detectPhantomOrders()).isEqualTo(1);
    }

    @Test
    void mergesHeldPairsBackToCollateral() {
        MarketRef pairMarket = new MarketRef("m2", "yes2", "no2", "cond2", "Will it snow?", null);
        paper.registerCompleteSet("cond2", "yes2", "no2");
        paper.splitPosition("cond2", 20);
        ledger.processSplit("m2", 20, "yes2", "no2");

        cycle.mergePairs(Map.of("m2", pairMarket), 10);

        assertThat(ledger.mergeAmount("m2")).isZero();
        assertThat(paper.shares("yes2")).isZero();
        assertThat(store.inventory()).hasSize(2);
    }

    @Test
    void lockedCapitalCountsOnlyRestingBids() {
        QuotePair resting = new QuotePair(MARKET, 0.48, 0.52, 10, 10, NOW);
        resting.markPlaced(QuoteSide.BID, "b1", OrderState.LIVE);
        resting.markPlaced(QuoteSide.ASK, "a1", OrderState.LIVE);
        QuotePair filled = new QuotePair(MARKET, 0.40, 0.60, 10, 10, NOW);
        filled.markPlaced(QuoteSide.BID, "b2", OrderState.FILLED);

        assertThat(MarketMakingCycle.lockedCapital(List.of(resting, filled))).isCloseTo(4.8, within(1e-9));
    }
}
