package com.polybot.mm.strategy.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.config.MmProperties;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.events.NoopMmEventPublisher;
import com.polybot.mm.store.InMemoryMmStore;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.store.RoundTripRecord;
import com.polybot.mm.strategy.MutableClock;
import com.polybot.mm.strategy.metrics.MmMetricsCollector;
import com.polybot.mm.strategy.metrics.MmMetricsService;
import com.polybot.mm.strategy.model.RiskMode;
import com.polybot.mm.strategy.risk.MmRiskManager;
import com.polybot.mm.venue.BookSummary;
import com.polybot.mm.venue.LimitOrderRequest;
import com.polybot.mm.venue.PaperVenueOrderApi;
import com.polybot.mm.venue.VenueGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RiskMonitorTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final MmProperties properties = MmProperties.defaults();
    private final MmStore store = new InMemoryMmStore(clock, new ObjectMapper());
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MmMetricsService metrics = new MmMetricsService(registry);
    private final MmRiskManager risk = new MmRiskManager(properties, store, new NoopMmEventPublisher(), clock);

    private PaperVenueOrderApi paper;
    private VenueGateway gateway;

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.close();
        }
    }

    @Test
    void drawdownKillCancelsOpenOrdersAndRecoversAfterCooldown() {
        RiskMonitor monitor = monitor(50);
        paper.creditShares("yes", 100);
        paper.updateBook("yes", new BookSummary(0.49, 0.51, 100, 100, 5));
        paper.placeLimitOrder(LimitOrderRequest.gtc("yes", OrderSide.BUY, 0.10, 10, true));

        monitor.tick();
        assertThat(risk.riskMode()).isEqualTo(RiskMode.OK);
        assertThat(risk.isPaused()).isFalse();

        paper.updateBook("yes", new BookSummary(0.19, 0.21, 100, 100, 5));
        monitor.tick();

        assertThat(risk.riskMode()).isEqualTo(RiskMode.KILL);
        assertThat(risk.isPaused()).isTrue();
        assertThat(paper.getOpenOrderIds()).isEmpty();
        assertThat(registry.get("mm.risk.mode").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("mm.paused").gauge().value()).isEqualTo(1.0);

        paper.updateBook("yes", new BookSummary(0.44, 0.46, 100, 100, 5));
        clock.advance(Duration.ofMinutes(10));
        monitor.tick();
        assertThat(risk.isPaused()).isTrue();

        clock.advance(Duration.ofMinutes(20));
        monitor.tick();
        assertThat(risk.isPaused()).isFalse();
        assertThat(risk.riskMode()).isEqualTo(RiskMode.OK);
        assertThat(risk.recoveriesToday()).isEqualTo(1);
    }

    @Test
    void dailyRealizedLossPausesWithoutKill() {
        RiskMonitor monitor = monitor(1_000);
        store.insertRoundTrip(new RoundTripRecord("m1", "yes", 0.60, 0.35, 1_000, -250, -250, 3600.0, NOW));

        monitor.tick();

        assertThat(risk.isPaused()).isTrue();
        assertThat(risk.riskMode()).isEqualTo(RiskMode.OK);
        assertThat(risk.killTriggeredAt()).isEmpty();

        clock.advance(Duration.ofHours(1));
        monitor.tick();
        assertThat(risk.isPaused()).isTrue();
    }

    @Test
    void yesterdaysLossesDoNotCount() {
        RiskMonitor monitor = monitor(1_000);
        store.insertRoundTrip(new RoundTripRecord("m1", "yes", 0.60, 0.35, 1_000, -250, -250, 3600.0,
                NOW.minus(Duration.ofDays(1))));

        monitor.tick();

        assertThat(risk.isPaused()).isFalse();
        assertThat(registry.get("mm.portfolio.value").gauge().value()).isEqualTo(1_000.0);
    }

    @Test
    void missingValuationSkipsTheTick() {
        VenueGateway venue = Mockito.mock(VenueGateway.class);
        when(venue.getPortfolioValue()).thenReturn(OptionalDouble.empty());
        RiskMonitor monitor = new RiskMonitor(properties, risk, venue, store, metrics,
                new MmMetricsCollector(store, venue, metrics, clock), clock);

        monitor.tick();

        assertThat(store.highWaterMark()).isEmpty();
        verify(venue, never()).getOpenOrderIds();
    }

    private RiskMonitor monitor(double cash) {
        paper = PaperVenueOrderApi.deterministic(clock, cash);
        gateway = new VenueGateway(paper, clock, 2, 1_000);
        return new RiskMonitor(properties, risk, gateway, store, metrics,
                new MmMetricsCollector(store, gateway, metrics, clock), clock);
    }
}
