package com.polybot.mm.strategy.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.config.MmProperties;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.domain.TokenLeg;
import com.polybot.mm.events.NoopMmEventPublisher;
import com.polybot.mm.store.InMemoryMmStore;
import com.polybot.mm.strategy.inventory.InventoryLedger;
import com.polybot.mm.strategy.loop.MarketMakingCycle;
import com.polybot.mm.strategy.loop.MarketMakingLoop;
import com.polybot.mm.strategy.risk.MmRiskManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MmStatusControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private MarketMakingCycle cycle;
    @Mock
    private MarketMakingLoop loop;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final MmProperties properties = MmProperties.defaults();
    private MmRiskManager risk;
    private InventoryLedger ledger;
    private MmStatusController controller;

    @BeforeEach
    void setUp() {
        risk = new MmRiskManager(properties, new InMemoryMmStore(clock, new ObjectMapper()),
                new NoopMmEventPublisher(), clock);
        ledger = new InventoryLedger(clock);
        controller = new MmStatusController(properties, risk, cycle, loop, ledger);
    }

    @Test
    void statusReportsLoopRiskAndBook() {
        when(loop.isRunning()).thenReturn(true);
        when(cycle.cycle()).thenReturn(42L);
        when(cycle.activeQuoteViews()).thenReturn(List.of());
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.40, 10, TokenLeg.YES);

        MmStatusController.MmStatusResponse status = controller.status().getBody();

        assertThat(status).isNotNull();
        assertThat(status.running()).isTrue();
        assertThat(status.cycle()).isEqualTo(42L);
        assertThat(status.paused()).isFalse();
        assertThat(status.riskMode()).isEqualTo("OK");
        assertThat(status.totalExposure()).isEqualTo(4.0);
        assertThat(status.inventory()).hasSize(1);
    }

    @Test
    void pauseAndResumeFlipTheRiskManager() {
        assertThat(controller.pause("maintenance").getBody().paused()).isTrue();
        assertThat(risk.isPaused()).isTrue();

        assertThat(controller.resume().getBody().paused()).isFalse();
        assertThat(risk.isPaused()).isFalse();
    }
}
