package com.polybot.mm.strategy.metrics;

import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.strategy.model.RiskMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MmMetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MmMetricsService metrics = new MmMetricsService(registry);

    @Test
    void countsFillsPerSide() {
        metrics.recordFill(OrderSide.BUY);
        metrics.recordFill(OrderSide.BUY);
        metrics.recordFill(OrderSide.SELL);
        metrics.recordQuotePlaced();

        assertThat(registry.get("mm.fills").tag("side", "BUY").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("mm.fills").tag("side", "SELL").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("mm.quotes.placed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void divergenceCounterIgnoresZero() {
        metrics.recordDivergences(0);
        metrics.recordDivergences(3);

        assertThat(registry.get("mm.inventory.divergences").counter().count()).isEqualTo(3.0);
    }

    @Test
    void gaugesReflectLatestState() {
        metrics.updateBook(1.5, 40.0, 3);
        metrics.updateRisk(950.0, RiskMode.KILL, true);
        metrics.recordAdverseSelection(12.5);

        assertThat(registry.get("mm.pnl.realized").gauge().value()).isEqualTo(1.5);
        assertThat(registry.get("mm.quotes.active").gauge().value()).isEqualTo(3.0);
        assertThat(registry.get("mm.risk.mode").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("mm.paused").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("mm.portfolio.value").gauge().value()).isEqualTo(950.0);
        assertThat(registry.get("mm.fills.adverse_selection").gauge().value()).isEqualTo(12.5);
    }
}
