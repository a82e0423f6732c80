package com.polybot.mm.strategy.metrics;

import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.strategy.model.RiskMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for the quoting loop. Gauges read fields the loop and the risk monitor publish here.
 */
@Component
public class MmMetricsService {

    private final Counter quotesPlaced;
    private final Counter quotesFailed;
    private final Counter buyFills;
    private final Counter sellFills;
    private final Counter arbitrageExecuted;
    private final Counter divergences;

    private volatile double realizedPnl;
    private volatile double totalExposure;
    private volatile double portfolioValue;
    private volatile int activeQuotes;
    private volatile RiskMode riskMode = RiskMode.OK;
    private volatile boolean paused;
    private volatile double adverseSelectionAvgBps;

    public MmMetricsService(MeterRegistry registry) {
        this.quotesPlaced = Counter.builder("mm.quotes.placed")
                .description("Quote pairs that reached the book")
                .register(registry);
        this.quotesFailed = Counter.builder("mm.quotes.failed")
                .description("Quote placements where no side reached the book")
                .register(registry);
        this.buyFills = Counter.builder("mm.fills")
                .description("Detected fills")
                .tag("side", OrderSide.BUY.name())
                .register(registry);
        this.sellFills = Counter.builder("mm.fills")
                .description("Detected fills")
                .tag("side", OrderSide.SELL.name())
                .register(registry);
        this.arbitrageExecuted = Counter.builder("mm.arbitrage.executed")
                .description("Completed complete-set arbitrages")
                .register(registry);
        this.divergences = Counter.builder("mm.inventory.divergences")
                .description("Inventory legs corrected from the store")
                .register(registry);

        Gauge.builder("mm.pnl.realized", this, s -> s.realizedPnl)
                .description("Realized P&L across all markets (USDC)")
                .register(registry);
        Gauge.builder("mm.exposure.total", this, s -> s.totalExposure)
                .description("Cost basis of open positions (USDC)")
                .register(registry);
        Gauge.builder("mm.portfolio.value", this, s -> s.portfolioValue)
                .description("Last portfolio valuation seen by the risk monitor (USDC)")
                .register(registry);
        Gauge.builder("mm.quotes.active", this, s -> s.activeQuotes)
                .description("Quote pairs currently tracked")
                .register(registry);
        Gauge.builder("mm.risk.mode", this, s -> s.riskMode.ordinal())
                .description("Drawdown regime: 0=OK, 1=REDUCE, 2=KILL")
                .register(registry);
        Gauge.builder("mm.fills.adverse_selection", this, s -> s.adverseSelectionAvgBps)
                .description("Average mid move against fills after 120s, last measurement pass")
                .baseUnit("bps")
                .register(registry);
        Gauge.builder("mm.paused", this, s -> s.paused ? 1 : 0)
                .description("1 while quoting is paused")
                .register(registry);
    }

    public void recordQuotePlaced() {
        quotesPlaced.increment();
    }

    public void recordQuoteFailed() {
        quotesFailed.increment();
    }

    public void recordFill(OrderSide side) {
        (side == OrderSide.BUY ? buyFills : sellFills).increment();
    }

    public void recordArbitrage() {
        arbitrageExecuted.increment();
    }

    public void recordDivergences(int count) {
        if (count > 0) {
            divergences.increment(count);
        }
    }

    public void recordAdverseSelection(double avgBps) {
        this.adverseSelectionAvgBps = avgBps;
    }

    public void updateBook(double realizedPnl, double totalExposure, int activeQuotes) {
        this.realizedPnl = realizedPnl;
        this.totalExposure = totalExposure;
        this.activeQuotes = activeQuotes;
    }

    public void updateRisk(double portfolioValue, RiskMode riskMode, boolean paused) {
        this.portfolioValue = portfolioValue;
        this.riskMode = riskMode;
        this.paused = paused;
    }
}
