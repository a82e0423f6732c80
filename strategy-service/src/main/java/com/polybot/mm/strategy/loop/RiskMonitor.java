package com.polybot.mm.strategy.loop;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.store.RoundTripRecord;
import com.polybot.mm.strategy.metrics.MmMetricsCollector;
import com.polybot.mm.strategy.metrics.MmMetricsService;
import com.polybot.mm.strategy.model.RiskMode;
import com.polybot.mm.strategy.risk.MmRiskManager;
import com.polybot.mm.venue.VenueGateway;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Portfolio-level risk checks on their own thread, independent of the quoting cycle: drawdown stop loss, the
 * intraday kill switch and its auto-resume, the daily realized-loss limit, adverse-selection sampling and the
 * daily metrics roll-up.
 *
 * While the kill switch is engaged every open venue order is cancelled on each tick; the loop notices the
 * cancellations on its next reconciliation.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RiskMonitor {

    static final int DAILY_METRICS_EVERY_TICKS = 20;

    private final @NonNull MmProperties properties;
    private final @NonNull MmRiskManager risk;
    private final @NonNull VenueGateway venue;
    private final @NonNull MmStore store;
    private final @NonNull MmMetricsService metrics;
    private final @NonNull MmMetricsCollector collector;
    private final @NonNull Clock clock;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mm-risk-monitor");
        t.setDaemon(true);
        return t;
    });

    private long ticks;

    @PostConstruct
    void startIfEnabled() {
        if (!properties.enabled()) {
            return;
        }
        long period = properties.risk().monitorIntervalSeconds();
        executor.scheduleWithFixedDelay(this::safeTick, period, period, TimeUnit.SECONDS);
        log.info("risk monitor started (intervalSeconds={})", period);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    void tick() {
        ticks++;
        OptionalDouble value = venue.getPortfolioValue();
        if (value.isEmpty()) {
            log.debug("risk monitor: portfolio value unavailable, skipping tick");
            return;
        }
        double portfolioValue = value.getAsDouble();

        risk.checkDrawdownStopLoss(portfolioValue);
        RiskMode mode = risk.checkIntradayDrawdown(portfolioValue);
        if (mode == RiskMode.KILL) {
            cancelAllOpenOrders();
        }

        double dailyPnl = todaysNetPnl();
        if (risk.checkStopLoss(dailyPnl, portfolioValue)) {
            risk.pause("daily stop loss (net P&L %.2f)".formatted(dailyPnl));
        }

        if (risk.isPaused()) {
            risk.tryAutoResume(portfolioValue);
        }
        metrics.updateRisk(portfolioValue, risk.riskMode(), risk.isPaused());

        collector.measureAdverseSelection();
        if (ticks % DAILY_METRICS_EVERY_TICKS == 0) {
            collector.computeDailyMetrics(portfolioValue);
        }
    }

    private void cancelAllOpenOrders() {
        Set<String> open = venue.getOpenOrderIds();
        int cancelled = 0;
        for (String orderId : open) {
            if (venue.cancelOrder(orderId)) {
                cancelled++;
            }
        }
        if (!open.isEmpty()) {
            log.warn("kill switch: cancelled {}/{} open orders", cancelled, open.size());
        }
    }

    private double todaysNetPnl() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return store.roundTripsSince(today.atStartOfDay(ZoneOffset.UTC).toInstant()).stream()
                .mapToDouble(RoundTripRecord::netPnl)
                .sum();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("risk monitor tick failed, continuing", e);
        }
    }
}
