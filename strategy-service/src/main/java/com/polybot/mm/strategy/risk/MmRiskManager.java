package com.polybot.mm.strategy.risk;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.events.MmEventPublisher;
import com.polybot.mm.events.MmEventTypes;
import com.polybot.mm.store.HighWaterMark;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.strategy.model.QuoteValidation;
import com.polybot.mm.strategy.model.RiskMode;
import com.polybot.mm.strategy.pricing.TickMath;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Quote sanity checks and the portfolio drawdown switch.
 *
 * <p>Drawdown is measured against the persisted high-water mark. Crossing the kill threshold pauses quoting and
 * latches the kill time; {@link #tryAutoResume(double)} lifts the pause once the drawdown has recovered below the
 * resume threshold, the cooldown has passed and the daily recovery budget allows it.
 *
 * <p>Read by the loop thread, written by the risk monitor and the status endpoint.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MmRiskManager {

    private static final double MIN_SPREAD_PTS = 1.0;
    private static final double INVENTORY_WARN_RATIO = 0.9;

    private final @NonNull MmProperties properties;
    private final @NonNull MmStore store;
    private final @NonNull MmEventPublisher events;
    private final @NonNull Clock clock;

    private volatile boolean paused;
    private volatile RiskMode riskMode = RiskMode.OK;
    private Instant killTriggeredAt;
    private LocalDate recoveryDate;
    private int recoveriesToday;
    private boolean killLogged;
    private boolean reduceLogged;
    private boolean stopLossLogged;

    /**
     * Reject quotes that are crossed, out of the price band, too wide, too far from mid or too tight to pay for
     * themselves.
     */
    public QuoteValidation validateMmQuote(double bid, double ask, double mid, double maxDelta) {
        if (paused) {
            return QuoteValidation.reject("trading paused");
        }
        if (bid >= ask) {
            return QuoteValidation.reject("crossed quote: bid %.2f >= ask %.2f".formatted(bid, ask));
        }
        if (bid < TickMath.MIN_PRICE || ask > TickMath.MAX_PRICE) {
            return QuoteValidation.reject("price out of range: bid %.2f ask %.2f".formatted(bid, ask));
        }

        double spreadPts = TickMath.round2((ask - bid) * 100.0);
        double maxSpread = Math.min(2.0 * maxDelta + 1.0, risk().maxSpreadPts());
        if (spreadPts > maxSpread) {
            return QuoteValidation.reject("spread %.2f pts > max %.2f".formatted(spreadPts, maxSpread));
        }

        double bidDelta = (mid - bid) * 100.0;
        double askDelta = (ask - mid) * 100.0;
        if (bidDelta > maxDelta * 2.0 || askDelta > maxDelta * 2.0) {
            return QuoteValidation.reject("quote too far from mid: bid -%.1f ask +%.1f pts".formatted(bidDelta, askDelta));
        }

        if (spreadPts < MIN_SPREAD_PTS) {
            return QuoteValidation.reject("spread %.2f pts < min %.1f".formatted(spreadPts, MIN_SPREAD_PTS));
        }
        return QuoteValidation.ok();
    }

    /**
     * Fold the valuation into the high-water mark and classify the drawdown. KILL pauses quoting.
     */
    public synchronized RiskMode checkIntradayDrawdown(double portfolioValue) {
        double peak = store.updateHighWaterMark(portfolioValue);
        double ddPct = drawdownPct(peak, portfolioValue);
        MmProperties.Risk risk = risk();

        RiskMode next;
        if (ddPct >= risk.ddKillPct()) {
            paused = true;
            if (killTriggeredAt == null) {
                killTriggeredAt = clock.instant();
            }
            if (!killLogged) {
                log.error("KILL SWITCH: intraday drawdown {}% >= {}% (peak={}, current={}), quoting paused",
                        TickMath.round2(ddPct), risk.ddKillPct(), peak, portfolioValue);
                killLogged = true;
            }
            reduceLogged = false;
            next = RiskMode.KILL;
        } else if (ddPct >= risk.ddReducePct()) {
            if (!reduceLogged) {
                log.warn("drawdown {}% >= {}%, reducing exposure", TickMath.round2(ddPct), risk.ddReducePct());
                reduceLogged = true;
            }
            killLogged = false;
            next = RiskMode.REDUCE;
        } else {
            killLogged = false;
            reduceLogged = false;
            next = RiskMode.OK;
        }
        transition(next, ddPct, peak, portfolioValue);
        return next;
    }

    /**
     * Lift a kill-switch pause. Manual pauses and stop-loss pauses without a kill are never lifted here.
     */
    public synchronized boolean tryAutoResume(double portfolioValue) {
        if (!paused || killTriggeredAt == null) {
            return false;
        }
        MmProperties.Risk risk = risk();
        double peak = store.highWaterMark().map(HighWaterMark::peakValue).orElse(portfolioValue);
        double ddPct = drawdownPct(peak, portfolioValue);
        if (ddPct >= risk.ddResumePct()) {
            return false;
        }

        Instant now = clock.instant();
        Duration sinceKill = Duration.between(killTriggeredAt, now);
        if (sinceKill.compareTo(Duration.ofMinutes(risk.ddCooldownMinutes())) < 0) {
            log.debug("auto-resume waiting for cooldown ({}s elapsed)", sinceKill.toSeconds());
            return false;
        }

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!today.equals(recoveryDate)) {
            recoveryDate = today;
            recoveriesToday = 0;
        }
        if (recoveriesToday >= risk.ddMaxRecoveriesPerDay()) {
            log.debug("auto-resume blocked: {} recoveries already used today", recoveriesToday);
            return false;
        }

        recoveriesToday++;
        paused = false;
        killTriggeredAt = null;
        killLogged = false;
        reduceLogged = false;
        stopLossLogged = false;
        log.info("AUTO-RESUME: drawdown {}% < {}% after {} min cooldown (recovery {}/{} today)",
                TickMath.round2(ddPct), risk.ddResumePct(), sinceKill.toMinutes(), recoveriesToday,
                risk.ddMaxRecoveriesPerDay());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("drawdownPct", TickMath.round2(ddPct));
        data.put("recoveriesToday", recoveriesToday);
        events.publish(MmEventTypes.RISK_RESUMED, null, data);
        return true;
    }

    /**
     * Hard stop on peak-to-current drawdown. Pauses on trigger; the pause is lifted only by a kill recovery or by
     * hand.
     */
    public synchronized DrawdownStatus checkDrawdownStopLoss(double portfolioValue) {
        double peak = store.updateHighWaterMark(portfolioValue);
        double ddPct = drawdownPct(peak, portfolioValue);
        if (ddPct >= risk().drawdownStopLossPct()) {
            paused = true;
            if (!stopLossLogged) {
                log.error("DRAWDOWN STOP LOSS: {}% from peak {} (limit {}%), quoting paused",
                        TickMath.round2(ddPct), peak, risk().drawdownStopLossPct());
                stopLossLogged = true;
            }
            return new DrawdownStatus(true, ddPct);
        }
        return new DrawdownStatus(false, ddPct);
    }

    /**
     * Realized loss against portfolio value. True means the loss limit is hit.
     */
    public boolean checkStopLoss(double totalPnl, double portfolioValue) {
        if (portfolioValue <= 0 || totalPnl >= 0) {
            return false;
        }
        double lossPct = -totalPnl / portfolioValue * 100.0;
        if (lossPct >= risk().stopLossPct()) {
            log.warn("stop loss hit: loss {}% >= {}%", TickMath.round2(lossPct), risk().stopLossPct());
            return true;
        }
        return false;
    }

    public QuoteValidation checkInventoryRisk(double netPosition, double maxInventory) {
        double abs = Math.abs(netPosition);
        if (abs > maxInventory) {
            return QuoteValidation.reject("inventory %.1f > max %.1f".formatted(abs, maxInventory));
        }
        if (maxInventory > 0 && abs > maxInventory * INVENTORY_WARN_RATIO) {
            log.warn("inventory {} is above {}% of max {}", abs, (int) (INVENTORY_WARN_RATIO * 100), maxInventory);
        }
        return QuoteValidation.ok();
    }

    public ExposureCheck checkGlobalExposure(double onchainBalance, double mmExposure, double otherExposure) {
        if (onchainBalance <= 0) {
            return new ExposureCheck(true, 0.0);
        }
        double total = onchainBalance + mmExposure + otherExposure;
        double pct = TickMath.round1((mmExposure + otherExposure) / total * 100.0);
        return new ExposureCheck(pct <= risk().maxTotalExposurePct(), pct);
    }

    public synchronized void pause(String reason) {
        if (!paused) {
            log.warn("quoting paused: {}", reason);
        }
        paused = true;
    }

    /**
     * Manual resume. Clears any latched kill so the next drawdown breach is reported afresh.
     */
    public synchronized void resume() {
        if (paused) {
            log.info("quoting resumed manually");
        }
        paused = false;
        killTriggeredAt = null;
        killLogged = false;
        reduceLogged = false;
        stopLossLogged = false;
    }

    public boolean isPaused() {
        return paused;
    }

    public RiskMode riskMode() {
        return riskMode;
    }

    public synchronized Optional<Instant> killTriggeredAt() {
        return Optional.ofNullable(killTriggeredAt);
    }

    public synchronized int recoveriesToday() {
        return today().equals(recoveryDate) ? recoveriesToday : 0;
    }

    private void transition(RiskMode next, double ddPct, double peak, double value) {
        RiskMode previous = riskMode;
        riskMode = next;
        if (previous == next) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", previous.name());
        data.put("to", next.name());
        data.put("drawdownPct", TickMath.round2(ddPct));
        data.put("peak", peak);
        data.put("portfolioValue", value);
        events.publish(MmEventTypes.RISK_MODE_CHANGED, null, data);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private MmProperties.Risk risk() {
        return properties.risk();
    }

    private static double drawdownPct(double peak, double value) {
        return peak > 0 ? (peak - value) / peak * 100.0 : 0.0;
    }
}
