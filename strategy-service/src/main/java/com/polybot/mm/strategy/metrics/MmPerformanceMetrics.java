package com.polybot.mm.strategy.metrics;

import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.store.FillRecord;
import com.polybot.mm.store.QuoteRecord;
import com.polybot.mm.store.RoundTripRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Market-making performance measures. Prices are in [0, 1]; quality and adverse selection are in basis points of
 * the mid.
 */
public final class MmPerformanceMetrics {

    /**
     * Reported instead of infinity when there are gains and no losses.
     */
    public static final double PROFIT_FACTOR_CAP = 999.9;

    private static final double BPS = 10_000.0;
    private static final double DAYS_PER_YEAR = 365.0;
    private static final double MIN_STD = 0.001;

    private MmPerformanceMetrics() {
    }

    /**
     * Mean of realized spread over quoted spread, across quotes that saw both a buy and a sell fill.
     */
    public static double spreadCaptureRate(Collection<FillRecord> fills, Collection<QuoteRecord> quotes) {
        if (fills.isEmpty()) {
            return 0.0;
        }
        Map<Long, List<FillRecord>> fillsByQuote = new LinkedHashMap<>();
        for (FillRecord fill : fills) {
            if (fill.quoteId() != null) {
                fillsByQuote.computeIfAbsent(fill.quoteId(), k -> new ArrayList<>()).add(fill);
            }
        }
        Map<Long, QuoteRecord> quotesById = new HashMap<>();
        for (QuoteRecord quote : quotes) {
            if (quote.id() != null) {
                quotesById.put(quote.id(), quote);
            }
        }

        double totalCapture = 0.0;
        int count = 0;
        for (Map.Entry<Long, List<FillRecord>> e : fillsByQuote.entrySet()) {
            double buyPrice = vwap(e.getValue(), OrderSide.BUY);
            double sellPrice = vwap(e.getValue(), OrderSide.SELL);
            QuoteRecord quote = quotesById.get(e.getKey());
            if (Double.isNaN(buyPrice) || Double.isNaN(sellPrice) || quote == null
                    || quote.bidPrice() == null || quote.askPrice() == null) {
                continue;
            }
            double theoretical = quote.askPrice() - quote.bidPrice();
            if (theoretical > 0) {
                totalCapture += (sellPrice - buyPrice) / theoretical;
                count++;
            }
        }
        return count > 0 ? totalCapture / count : 0.0;
    }

    /**
     * Positive when the fill beat the mid: bought below it or sold above it.
     */
    public static double fillQuality(double fillPrice, double midAtFill, OrderSide side) {
        if (midAtFill <= 0) {
            return 0.0;
        }
        double improvement = side == OrderSide.BUY
                ? (midAtFill - fillPrice) / midAtFill
                : (fillPrice - midAtFill) / midAtFill;
        return improvement * BPS;
    }

    /**
     * Positive when the mid moved against the fill afterwards: down after a buy, up after a sell.
     */
    public static double adverseSelection(double midAtFill, double midLater, OrderSide side) {
        if (midAtFill <= 0) {
            return 0.0;
        }
        double movement = side == OrderSide.BUY
                ? (midAtFill - midLater) / midAtFill
                : (midLater - midAtFill) / midAtFill;
        return movement * BPS;
    }

    public static PnlSummary pnlSummary(Collection<RoundTripRecord> roundTrips) {
        double gross = 0.0;
        double net = 0.0;
        double size = 0.0;
        for (RoundTripRecord rt : roundTrips) {
            gross += rt.grossPnl();
            net += rt.netPnl();
            size += rt.size();
        }
        return new PnlSummary(gross, net, gross - net, roundTrips.size(), size);
    }

    /**
     * Annualized Sharpe ratio of daily returns; 0 with fewer than two observations.
     */
    public static double sharpeRatio(List<Double> dailyReturns, double riskFreeRate) {
        int n = dailyReturns.size();
        if (n < 2) {
            return 0.0;
        }
        double dailyRiskFree = riskFreeRate / DAYS_PER_YEAR;
        double mean = 0.0;
        for (double r : dailyReturns) {
            mean += r - dailyRiskFree;
        }
        mean /= n;
        double variance = 0.0;
        for (double r : dailyReturns) {
            double d = r - dailyRiskFree - mean;
            variance += d * d;
        }
        variance /= n - 1;
        double std = variance > 0 ? Math.sqrt(variance) : MIN_STD;
        return mean / std * Math.sqrt(DAYS_PER_YEAR);
    }

    /**
     * Gross gains over gross losses of completed round trips. Capped at {@link #PROFIT_FACTOR_CAP}.
     */
    public static double profitFactor(Collection<RoundTripRecord> roundTrips) {
        double gains = 0.0;
        double losses = 0.0;
        for (RoundTripRecord rt : roundTrips) {
            if (rt.netPnl() > 0) {
                gains += rt.netPnl();
            } else if (rt.netPnl() < 0) {
                losses -= rt.netPnl();
            }
        }
        if (losses == 0) {
            return gains > 0 ? PROFIT_FACTOR_CAP : 0.0;
        }
        return Math.min(PROFIT_FACTOR_CAP, gains / losses);
    }

    /**
     * Inventory turns per day, counting two fills per round trip.
     */
    public static double inventoryTurnRate(int fillsCount, double avgInventory, double periodHours) {
        if (avgInventory <= 0 || periodHours <= 0) {
            return 0.0;
        }
        double dailyFills = fillsCount * (24.0 / periodHours);
        return dailyFills / (2.0 * avgInventory);
    }

    private static double vwap(List<FillRecord> fills, OrderSide side) {
        double notional = 0.0;
        double size = 0.0;
        for (FillRecord f : fills) {
            if (f.side() == side) {
                notional += f.price() * f.size();
                size += f.size();
            }
        }
        return size > 0 ? notional / size : Double.NaN;
    }

    public record PnlSummary(double grossPnl, double netPnl, double totalFees, int roundTrips, double closedSize) {
    }
}
