package com.polybot.mm.strategy.pricing;

import com.polybot.mm.config.MmProperties;

import static com.polybot.mm.strategy.pricing.TickMath.MAX_PRICE;
import static com.polybot.mm.strategy.pricing.TickMath.MIN_PRICE;
import static com.polybot.mm.strategy.pricing.TickMath.TICK;
import static com.polybot.mm.strategy.pricing.TickMath.clamp;
import static com.polybot.mm.strategy.pricing.TickMath.round2;

/**
 * Avellaneda-Stoikov quoting: inventory-adaptive gamma, reservation price, then optimal spread around it.
 *
 * <pre>
 *   gamma = gammaBase · (1 + alpha · |q|)
 *   r     = mid − q · gamma · σ² · T
 *   s     = gamma · σ² · T + (2 / gamma) · ln(1 + gamma / kappa)
 * </pre>
 *
 * with {@code q} the inventory ratio and {@code σ} the volatility in price units.
 */
public class AvellanedaStoikovEngine implements PricingEngine {

    static final double DEGENERATE_SPREAD = 0.02;
    private static final double HORIZON_DAYS = 30.0;
    private static final double MIN_TIME_REMAINING = 0.01;
    private static final double FALLBACK_MAX_INVENTORY = 100.0;

    private final AsParams baseParams;

    public AvellanedaStoikovEngine(MmProperties.Pricing pricing, MmProperties.Risk risk) {
        this(new AsParams(
                pricing.gammaBase(),
                pricing.gammaAlpha(),
                pricing.kappaDefault(),
                1.0,
                pricing.deltaMin() * 2,
                risk.maxSpreadPts()
        ));
    }

    public AvellanedaStoikovEngine(AsParams baseParams) {
        this.baseParams = baseParams;
    }

    @Override
    public QuotePrices quote(PricingInput in) {
        double mid = in.mid();
        double maxInventory = mid > 0 ? in.maxPerMarketUsd() / mid : FALLBACK_MAX_INVENTORY;
        AsParams params = baseParams.withMarket(in.kappa(), estimateTimeRemaining(in.daysToResolution()));
        return quotes(mid, in.netPosition(), maxInventory, in.effectiveVolPts(), params, in.avgEntryPrice());
    }

    @Override
    public String name() {
        return "avellaneda-stoikov";
    }

    public AsParams baseParams() {
        return baseParams;
    }

    public static double reservationPrice(double mid, double inventory, double maxInventory,
                                          double gamma, double volPts, double timeRemaining) {
        if (maxInventory <= 0) {
            return mid;
        }
        double q = inventory / maxInventory;
        double sigma = volPts / 100.0;
        return mid - q * gamma * sigma * sigma * timeRemaining;
    }

    /**
     * Optimal spread in price units.
     */
    public static double optimalSpread(double gamma, double volPts, double timeRemaining, double kappa) {
        if (gamma <= 0 || kappa <= 0) {
            return DEGENERATE_SPREAD;
        }
        double sigma = volPts / 100.0;
        double inventoryComponent = gamma * sigma * sigma * timeRemaining;
        double arrivalComponent = (2.0 / gamma) * Math.log(1.0 + gamma / kappa);
        return inventoryComponent + arrivalComponent;
    }

    public static double dynamicGamma(double gammaBase, double alpha, double inventoryRatio) {
        return gammaBase * (1.0 + alpha * Math.abs(inventoryRatio));
    }

    /**
     * Normalized time remaining: 30 days or more is 1.0; a resolved or past-due market is 0.01.
     */
    public static double estimateTimeRemaining(double daysToResolution) {
        if (daysToResolution <= 0) {
            return MIN_TIME_REMAINING;
        }
        return Math.min(daysToResolution / HORIZON_DAYS, 1.0);
    }

    public static QuotePrices quotes(double mid, double inventory, double maxInventory, double volPts,
                                     AsParams params, double avgEntryPrice) {
        double ratio = maxInventory > 0 ? inventory / maxInventory : 0.0;
        double gamma = dynamicGamma(params.gammaBase(), params.gammaAlpha(), ratio);
        double r = reservationPrice(mid, inventory, maxInventory, gamma, volPts, params.timeRemaining());
        double spreadPts = clamp(optimalSpread(gamma, volPts, params.timeRemaining(), params.kappa()) * 100.0,
                params.minSpreadPts(), params.maxSpreadPts());
        double s = spreadPts / 100.0;

        double bid = r - s / 2.0;
        double ask = r + s / 2.0;

        // never offer inventory below what it cost
        if (avgEntryPrice > 0 && inventory > 0) {
            ask = Math.max(ask, avgEntryPrice + TICK);
        }

        bid = clamp(round2(bid), MIN_PRICE, MAX_PRICE);
        ask = clamp(round2(ask), MIN_PRICE, MAX_PRICE);

        if (bid >= ask) {
            double midPoint = (bid + ask) / 2.0;
            bid = Math.max(MIN_PRICE, round2(midPoint - TICK));
            ask = Math.min(MAX_PRICE, round2(midPoint + TICK));
        }
        return new QuotePrices(bid, ask);
    }
}
