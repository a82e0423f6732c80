package com.polybot.mm.strategy.pricing;

import com.polybot.mm.config.MmProperties;

import static com.polybot.mm.strategy.pricing.TickMath.MAX_PRICE;
import static com.polybot.mm.strategy.pricing.TickMath.MIN_PRICE;
import static com.polybot.mm.strategy.pricing.TickMath.TICK;
import static com.polybot.mm.strategy.pricing.TickMath.clamp;
import static com.polybot.mm.strategy.pricing.TickMath.roundToTick;

/**
 * Half-spread from volatility, book imbalance, staleness and a fee buffer, shifted by an inventory skew.
 * All deltas and skews are in points (0.01 price units).
 */
public class HeuristicPricingEngine implements PricingEngine {

    private static final double AGE_SKEW_BOOST = 0.3;

    private final MmProperties.Pricing cfg;

    public HeuristicPricingEngine(MmProperties.Pricing cfg) {
        this.cfg = cfg;
    }

    @Override
    public QuotePrices quote(PricingInput in) {
        double delta = dynamicDelta(in.volProxyPts(), in.imbalance(), in.staleness(), in.trackedVolPts());
        double skewFactor = cfg.skewFactor() + in.unwindUrgency() * AGE_SKEW_BOOST;
        double skew = skew(in.skewDirection(), 1.0, skewFactor, cfg.quadraticSkewFactor());
        return bidAsk(in.mid(), delta, skew);
    }

    @Override
    public String name() {
        return "heuristic";
    }

    double dynamicDelta(double volShort, double imbalance, double staleness, double trackedVol) {
        return dynamicDelta(volShort, imbalance, staleness, trackedVol,
                cfg.deltaMin(), cfg.deltaMax(),
                cfg.weightVol(), cfg.weightImbalance(), cfg.weightStale(), cfg.weightFee());
    }

    /**
     * {@code clamp(a·vol + b·|imbalance|·10 + c·stale·5 + d, min, max)}; tracked vol replaces the proxy when known.
     */
    public static double dynamicDelta(double volShort, double imbalance, double staleness, double trackedVol,
                                      double deltaMin, double deltaMax,
                                      double a, double b, double c, double d) {
        double vol = trackedVol > 0 ? trackedVol : volShort;
        double raw = a * vol + b * Math.abs(imbalance) * 10 + c * staleness * 5 + d * 1.0;
        return clamp(raw, deltaMin, deltaMax);
    }

    /**
     * Linear plus quadratic skew against the inventory ratio. Long inventory gives a negative skew.
     */
    public static double skew(double netInventory, double maxInventory, double skewFactor, double quadraticFactor) {
        if (maxInventory <= 0) {
            return 0.0;
        }
        double ratio = clamp(netInventory / maxInventory, -1.0, 1.0);
        double linear = -ratio * skewFactor;
        double sign = ratio > 0 ? -1.0 : 1.0;
        return linear + sign * ratio * ratio * quadraticFactor;
    }

    public static QuotePrices bidAsk(double mid, double deltaPts, double skewPts) {
        double deltaPrice = deltaPts / 100.0;
        double skewPrice = skewPts / 100.0;

        double bid = roundToTick(clamp(mid - deltaPrice + skewPrice, MIN_PRICE, MAX_PRICE));
        double ask = roundToTick(clamp(mid + deltaPrice + skewPrice, MIN_PRICE, MAX_PRICE));

        if (bid >= ask) {
            double midTick = roundToTick(mid);
            bid = roundToTick(midTick - TICK);
            ask = roundToTick(midTick + TICK);
        }
        return new QuotePrices(bid, ask);
    }
}
