package com.polybot.mm.strategy.pricing;

import com.polybot.mm.config.MmProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeuristicPricingEngineTest {

    private static double delta(double vol, double trackedVol) {
        return HeuristicPricingEngine.dynamicDelta(vol, 0, 0, trackedVol, 1.5, 8.0, 0.3, 0.2, 0.3, 0.2);
    }

    @Test
    void deltaIsClampedToConfiguredRange() {
        assertThat(delta(2.0, 0)).isEqualTo(1.5);
        assertThat(delta(20.0, 0)).isCloseTo(6.2, within(1e-9));
        assertThat(delta(200.0, 0)).isEqualTo(8.0);
    }

    @Test
    void trackedVolatilityReplacesSpreadProxy() {
        assertThat(delta(2.0, 10.0)).isCloseTo(3.2, within(1e-9));
    }

    @Test
    void skewLeansAgainstInventory() {
        double longSkew = HeuristicPricingEngine.skew(50, 100, 0.5, 0.3);
        double shortSkew = HeuristicPricingEngine.skew(-50, 100, 0.5, 0.3);

        assertThat(longSkew).isCloseTo(-0.325, within(1e-9));
        assertThat(shortSkew).isCloseTo(0.325, within(1e-9));
        assertThat(HeuristicPricingEngine.skew(50, 0, 0.5, 0.3)).isZero();
    }

    @Test
    void bidAskAroundMid() {
        QuotePrices prices = HeuristicPricingEngine.bidAsk(0.50, 2.0, 0);

        assertThat(prices.bid()).isEqualTo(0.48);
        assertThat(prices.ask()).isEqualTo(0.52);
    }

    @Test
    void collapsedSpreadIsWidenedToOneTickEachSide() {
        QuotePrices prices = HeuristicPricingEngine.bidAsk(0.50, 0.2, 0);

        assertThat(prices.bid()).isEqualTo(0.49);
        assertThat(prices.ask()).isEqualTo(0.51);
    }

    @Test
    void longInventoryShiftsBothSidesDown() {
        HeuristicPricingEngine engine = new HeuristicPricingEngine(MmProperties.defaults().pricing());

        QuotePrices flat = engine.quote(new PricingInput(0.50, 4.0, 0, 0, 0, 0, 0, 50, 0.0, 0, 1.5, 10));
        QuotePrices loaded = engine.quote(new PricingInput(0.50, 4.0, 0, 0, 0, 80, 0.5, 50, 1.0, 1.0, 1.5, 10));

        assertThat(loaded.bid()).isLessThanOrEqualTo(flat.bid());
        assertThat(loaded.ask()).isLessThanOrEqualTo(flat.ask());
        assertThat(loaded.bid()).isLessThan(loaded.ask());
    }
}
