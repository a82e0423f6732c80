package com.polybot.mm.strategy.pricing;

import com.polybot.mm.config.MmProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AvellanedaStoikovEngineTest {

    private static final AsParams PARAMS = new AsParams(0.1, 0.5, 1.5, 1.0, 3.0, 12.0);

    @Test
    void longInventoryPullsReservationPriceBelowMid() {
        double flat = AvellanedaStoikovEngine.reservationPrice(0.50, 0, 100, 0.1, 5.0, 1.0);
        double longPos = AvellanedaStoikovEngine.reservationPrice(0.50, 50, 100, 0.1, 5.0, 1.0);
        double shortPos = AvellanedaStoikovEngine.reservationPrice(0.50, -50, 100, 0.1, 5.0, 1.0);

        assertThat(flat).isEqualTo(0.50);
        assertThat(longPos).isLessThan(0.50);
        assertThat(shortPos).isGreaterThan(0.50);
    }

    @Test
    void spreadWidensWithVolatility() {
        double calm = AvellanedaStoikovEngine.optimalSpread(0.1, 1.0, 1.0, 1.5);
        double wild = AvellanedaStoikovEngine.optimalSpread(0.1, 30.0, 1.0, 1.5);

        assertThat(wild).isGreaterThan(calm);
    }

    @Test
    void degenerateParametersFallBackToFixedSpread() {
        assertThat(AvellanedaStoikovEngine.optimalSpread(0.0, 5.0, 1.0, 1.5)).isEqualTo(0.02);
        assertThat(AvellanedaStoikovEngine.optimalSpread(0.1, 5.0, 1.0, 0.0)).isEqualTo(0.02);
    }

    @Test
    void gammaGrowsWithInventory() {
        assertThat(AvellanedaStoikovEngine.dynamicGamma(0.1, 0.5, 0.0)).isEqualTo(0.1);
        assertThat(AvellanedaStoikovEngine.dynamicGamma(0.1, 0.5, -1.0)).isCloseTo(0.15, within(1e-12));
    }

    @Test
    void timeRemainingIsNormalizedToThirtyDays() {
        assertThat(AvellanedaStoikovEngine.estimateTimeRemaining(15)).isEqualTo(0.5);
        assertThat(AvellanedaStoikovEngine.estimateTimeRemaining(90)).isEqualTo(1.0);
        assertThat(AvellanedaStoikovEngine.estimateTimeRemaining(0)).isEqualTo(0.01);
    }

    @Test
    void spreadIsClampedToMaximum() {
        QuotePrices prices = AvellanedaStoikovEngine.quotes(0.50, 0, 100, 2.0, PARAMS, 0);

        assertThat(prices.bid()).isEqualTo(0.44);
        assertThat(prices.ask()).isEqualTo(0.56);
    }

    @Test
    void askNeverBelowEntryWhileLong() {
        QuotePrices prices = AvellanedaStoikovEngine.quotes(0.50, 50, 100, 2.0, PARAMS, 0.60);

        assertThat(prices.ask()).isEqualTo(0.61);
        assertThat(prices.bid()).isEqualTo(0.44);
    }

    @Test
    void engineQuotesOnTheTickGrid() {
        MmProperties defaults = MmProperties.defaults();
        AvellanedaStoikovEngine engine = new AvellanedaStoikovEngine(defaults.pricing(), defaults.risk());

        QuotePrices prices = engine.quote(new PricingInput(0.37, 2.0, 0.1, 0.0, 3.0, 0, 0, 50, 0, 0, 1.5, 10));

        assertThat(prices.bid()).isLessThan(0.37);
        assertThat(prices.ask()).isGreaterThan(0.37);
        assertThat(prices.bid() * 100).isCloseTo(Math.round(prices.bid() * 100), within(1e-9));
        assertThat(prices.ask() * 100).isCloseTo(Math.round(prices.ask() * 100), within(1e-9));
        assertThat(engine.name()).isEqualTo("avellaneda-stoikov");
    }
}
