package com.polybot.mm.strategy.loop;

import com.polybot.mm.advisory.Advisors;
import com.polybot.mm.config.MmProperties;
import com.polybot.mm.events.MmEventPublisher;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.strategy.arbitrage.CompleteSetArbitrage;
import com.polybot.mm.strategy.inventory.InventoryLedger;
import com.polybot.mm.strategy.metrics.MmMetricsCollector;
import com.polybot.mm.strategy.metrics.MmMetricsService;
import com.polybot.mm.strategy.pricing.AvellanedaStoikovEngine;
import com.polybot.mm.strategy.pricing.HeuristicPricingEngine;
import com.polybot.mm.strategy.pricing.KappaEstimator;
import com.polybot.mm.strategy.pricing.PricingEngine;
import com.polybot.mm.strategy.pricing.StaleTracker;
import com.polybot.mm.strategy.pricing.VolTracker;
import com.polybot.mm.strategy.quote.Quoter;
import com.polybot.mm.strategy.risk.MmRiskManager;
import com.polybot.mm.venue.VenueGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the loop-thread components. They are plain objects owned by {@link MarketMakingCycle}; only the cycle,
 * the ledger and the collector are shared with other beans.
 */
@Slf4j
@Configuration
public class MarketMakingConfiguration {

    @Bean
    public PricingEngine pricingEngine(MmProperties properties) {
        MmProperties.Pricing pricing = properties.pricing();
        PricingEngine engine = switch (pricing.engine()) {
            case HEURISTIC -> new HeuristicPricingEngine(pricing);
            case AVELLANEDA_STOIKOV -> new AvellanedaStoikovEngine(pricing, properties.risk());
        };
        log.info("MM pricing engine: {}", engine.name());
        return engine;
    }

    @Bean
    public InventoryLedger inventoryLedger(Clock clock) {
        return new InventoryLedger(clock);
    }

    @Bean
    public MmMetricsCollector mmMetricsCollector(MmStore store, VenueGateway venue, MmMetricsService metrics,
                                                 Clock clock) {
        return new MmMetricsCollector(store, venue, metrics, clock);
    }

    @Bean
    public MarketMakingCycle marketMakingCycle(
            MmProperties properties,
            VenueGateway venue,
            InventoryLedger inventoryLedger,
            MmRiskManager riskManager,
            PricingEngine pricingEngine,
            Advisors advisors,
            MmStore store,
            MmEventPublisher events,
            MmMetricsService metrics,
            Clock clock
    ) {
        MmProperties.Quoting quoting = properties.quoting();
        MmProperties.Pricing pricing = properties.pricing();
        Quoter quoter = new Quoter(venue, events, clock, quoting.postOnly(), quoting.hangingPriceThreshold());
        CompleteSetArbitrage arbitrage = new CompleteSetArbitrage(venue, inventoryLedger, events,
                properties.arbitrage(), Duration.ofMillis(properties.venue().settleWaitMillis()), clock);
        return new MarketMakingCycle(
                properties,
                venue,
                quoter,
                inventoryLedger,
                riskManager,
                pricingEngine,
                new VolTracker(pricing.volHalflife()),
                new StaleTracker(clock, Duration.ofSeconds(pricing.staleThresholdSeconds())),
                new KappaEstimator(clock, Duration.ofMinutes(pricing.kappaWindowMinutes()), pricing.kappaDefault()),
                advisors,
                store,
                events,
                metrics,
                arbitrage,
                clock
        );
    }
}
