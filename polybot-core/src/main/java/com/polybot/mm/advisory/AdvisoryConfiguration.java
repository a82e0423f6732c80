package com.polybot.mm.advisory;

import com.polybot.mm.config.MmProperties;
import com.polybot.mm.store.MmStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods=false)
public class AdvisoryConfiguration {

  @Bean(destroyMethod="close")
  public FallbackAdvisors fallbackAdvisors(MmProperties properties) {
    return new FallbackAdvisors(properties.advisory());
  }

  /**
   * Custom {@link RiskOfficer}, {@link MarketScorer} or {@link EventRiskGuard} beans replace the defaults.
   */
  @Bean
  public Advisors advisors(
      MmProperties properties,
      FallbackAdvisors fallbackAdvisors,
      MmStore store,
      ObjectProvider<RiskOfficer> riskOfficer,
      ObjectProvider<MarketScorer> marketScorer,
      ObjectProvider<EventRiskGuard> eventRiskGuard
  ) {
    MmProperties.Advisory advisory = properties.advisory();
    return new Advisors(
        fallbackAdvisors.guard(riskOfficer.getIfAvailable(
            () -> new DefaultRiskOfficer(advisory.fallbackSizeMultiplier(), advisory.defaultRiskScore()))),
        fallbackAdvisors.guard(marketScorer.getIfAvailable(() -> new NeutralMarketScorer(advisory.defaultRiskScore()))),
        fallbackAdvisors.guard(eventRiskGuard.getIfAvailable(() -> new StoreEventRiskGuard(store))));
  }
}
