package com.polybot.mm.config;

import com.polybot.mm.domain.MarketRef;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class MmPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "mm.enabled=true",
        "mm.mode=LIVE",
        "mm.quoting.quote-size-usd=12.5",
        "mm.quoting.max-markets=3",
        "mm.pricing.engine=HEURISTIC",
        "mm.pricing.delta-min=2.0",
        "mm.risk.dd-kill-pct=30",
        "mm.arbitrage.enabled=true",
        "mm.store.mode=JDBC",
        "mm.markets[0].market-id=m1",
        "mm.markets[0].token-id=yes-1",
        "mm.markets[0].no-token-id=no-1",
        "mm.markets[0].condition-id=0xabc"
    ).run(context -> {
      assertThat(context).hasNotFailed();
      MmProperties properties = context.getBean(MmProperties.class);

      assertThat(properties.enabled()).isTrue();
      assertThat(properties.mode()).isEqualTo(MmProperties.TradingMode.LIVE);
      assertThat(properties.quoting().quoteSizeUsd()).isEqualTo(12.5);
      assertThat(properties.quoting().maxMarkets()).isEqualTo(3);
      assertThat(properties.pricing().engine()).isEqualTo(MmProperties.PricingEngineType.HEURISTIC);
      assertThat(properties.pricing().deltaMin()).isEqualTo(2.0);
      assertThat(properties.risk().ddKillPct()).isEqualTo(30.0);
      assertThat(properties.arbitrage().enabled()).isTrue();
      assertThat(properties.store().mode()).isEqualTo(MmProperties.StoreMode.JDBC);

      assertThat(properties.markets()).hasSize(1);
      MarketRef market = properties.markets().get(0);
      assertThat(market.tokenId()).isEqualTo("yes-1");
      assertThat(market.supportsCompleteSet()).isTrue();
      assertThat(market.daysToResolution()).isEqualTo(30.0);
    });
  }

  @Test
  void unsetSectionsFallBackToDefaults() {
    runner.run(context -> {
      MmProperties properties = context.getBean(MmProperties.class);

      assertThat(properties.enabled()).isFalse();
      assertThat(properties.mode()).isEqualTo(MmProperties.TradingMode.PAPER);
      assertThat(properties.quoting().cycleSeconds()).isEqualTo(10L);
      assertThat(properties.quoting().postOnly()).isTrue();
      assertThat(properties.pricing().engine()).isEqualTo(MmProperties.PricingEngineType.AVELLANEDA_STOIKOV);
      assertThat(properties.risk().ddReducePct()).isEqualTo(15.0);
      assertThat(properties.risk().ddResumePct()).isEqualTo(20.0);
      assertThat(properties.circuitBreaker().threshold()).isEqualTo(5);
      assertThat(properties.splitMerge().mergeEveryCycles()).isEqualTo(6);
      assertThat(properties.store().mode()).isEqualTo(MmProperties.StoreMode.MEMORY);
      assertThat(properties.markets()).isEmpty();
    });
  }

  @Test
  void rejectsOutOfRangeValues() {
    runner.withPropertyValues("mm.quoting.max-markets=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void rejectsResumeThresholdAtOrAboveKill() {
    runner.withPropertyValues("mm.risk.dd-resume-pct=10", "mm.risk.dd-kill-pct=10")
        .run(context -> assertThat(context).hasFailed());
    runner.withPropertyValues("mm.risk.dd-resume-pct=30", "mm.risk.dd-kill-pct=25")
        .run(context -> assertThat(context).hasFailed());
    runner.withPropertyValues("mm.risk.dd-resume-pct=10", "mm.risk.dd-kill-pct=12")
        .run(context -> assertThat(context).hasNotFailed());
  }

  @Test
  void programmaticDefaultsMatchBoundDefaults() {
    MmProperties defaults = MmProperties.defaults();

    assertThat(defaults.quoting().quoteSizeUsd()).isEqualTo(5.0);
    assertThat(defaults.venue().executorBaseUrl()).isEqualTo("http://localhost:8080");
    assertThat(defaults.advisory().minMarketScore()).isEqualTo(5.0);
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(MmProperties.class)
  static class TestConfig {
  }
}
