package com.polybot.mm.config;

import com.polybot.mm.domain.MarketRef;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix="mm")
public record MmProperties(
    @NotNull Boolean enabled,
    TradingMode mode,
    @Valid Quoting quoting,
    @Valid Pricing pricing,
    @Valid Proposal proposal,
    @Valid Risk risk,
    @Valid Venue venue,
    @Valid SplitMerge splitMerge,
    @Valid Arbitrage arbitrage,
    @Valid CircuitBreaker circuitBreaker,
    @Valid Advisory advisory,
    @Valid Store store,
    List<MarketRef> markets
) {

  public MmProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (quoting == null) {
      quoting = defaultQuoting();
    }
    if (pricing == null) {
      pricing = defaultPricing();
    }
    if (proposal == null) {
      proposal = defaultProposal();
    }
    if (risk == null) {
      risk = defaultRisk();
    }
    if (venue == null) {
      venue = defaultVenue();
    }
    if (splitMerge == null) {
      splitMerge = defaultSplitMerge();
    }
    if (arbitrage == null) {
      arbitrage = defaultArbitrage();
    }
    if (circuitBreaker == null) {
      circuitBreaker = defaultCircuitBreaker();
    }
    if (advisory == null) {
      advisory = defaultAdvisory();
    }
    if (store == null) {
      store = defaultStore();
    }
    markets = markets == null ? List.of() : List.copyOf(markets);
  }

  public static MmProperties defaults() {
    return new MmProperties(null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Quoting defaultQuoting() {
    return new Quoting(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Pricing defaultPricing() {
    return new Pricing(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Proposal defaultProposal() {
    return new Proposal(null, null, null, null, null, null);
  }

  private static Risk defaultRisk() {
    return new Risk(null, null, null, null, null, null, null, null, null, null);
  }

  private static Venue defaultVenue() {
    return new Venue(null, null, null, null, null, null);
  }

  private static SplitMerge defaultSplitMerge() {
    return new SplitMerge(null, null, null, null);
  }

  private static Arbitrage defaultArbitrage() {
    return new Arbitrage(null, null, null, null, null, null);
  }

  private static CircuitBreaker defaultCircuitBreaker() {
    return new CircuitBreaker(null, null);
  }

  private static Advisory defaultAdvisory() {
    return new Advisory(null, null, null, null);
  }

  private static Store defaultStore() {
    return new Store(null);
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  public enum PricingEngineType {
    /**
     * Delta/skew heuristic driven by volatility, book imbalance and staleness.
     */
    HEURISTIC,
    /**
     * Avellaneda-Stoikov reservation price and optimal spread.
     */
    AVELLANEDA_STOIKOV
  }

  public enum StoreMode {
    MEMORY,
    JDBC
  }

  public record Quoting(
      @NotNull @Positive Long cycleSeconds,
      @NotNull @Positive Double quoteSizeUsd,
      @NotNull @Min(1) Integer maxMarkets,
      @NotNull @PositiveOrZero Double requoteThresholdPts,
      @NotNull @PositiveOrZero Long minQuoteLifetimeSeconds,
      @NotNull Boolean postOnly,
      @NotNull Boolean hangingOrders,
      @NotNull @PositiveOrZero Double hangingPriceThreshold,
      @NotNull @Positive Double minOrderShares,
      @NotNull @Min(1) Integer crossRejectThreshold,
      @NotNull @PositiveOrZero Long crossCooldownSeconds,
      @NotNull @PositiveOrZero Long crossCooldownMaxSeconds,
      @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double unwindThreshold,
      @NotNull @Positive Long maxPositionAgeHours,
      @NotNull Boolean twoSided
  ) {
    public Quoting {
      if (cycleSeconds == null) {
        cycleSeconds = 10L;
      }
      if (quoteSizeUsd == null) {
        quoteSizeUsd = 5.0;
      }
      if (maxMarkets == null) {
        maxMarkets = 10;
      }
      if (requoteThresholdPts == null) {
        requoteThresholdPts = 0.5;
      }
      if (minQuoteLifetimeSeconds == null) {
        minQuoteLifetimeSeconds = 10L;
      }
      if (postOnly == null) {
        postOnly = true;
      }
      if (hangingOrders == null) {
        hangingOrders = true;
      }
      if (hangingPriceThreshold == null) {
        hangingPriceThreshold = 0.005;
      }
      if (minOrderShares == null) {
        minOrderShares = 5.0;
      }
      if (crossRejectThreshold == null) {
        crossRejectThreshold = 3;
      }
      if (crossCooldownSeconds == null) {
        crossCooldownSeconds = 300L;
      }
      if (crossCooldownMaxSeconds == null) {
        crossCooldownMaxSeconds = 600L;
      }
      if (unwindThreshold == null) {
        unwindThreshold = 0.8;
      }
      if (maxPositionAgeHours == null) {
        maxPositionAgeHours = 24L;
      }
      if (twoSided == null) {
        twoSided = true;
      }
    }
  }

  public record Pricing(
      PricingEngineType engine,
      @NotNull @Positive Double deltaMin,
      @NotNull @Positive Double deltaMax,
      @NotNull @PositiveOrZero Double weightVol,
      @NotNull @PositiveOrZero Double weightImbalance,
      @NotNull @PositiveOrZero Double weightStale,
      @NotNull @PositiveOrZero Double weightFee,
      @NotNull @PositiveOrZero Double skewFactor,
      @NotNull @PositiveOrZero Double quadraticSkewFactor,
      @NotNull @Positive Integer volHalflife,
      @NotNull @Positive Long staleThresholdSeconds,
      @NotNull @Positive Double gammaBase,
      @NotNull @PositiveOrZero Double gammaAlpha,
      @NotNull @Positive Double kappaDefault,
      @NotNull @Positive Long kappaWindowMinutes
  ) {
    public Pricing {
      if (engine == null) {
        engine = PricingEngineType.AVELLANEDA_STOIKOV;
      }
      if (deltaMin == null) {
        deltaMin = 1.5;
      }
      if (deltaMax == null) {
        deltaMax = 8.0;
      }
      if (weightVol == null) {
        weightVol = 0.3;
      }
      if (weightImbalance == null) {
        weightImbalance = 0.2;
      }
      if (weightStale == null) {
        weightStale = 0.3;
      }
      if (weightFee == null) {
        weightFee = 0.2;
      }
      if (skewFactor == null) {
        skewFactor = 0.5;
      }
      if (quadraticSkewFactor == null) {
        quadraticSkewFactor = 0.3;
      }
      if (volHalflife == null) {
        volHalflife = 20;
      }
      if (staleThresholdSeconds == null) {
        staleThresholdSeconds = 60L;
      }
      if (gammaBase == null) {
        gammaBase = 0.1;
      }
      if (gammaAlpha == null) {
        gammaAlpha = 0.5;
      }
      if (kappaDefault == null) {
        kappaDefault = 1.5;
      }
      if (kappaWindowMinutes == null) {
        kappaWindowMinutes = 60L;
      }
    }
  }

  public record Proposal(
      @NotNull @Min(1) Integer levels,
      @NotNull @Positive Double levelSpreadMult,
      @NotNull @Positive Double levelSizeMult,
      @NotNull @Positive Double volWidenThreshold,
      @NotNull @PositiveOrZero Double eventRiskWidenPct,
      @NotNull @Positive Double minViableSize
  ) {
    public Proposal {
      if (levels == null) {
        levels = 1;
      }
      if (levelSpreadMult == null) {
        levelSpreadMult = 1.5;
      }
      if (levelSizeMult == null) {
        levelSizeMult = 2.0;
      }
      if (volWidenThreshold == null) {
        volWidenThreshold = 5.0;
      }
      if (eventRiskWidenPct == null) {
        eventRiskWidenPct = 50.0;
      }
      if (minViableSize == null) {
        minViableSize = 5.0;
      }
    }
  }

  public record Risk(
      @NotNull @Positive Double maxSpreadPts,
      @NotNull @Positive Double ddReducePct,
      @NotNull @Positive Double ddKillPct,
      @NotNull @Positive Double ddResumePct,
      @NotNull @PositiveOrZero Long ddCooldownMinutes,
      @NotNull @PositiveOrZero Integer ddMaxRecoveriesPerDay,
      @NotNull @Positive Double maxTotalExposurePct,
      @NotNull @Positive Double stopLossPct,
      @NotNull @Positive Double drawdownStopLossPct,
      @NotNull @Positive Long monitorIntervalSeconds
  ) {
    public Risk {
      if (maxSpreadPts == null) {
        maxSpreadPts = 12.0;
      }
      if (ddReducePct == null) {
        ddReducePct = 15.0;
      }
      if (ddKillPct == null) {
        ddKillPct = 25.0;
      }
      if (ddResumePct == null) {
        ddResumePct = 20.0;
      }
      if (ddCooldownMinutes == null) {
        ddCooldownMinutes = 30L;
      }
      if (ddMaxRecoveriesPerDay == null) {
        ddMaxRecoveriesPerDay = 3;
      }
      if (maxTotalExposurePct == null) {
        maxTotalExposurePct = 75.0;
      }
      if (stopLossPct == null) {
        stopLossPct = 20.0;
      }
      if (drawdownStopLossPct == null) {
        drawdownStopLossPct = 25.0;
      }
      if (monitorIntervalSeconds == null) {
        monitorIntervalSeconds = 30L;
      }
    }

    /**
     * Auto-resume needs the drawdown to recover below the kill level, otherwise kill and resume alternate on
     * every tick.
     */
    @AssertTrue(message = "dd-resume-pct must be below dd-kill-pct")
    public boolean isResumeBelowKill() {
      return ddResumePct < ddKillPct;
    }
  }

  public record Venue(
      String executorBaseUrl,
      @NotNull @Min(1) Integer maxConcurrentCalls,
      @NotNull @Positive Long callTimeoutMillis,
      @NotNull @PositiveOrZero Long settleWaitMillis,
      @NotNull @Positive Double paperStartingCash,
      @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double paperFillProbability
  ) {
    public Venue {
      if (executorBaseUrl == null || executorBaseUrl.isBlank()) {
        executorBaseUrl = "http://localhost:8080";
      }
      if (maxConcurrentCalls == null) {
        maxConcurrentCalls = 10;
      }
      if (callTimeoutMillis == null) {
        callTimeoutMillis = 10_000L;
      }
      if (settleWaitMillis == null) {
        settleWaitMillis = 2_000L;
      }
      if (paperStartingCash == null) {
        paperStartingCash = 1_000.0;
      }
      if (paperFillProbability == null) {
        paperFillProbability = 0.1;
      }
    }
  }

  public record SplitMerge(
      @NotNull Boolean enabled,
      @NotNull @Positive Double splitSizeUsd,
      @NotNull @Positive Double mergeThreshold,
      @NotNull @Min(1) Integer mergeEveryCycles
  ) {
    public SplitMerge {
      if (enabled == null) {
        enabled = true;
      }
      if (splitSizeUsd == null) {
        splitSizeUsd = 5.0;
      }
      if (mergeThreshold == null) {
        mergeThreshold = 10.0;
      }
      if (mergeEveryCycles == null) {
        mergeEveryCycles = 6;
      }
    }
  }

  public record Arbitrage(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double minProfitPct,
      @NotNull @Positive Double maxSizeUsd,
      @NotNull @PositiveOrZero Double gasCostUsd,
      @NotNull @Positive Double minSize,
      @NotNull @Min(1) Integer scanEveryCycles
  ) {
    public Arbitrage {
      if (enabled == null) {
        enabled = false;
      }
      if (minProfitPct == null) {
        minProfitPct = 0.5;
      }
      if (maxSizeUsd == null) {
        maxSizeUsd = 50.0;
      }
      if (gasCostUsd == null) {
        gasCostUsd = 0.005;
      }
      if (minSize == null) {
        minSize = 5.0;
      }
      if (scanEveryCycles == null) {
        scanEveryCycles = 3;
      }
    }
  }

  public record CircuitBreaker(
      @NotNull @Min(1) Integer threshold,
      @NotNull @PositiveOrZero Long cooldownSeconds
  ) {
    public CircuitBreaker {
      if (threshold == null) {
        threshold = 5;
      }
      if (cooldownSeconds == null) {
        cooldownSeconds = 300L;
      }
    }
  }

  public record Advisory(
      @NotNull @Positive Long timeoutMillis,
      @NotNull @Positive Double fallbackSizeMultiplier,
      @NotNull @PositiveOrZero Double defaultRiskScore,
      @NotNull @PositiveOrZero Double minMarketScore
  ) {
    public Advisory {
      if (timeoutMillis == null) {
        timeoutMillis = 5_000L;
      }
      if (fallbackSizeMultiplier == null) {
        fallbackSizeMultiplier = 0.5;
      }
      if (defaultRiskScore == null) {
        defaultRiskScore = 5.0;
      }
      if (minMarketScore == null) {
        minMarketScore = 5.0;
      }
    }
  }

  public record Store(
      StoreMode mode
  ) {
    public Store {
      if (mode == null) {
        mode = StoreMode.MEMORY;
      }
    }
  }
}
