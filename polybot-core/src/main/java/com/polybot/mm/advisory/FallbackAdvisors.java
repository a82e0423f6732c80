package com.polybot.mm.advisory;

import com.polybot.mm.config.MmProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wraps advisory oracles so that a slow or failing oracle can never block or break a cycle. Each call runs with
 * a timeout; on timeout or error the wrapper answers with a fixed conservative fallback:
 * <ul>
 *   <li>risk officer: approve at {@code advisory.fallback-size-multiplier}</li>
 *   <li>market scorer: {@code advisory.default-risk-score}</li>
 *   <li>event guard: warning raised (spreads widen), empty kill list</li>
 * </ul>
 */
@Slf4j
public class FallbackAdvisors implements AutoCloseable {

  private final MmProperties.Advisory advisory;
  private final ExecutorService executor;

  public FallbackAdvisors(MmProperties.Advisory advisory) {
    this.advisory = advisory;
    AtomicInteger seq = new AtomicInteger();
    this.executor = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "mm-advisory-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  public RiskOfficer guard(RiskOfficer delegate) {
    RiskVerdict fallback = RiskVerdict.approve(advisory.fallbackSizeMultiplier(), advisory.defaultRiskScore(),
        "advisory unavailable");
    return intent -> call("riskOfficer", () -> delegate.review(intent), fallback);
  }

  public MarketScorer guard(MarketScorer delegate) {
    return market -> call("marketScorer", () -> delegate.score(market), advisory.defaultRiskScore());
  }

  public EventRiskGuard guard(EventRiskGuard delegate) {
    return new EventRiskGuard() {
      @Override
      public boolean hasWarning(String marketId) {
        return call("eventRiskGuard.hasWarning", () -> delegate.hasWarning(marketId), Boolean.TRUE);
      }

      @Override
      public Set<String> killList() {
        return call("eventRiskGuard.killList", delegate::killList, Set.of());
      }
    };
  }

  private <T> T call(String name, Supplier<T> supplier, T fallback) {
    CompletableFuture<T> future = CompletableFuture.supplyAsync(supplier, executor);
    try {
      T result = future.get(advisory.timeoutMillis(), TimeUnit.MILLISECONDS);
      return result == null ? fallback : result;
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("advisory {} timed out after {}ms, using fallback", name, advisory.timeoutMillis());
      return fallback;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return fallback;
    } catch (ExecutionException e) {
      log.warn("advisory {} failed, using fallback: {}", name, String.valueOf(e.getCause()));
      return fallback;
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
