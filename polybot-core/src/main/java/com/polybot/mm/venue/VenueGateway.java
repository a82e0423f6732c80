package com.polybot.mm.venue;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs every outbound venue call on a bounded worker pool. A semaphore caps in-flight calls and each call has a
 * timeout; a timed-out or failed call degrades to the same explicit failure value the venue contract uses.
 */
@Slf4j
public class VenueGateway implements VenueOrderApi, AutoCloseable {

  private final VenueOrderApi delegate;
  private final Clock clock;
  private final Semaphore permits;
  private final long timeoutMillis;
  private final ExecutorService pool;

  public VenueGateway(VenueOrderApi delegate, Clock clock, int maxConcurrentCalls, long timeoutMillis) {
    this.delegate = delegate;
    this.clock = clock;
    this.permits = new Semaphore(Math.max(1, maxConcurrentCalls));
    this.timeoutMillis = Math.max(1, timeoutMillis);
    AtomicInteger seq = new AtomicInteger();
    this.pool = Executors.newFixedThreadPool(Math.max(1, maxConcurrentCalls), r -> {
      Thread t = new Thread(r, "venue-io-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public OrderSubmission placeLimitOrder(LimitOrderRequest request) {
    OrderError timeout = new OrderError(OrderError.TIMEOUT, request.side(), request.tokenId(),
        request.price(), request.size(), "venue call timed out", clock.instant());
    OrderSubmission fallback = OrderSubmission.rejected(timeout);
    OrderSubmission submission = call("placeLimitOrder", () -> delegate.placeLimitOrder(request), fallback);
    if (submission == fallback) {
      log.warn("placement {} {} {}@{} on {} got no answer, the order may still rest on the venue "
              + "until the open-order scan finds it",
          request.orderType(), request.side(), request.size(), request.price(), request.tokenId());
    }
    return submission;
  }

  @Override
  public boolean cancelOrder(String orderId) {
    return call("cancelOrder", () -> delegate.cancelOrder(orderId), false);
  }

  @Override
  public OrderStatusSnapshot getOrderStatus(String orderId) {
    return call("getOrderStatus", () -> delegate.getOrderStatus(orderId), OrderStatusSnapshot.error());
  }

  @Override
  public Optional<BookSummary> getBookSummary(String tokenId) {
    return call("getBookSummary", () -> delegate.getBookSummary(tokenId), Optional.empty());
  }

  @Override
  public boolean mergePositions(String conditionId, double amount) {
    return call("mergePositions", () -> delegate.mergePositions(conditionId, amount), false);
  }

  @Override
  public boolean splitPosition(String conditionId, double amount) {
    return call("splitPosition", () -> delegate.splitPosition(conditionId, amount), false);
  }

  @Override
  public Set<String> getOpenOrderIds() {
    return call("getOpenOrderIds", delegate::getOpenOrderIds, Set.of());
  }

  @Override
  public OptionalDouble getAvailableBalance() {
    return call("getAvailableBalance", delegate::getAvailableBalance, OptionalDouble.empty());
  }

  @Override
  public OptionalDouble getPortfolioValue() {
    return call("getPortfolioValue", delegate::getPortfolioValue, OptionalDouble.empty());
  }

  /**
   * Fetch several books concurrently. Iteration order of the result follows {@code tokenIds}.
   */
  public Map<String, Optional<BookSummary>> fetchBooks(Collection<String> tokenIds) {
    Map<String, CompletableFuture<Optional<BookSummary>>> futures = new LinkedHashMap<>();
    for (String tokenId : tokenIds) {
      if (tokenId == null || futures.containsKey(tokenId)) {
        continue;
      }
      futures.put(tokenId, submit(() -> delegate.getBookSummary(tokenId)));
    }
    Map<String, Optional<BookSummary>> books = new LinkedHashMap<>();
    futures.forEach((tokenId, future) -> books.put(tokenId, await("getBookSummary", future, Optional.empty())));
    return books;
  }

  private <T> T call(String operation, Supplier<T> supplier, T fallback) {
    return await(operation, submit(supplier), fallback);
  }

  private <T> CompletableFuture<T> submit(Supplier<T> supplier) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CompletableFuture.failedFuture(e);
    }
    try {
      return CompletableFuture.supplyAsync(() -> {
        try {
          return supplier.get();
        } finally {
          permits.release();
        }
      }, pool);
    } catch (RuntimeException e) {
      permits.release();
      return CompletableFuture.failedFuture(e);
    }
  }

  private <T> T await(String operation, CompletableFuture<T> future, T fallback) {
    try {
      T result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
      return result == null ? fallback : result;
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("venue call {} timed out after {}ms", operation, timeoutMillis);
      return fallback;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("venue call {} interrupted", operation);
      return fallback;
    } catch (ExecutionException e) {
      log.error("venue call {} failed: {}", operation, String.valueOf(e.getCause()));
      return fallback;
    }
  }

  @Override
  public void close() {
    pool.shutdownNow();
  }
}
