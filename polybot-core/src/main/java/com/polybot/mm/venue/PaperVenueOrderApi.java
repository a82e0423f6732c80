package com.polybot.mm.venue;

import com.polybot.mm.domain.OrderSide;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A lightweight "paper exchange" for local runs and tests.
 *
 * Books are fed externally via {@link #updateBook} or pulled from a {@link #useBookSource book source}. Resting orders stay LIVE while partially matched and end
 * FILLED or CANCELED; a status poll fills an order when the book has crossed it, and otherwise with a configurable
 * per-poll probability. Cash and token balances follow every fill, split and merge.
 */
@Slf4j
public class PaperVenueOrderApi implements VenueOrderApi {

  private static final double SHARE_EPS = 1e-9;

  private final Clock clock;
  private final double makerFillProbabilityPerPoll;
  private final double makerFillFraction;

  private final ConcurrentMap<String, SimOrder> ordersById = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Double> sharesByTokenId = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, BookSummary> booksByTokenId = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String[]> tokensByConditionId = new ConcurrentHashMap<>();
  private final Object cashLock = new Object();
  private double cash;
  private volatile Function<String, Optional<BookSummary>> bookSource;

  public PaperVenueOrderApi(Clock clock, double startingCash, double makerFillProbabilityPerPoll, double makerFillFraction) {
    this.clock = clock;
    this.cash = startingCash;
    this.makerFillProbabilityPerPoll = Math.max(0.0, Math.min(1.0, makerFillProbabilityPerPoll));
    this.makerFillFraction = makerFillFraction <= 0 ? 1.0 : Math.min(1.0, makerFillFraction);
  }

  /**
   * Deterministic paper venue: fills only happen on crossed books or via {@link #fill}.
   */
  public static PaperVenueOrderApi deterministic(Clock clock, double startingCash) {
    return new PaperVenueOrderApi(clock, startingCash, 0.0, 1.0);
  }

  /**
   * Pull books from a real source (e.g. the executor's public order book) on every {@link #getBookSummary} call.
   */
  public void useBookSource(Function<String, Optional<BookSummary>> bookSource) {
    this.bookSource = bookSource;
  }

  public void updateBook(String tokenId, BookSummary book) {
    booksByTokenId.put(tokenId, book);
  }

  public void registerCompleteSet(String conditionId, String yesTokenId, String noTokenId) {
    tokensByConditionId.put(conditionId, new String[]{yesTokenId, noTokenId});
  }

  public void creditShares(String tokenId, double shares) {
    sharesByTokenId.merge(tokenId, shares, Double::sum);
  }

  public double shares(String tokenId) {
    return sharesByTokenId.getOrDefault(tokenId, 0.0);
  }

  public double cash() {
    synchronized (cashLock) {
      return cash;
    }
  }

  @Override
  public OrderSubmission placeLimitOrder(LimitOrderRequest request) {
    if (request.price() <= 0 || request.price() >= 1 || request.size() <= 0) {
      return OrderSubmission.rejected(error(OrderError.API_ERROR, request, "invalid price or size"));
    }
    BookSummary book = booksByTokenId.get(request.tokenId());
    boolean crosses = book != null && (request.side() == OrderSide.BUY
        ? book.bestAsk() > 0 && request.price() >= book.bestAsk()
        : book.bestBid() > 0 && request.price() <= book.bestBid());
    if (request.postOnly() && crosses) {
      return OrderSubmission.rejected(error(OrderError.POST_ONLY_CROSS, request, "order crosses the book"));
    }
    if (request.side() == OrderSide.BUY) {
      if (request.price() * request.size() > availableCash() + SHARE_EPS) {
        return OrderSubmission.rejected(error(OrderError.INSUFFICIENT_BALANCE, request, "not enough balance"));
      }
    } else if (request.size() > availableShares(request.tokenId()) + SHARE_EPS) {
      return OrderSubmission.rejected(error(OrderError.INSUFFICIENT_TOKEN_BALANCE, request, "not enough token balance"));
    }

    String orderId = "sim-" + UUID.randomUUID();
    SimOrder order = new SimOrder(orderId, request.tokenId(), request.side(), request.price(), request.size());
    ordersById.put(orderId, order);
    if (crosses) {
      fill(order, order.remainingSize, request.side() == OrderSide.BUY ? book.bestAsk() : book.bestBid());
    }
    return OrderSubmission.placed(orderId);
  }

  @Override
  public boolean cancelOrder(String orderId) {
    if (orderId == null || orderId.isBlank()) {
      return false;
    }
    SimOrder order = ordersById.get(orderId);
    if (order == null) {
      return false;
    }
    synchronized (order) {
      if (isTerminal(order.status)) {
        return false;
      }
      order.status = "CANCELED";
    }
    return true;
  }

  @Override
  public OrderStatusSnapshot getOrderStatus(String orderId) {
    SimOrder order = orderId == null ? null : ordersById.get(orderId);
    if (order == null) {
      return OrderStatusSnapshot.unknown();
    }
    simulateOne(order);
    synchronized (order) {
      String status = "FILLED".equals(order.status) ? "MATCHED" : order.status;
      boolean filled = "MATCHED".equals(status);
      Double avg = order.matchedSize > 0 ? order.matchedNotional / order.matchedSize : null;
      return new OrderStatusSnapshot(filled, status, order.matchedSize, avg, 0.0);
    }
  }

  @Override
  public Optional<BookSummary> getBookSummary(String tokenId) {
    Function<String, Optional<BookSummary>> source = bookSource;
    if (source != null) {
      source.apply(tokenId).ifPresent(book -> booksByTokenId.put(tokenId, book));
    }
    return Optional.ofNullable(booksByTokenId.get(tokenId));
  }

  @Override
  public boolean mergePositions(String conditionId, double amount) {
    String[] tokens = tokensByConditionId.get(conditionId);
    if (tokens == null || amount <= 0) {
      return false;
    }
    synchronized (cashLock) {
      if (shares(tokens[0]) + SHARE_EPS < amount || shares(tokens[1]) + SHARE_EPS < amount) {
        log.warn("paper merge refused conditionId={} amount={} (insufficient pairs)", conditionId, amount);
        return false;
      }
      sharesByTokenId.merge(tokens[0], -amount, Double::sum);
      sharesByTokenId.merge(tokens[1], -amount, Double::sum);
      cash += amount;
    }
    return true;
  }

  @Override
  public boolean splitPosition(String conditionId, double amount) {
    String[] tokens = tokensByConditionId.get(conditionId);
    if (tokens == null || amount <= 0) {
      return false;
    }
    synchronized (cashLock) {
      if (cash + SHARE_EPS < amount) {
        log.warn("paper split refused conditionId={} amount={} cash={}", conditionId, amount, cash);
        return false;
      }
      cash -= amount;
      sharesByTokenId.merge(tokens[0], amount, Double::sum);
      sharesByTokenId.merge(tokens[1], amount, Double::sum);
    }
    return true;
  }

  @Override
  public Set<String> getOpenOrderIds() {
    return ordersById.values().stream()
        .filter(o -> !isTerminal(o.status))
        .map(o -> o.orderId)
        .collect(Collectors.toSet());
  }

  @Override
  public OptionalDouble getAvailableBalance() {
    return OptionalDouble.of(cash());
  }

  @Override
  public OptionalDouble getPortfolioValue() {
    double value = cash();
    for (Map.Entry<String, Double> e : sharesByTokenId.entrySet()) {
      BookSummary book = booksByTokenId.get(e.getKey());
      double mark = book != null && book.hasMid() ? book.mid() : 0.5;
      value += e.getValue() * mark;
    }
    return OptionalDouble.of(value);
  }

  /**
   * Force a fill of {@code size} shares at the order's limit price.
   */
  public void fill(String orderId, double size) {
    SimOrder order = ordersById.get(orderId);
    if (order != null) {
      fill(order, size, order.price);
    }
  }

  private void simulateOne(SimOrder order) {
    if (isTerminal(order.status)) {
      return;
    }
    BookSummary book = booksByTokenId.get(order.tokenId);
    if (book == null) {
      return;
    }
    // Book moved through our resting price: the aggressor crossed into us.
    boolean crossed = order.side == OrderSide.BUY
        ? book.bestAsk() > 0 && book.bestAsk() <= order.price
        : book.bestBid() > 0 && book.bestBid() >= order.price;
    if (crossed) {
      fill(order, order.remainingSize, order.price);
      return;
    }
    if (makerFillProbabilityPerPoll > 0 && ThreadLocalRandom.current().nextDouble() < makerFillProbabilityPerPoll) {
      double size = Math.max(0.1, Math.floor(order.remainingSize * makerFillFraction * 10.0) / 10.0);
      fill(order, size, order.price);
    }
  }

  private void fill(SimOrder order, double fillSize, double fillPrice) {
    if (fillSize <= 0) {
      return;
    }
    double applied;
    synchronized (order) {
      if (isTerminal(order.status)) {
        return;
      }
      applied = Math.min(fillSize, order.remainingSize);
      if (applied <= SHARE_EPS) {
        return;
      }
      order.matchedSize += applied;
      order.matchedNotional += applied * fillPrice;
      order.remainingSize -= applied;
      order.status = order.remainingSize <= SHARE_EPS ? "FILLED" : "LIVE";
    }

    double signed = order.side == OrderSide.BUY ? applied : -applied;
    sharesByTokenId.merge(order.tokenId, signed, Double::sum);
    synchronized (cashLock) {
      cash -= signed * fillPrice;
    }
    log.debug("paper fill orderId={} side={} size={} price={}", order.orderId, order.side, applied, fillPrice);
  }

  private double availableCash() {
    double locked = ordersById.values().stream()
        .filter(o -> o.side == OrderSide.BUY && !isTerminal(o.status))
        .mapToDouble(o -> o.remainingSize * o.price)
        .sum();
    return cash() - locked;
  }

  private double availableShares(String tokenId) {
    double locked = ordersById.values().stream()
        .filter(o -> o.side == OrderSide.SELL && tokenId.equals(o.tokenId) && !isTerminal(o.status))
        .mapToDouble(o -> o.remainingSize)
        .sum();
    return shares(tokenId) - locked;
  }

  private OrderError error(String code, LimitOrderRequest request, String details) {
    return new OrderError(code, request.side(), request.tokenId(), request.price(), request.size(), details, clock.instant());
  }

  private static boolean isTerminal(String status) {
    if (status == null) {
      return false;
    }
    String s = status.trim().toUpperCase(Locale.ROOT);
    return "FILLED".equals(s) || s.contains("CANCEL") || s.contains("EXPIRED");
  }

  private static final class SimOrder {
    private final String orderId;
    private final String tokenId;
    private final OrderSide side;
    private final double price;

    private volatile String status = "LIVE";
    private double matchedSize;
    private double matchedNotional;
    private double remainingSize;

    private SimOrder(String orderId, String tokenId, OrderSide side, double price, double size) {
      this.orderId = orderId;
      this.tokenId = tokenId;
      this.side = side;
      this.price = price;
      this.remainingSize = size;
    }
  }
}
