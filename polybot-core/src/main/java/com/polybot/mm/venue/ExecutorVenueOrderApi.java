package com.polybot.mm.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Venue client backed by the executor service's Polymarket REST endpoints.
 */
@RequiredArgsConstructor
@Slf4j
public class ExecutorVenueOrderApi implements VenueOrderApi {

  private static final int BOOK_DEPTH_LEVELS = 5;

  private final @NonNull RestClient executorRestClient;
  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull Clock clock;

  @Override
  public OrderSubmission placeLimitOrder(LimitOrderRequest request) {
    try {
      String body = executorRestClient.post()
          .uri("/api/polymarket/orders/limit")
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of(
              "tokenId", request.tokenId(),
              "side", request.side().name(),
              "price", request.price(),
              "size", request.size(),
              "orderType", request.orderType(),
              "postOnly", request.postOnly()
          ))
          .retrieve()
          .body(String.class);
      JsonNode resp = readTree(body);
      String orderId = resolveOrderId(resp);
      if (orderId == null) {
        String details = resp.path("errorMsg").asText(resp.path("error").asText("no order id in response"));
        return OrderSubmission.rejected(error(classify(details), request, details));
      }
      return OrderSubmission.placed(orderId);
    } catch (RestClientResponseException e) {
      String details = e.getResponseBodyAsString();
      log.warn("limit order rejected tokenId={} side={} price={} status={} body={}",
          request.tokenId(), request.side(), request.price(), e.getStatusCode().value(), details);
      return OrderSubmission.rejected(error(classify(details), request, details));
    } catch (Exception e) {
      log.error("limit order failed tokenId={} side={} price={}: {}",
          request.tokenId(), request.side(), request.price(), e.toString());
      return OrderSubmission.rejected(error(OrderError.EXCEPTION, request, e.toString()));
    }
  }

  @Override
  public boolean cancelOrder(String orderId) {
    if (orderId == null || orderId.isBlank()) {
      return false;
    }
    try {
      executorRestClient.delete()
          .uri("/api/polymarket/orders/{orderId}", orderId)
          .retrieve()
          .toBodilessEntity();
      return true;
    } catch (Exception e) {
      log.error("cancel failed orderId={}: {}", orderId, e.toString());
      return false;
    }
  }

  @Override
  public OrderStatusSnapshot getOrderStatus(String orderId) {
    try {
      String body = executorRestClient.get()
          .uri("/api/polymarket/orders/{orderId}", orderId)
          .retrieve()
          .body(String.class);
      JsonNode order = readTree(body);
      if (order.isEmpty()) {
        return OrderStatusSnapshot.unknown();
      }
      return toSnapshot(order);
    } catch (Exception e) {
      log.error("order status check failed orderId={}: {}", orderId, e.toString());
      return OrderStatusSnapshot.error();
    }
  }

  @Override
  public Optional<BookSummary> getBookSummary(String tokenId) {
    try {
      String body = executorRestClient.get()
          .uri("/api/polymarket/orderbook/{tokenId}", tokenId)
          .retrieve()
          .body(String.class);
      JsonNode book = readTree(body);
      if (book.isEmpty() || book.hasNonNull("error")) {
        return Optional.empty();
      }
      return Optional.of(toBookSummary(book));
    } catch (Exception e) {
      log.error("book summary failed tokenId={}: {}", tokenId, e.toString());
      return Optional.empty();
    }
  }

  @Override
  public boolean mergePositions(String conditionId, double amount) {
    return settlementCall("/api/polymarket/settlement/merge", conditionId, amount);
  }

  @Override
  public boolean splitPosition(String conditionId, double amount) {
    return settlementCall("/api/polymarket/settlement/split", conditionId, amount);
  }

  @Override
  public Set<String> getOpenOrderIds() {
    try {
      String body = executorRestClient.get()
          .uri("/api/polymarket/orders/open")
          .retrieve()
          .body(String.class);
      JsonNode orders = readTree(body);
      Set<String> ids = new HashSet<>();
      for (JsonNode order : orders) {
        String id = textOrNull(order, "id", "order_id", "orderID");
        if (id != null) {
          ids.add(id);
        }
      }
      return ids;
    } catch (Exception e) {
      log.error("open orders fetch failed: {}", e.toString());
      return Set.of();
    }
  }

  @Override
  public OptionalDouble getAvailableBalance() {
    return bankroll().map(b -> b.usdcBalance() == null ? OptionalDouble.empty() : OptionalDouble.of(b.usdcBalance().doubleValue()))
        .orElse(OptionalDouble.empty());
  }

  @Override
  public OptionalDouble getPortfolioValue() {
    return bankroll().map(b -> b.totalEquityUsd() == null ? OptionalDouble.empty() : OptionalDouble.of(b.totalEquityUsd().doubleValue()))
        .orElse(OptionalDouble.empty());
  }

  private Optional<BankrollResponse> bankroll() {
    try {
      return Optional.ofNullable(executorRestClient.get()
          .uri("/api/polymarket/bankroll")
          .retrieve()
          .body(BankrollResponse.class));
    } catch (Exception e) {
      log.warn("bankroll fetch failed: {}", e.toString());
      return Optional.empty();
    }
  }

  private boolean settlementCall(String path, String conditionId, double amount) {
    if (conditionId == null || conditionId.isBlank() || amount <= 0) {
      return false;
    }
    try {
      String body = executorRestClient.post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of("conditionId", conditionId, "amount", amount))
          .retrieve()
          .body(String.class);
      JsonNode resp = readTree(body);
      return resp.path("ok").asBoolean(false);
    } catch (Exception e) {
      log.error("settlement call {} failed conditionId={} amount={}: {}", path, conditionId, amount, e.toString());
      return false;
    }
  }

  OrderStatusSnapshot toSnapshot(JsonNode order) {
    String status = order.path("status").asText(OrderStatusSnapshot.UNKNOWN).trim().toUpperCase(Locale.ROOT);
    double sizeMatched = firstDouble(order, 0.0, "size_matched", "matched_size", "filled_size");
    double avgFill = firstDouble(order, 0.0, "avg_fill_price", "avg_price", "average_price", "fill_price", "price");
    double fees = firstDouble(order, 0.0, "fees_paid", "fees", "fee");
    double originalSize = firstDouble(order, 0.0, "original_size", "size");
    boolean filled = "MATCHED".equals(status) || (originalSize > 0 && sizeMatched >= originalSize);
    return new OrderStatusSnapshot(filled, status, sizeMatched, avgFill > 0 ? avgFill : null, fees);
  }

  BookSummary toBookSummary(JsonNode book) {
    List<double[]> bids = levels(book.path("bids"));
    List<double[]> asks = levels(book.path("asks"));
    bids.sort(Comparator.comparingDouble((double[] l) -> l[0]).reversed());
    asks.sort(Comparator.comparingDouble(l -> l[0]));

    double bestBid = bids.isEmpty() ? 0.0 : bids.get(0)[0];
    double bestAsk = asks.isEmpty() ? 1.0 : asks.get(0)[0];
    double minOrderSize = book.path("min_order_size").asDouble(5.0);
    return new BookSummary(bestBid, bestAsk, notional(bids), notional(asks), minOrderSize);
  }

  private static List<double[]> levels(JsonNode side) {
    List<double[]> out = new ArrayList<>();
    if (side == null || !side.isArray()) {
      return out;
    }
    for (JsonNode level : side) {
      double price = level.path("price").asDouble(0);
      double size = level.path("size").asDouble(0);
      if (price > 0 && size > 0) {
        out.add(new double[]{price, size});
      }
    }
    return out;
  }

  private static double notional(List<double[]> levels) {
    double total = 0;
    for (int i = 0; i < Math.min(BOOK_DEPTH_LEVELS, levels.size()); i++) {
      total += levels.get(i)[0] * levels.get(i)[1];
    }
    return total;
  }

  private OrderError error(String code, LimitOrderRequest request, String details) {
    return new OrderError(code, request.side(), request.tokenId(), request.price(), request.size(), details, clock.instant());
  }

  static String classify(String details) {
    if (details == null) {
      return OrderError.API_ERROR;
    }
    String d = details.toLowerCase(Locale.ROOT);
    if (d.contains("post-only") || d.contains("post only") || d.contains("cross")) {
      return OrderError.POST_ONLY_CROSS;
    }
    if (d.contains("not enough balance") || d.contains("insufficient")) {
      return d.contains("token") || d.contains("allowance") ? OrderError.INSUFFICIENT_TOKEN_BALANCE : OrderError.INSUFFICIENT_BALANCE;
    }
    return OrderError.API_ERROR;
  }

  private static String resolveOrderId(JsonNode resp) {
    JsonNode clob = resp.path("clobResponse");
    String id = textOrNull(clob, "orderID", "orderId", "order_id", "id");
    return id != null ? id : textOrNull(resp, "orderID", "orderId", "order_id", "id");
  }

  private static String textOrNull(JsonNode node, String... keys) {
    if (node == null || node.isMissingNode()) {
      return null;
    }
    for (String key : keys) {
      if (node.hasNonNull(key) && !node.get(key).asText().isBlank()) {
        return node.get(key).asText();
      }
    }
    return null;
  }

  private static double firstDouble(JsonNode node, double fallback, String... keys) {
    for (String key : keys) {
      if (node.has(key)) {
        return node.path(key).asDouble(fallback);
      }
    }
    return fallback;
  }

  private JsonNode readTree(String body) {
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (Exception e) {
      throw new IllegalStateException("Failed parsing executor response", e);
    }
  }
}
