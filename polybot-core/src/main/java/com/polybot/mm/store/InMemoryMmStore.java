package com.polybot.mm.store;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local store for paper trading and tests. Nothing survives a restart.
 */
public class InMemoryMmStore implements MmStore {

  private final Clock clock;
  private final BotStatusCodec codec;

  private final AtomicLong quoteSeq = new AtomicLong();
  private final AtomicLong fillSeq = new AtomicLong();
  private final ConcurrentMap<Long, QuoteRecord> quotes = new ConcurrentHashMap<>();
  private final ConcurrentMap<Long, FillRecord> fills = new ConcurrentHashMap<>();
  private final List<RoundTripRecord> roundTrips = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<String, InventoryRecord> inventory = new ConcurrentHashMap<>();
  private final ConcurrentMap<LocalDate, DailyMetricsRecord> dailyMetrics = new ConcurrentHashMap<>();
  private final AtomicReference<HighWaterMark> highWaterMark = new AtomicReference<>();
  private final ConcurrentMap<String, String> botStatus = new ConcurrentHashMap<>();

  public InMemoryMmStore(Clock clock, ObjectMapper objectMapper) {
    this.clock = clock;
    this.codec = new BotStatusCodec(objectMapper);
  }

  @Override
  public long insertQuote(QuoteRecord quote) {
    long id = quoteSeq.incrementAndGet();
    quotes.put(id, quote.withId(id));
    return id;
  }

  @Override
  public void updateQuoteStatus(long quoteId, String status) {
    quotes.computeIfPresent(quoteId, (id, q) -> q.withStatus(status, clock.instant()));
  }

  @Override
  public List<QuoteRecord> activeQuotes() {
    return quotes.values().stream()
        .filter(QuoteRecord::isActive)
        .sorted(Comparator.comparing(QuoteRecord::id))
        .toList();
  }

  @Override
  public List<QuoteRecord> quotesSince(Instant since) {
    return quotes.values().stream()
        .filter(q -> q.createdAt() == null || !q.createdAt().isBefore(since))
        .sorted(Comparator.comparing(QuoteRecord::id))
        .toList();
  }

  @Override
  public long insertFill(FillRecord fill) {
    long id = fillSeq.incrementAndGet();
    fills.put(id, fill.withId(id));
    return id;
  }

  @Override
  public void updateFillAdverseSelection(long fillId, Double midAt30s, Double midAt120s) {
    fills.computeIfPresent(fillId, (id, f) -> f.withLaterMids(midAt30s, midAt120s));
  }

  @Override
  public List<FillRecord> fillsSince(Instant since) {
    return fills.values().stream()
        .filter(f -> !f.filledAt().isBefore(since))
        .sorted(Comparator.comparing(FillRecord::id))
        .toList();
  }

  @Override
  public List<FillRecord> fillsPendingAdverseSelection(Instant notBefore) {
    return fillsSince(notBefore).stream()
        .filter(f -> f.midAt30s() == null || f.midAt120s() == null)
        .toList();
  }

  @Override
  public void insertRoundTrip(RoundTripRecord roundTrip) {
    roundTrips.add(roundTrip);
  }

  @Override
  public List<RoundTripRecord> roundTripsSince(Instant since) {
    return roundTrips.stream().filter(rt -> !rt.closedAt().isBefore(since)).toList();
  }

  @Override
  public void upsertInventory(InventoryRecord record) {
    inventory.put(record.marketId() + "|" + record.tokenId(), record);
  }

  @Override
  public List<InventoryRecord> inventory() {
    return new ArrayList<>(inventory.values());
  }

  @Override
  public void upsertDailyMetrics(DailyMetricsRecord metrics) {
    dailyMetrics.put(metrics.date(), metrics);
  }

  @Override
  public List<DailyMetricsRecord> dailyMetricsSince(LocalDate since) {
    return dailyMetrics.values().stream()
        .filter(m -> !m.date().isBefore(since))
        .sorted(Comparator.comparing(DailyMetricsRecord::date).reversed())
        .toList();
  }

  @Override
  public Optional<HighWaterMark> highWaterMark() {
    return Optional.ofNullable(highWaterMark.get());
  }

  @Override
  public double updateHighWaterMark(double currentValue) {
    Instant now = clock.instant();
    return highWaterMark.updateAndGet(prev -> HighWaterMark.next(prev, currentValue, now)).peakValue();
  }

  @Override
  public void updateBotStatus(Map<String, ?> fields) {
    fields.forEach((k, v) -> botStatus.put(k, codec.encode(v)));
  }

  @Override
  public Optional<String> botStatusField(String key) {
    return Optional.ofNullable(botStatus.get(key));
  }

  @Override
  public Set<String> botStatusList(String key) {
    return codec.decodeStringSet(botStatus.get(key));
  }
}
