package com.polybot.mm.store;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for the market maker: quotes, fills, round trips, per-token inventory, daily metrics, the portfolio
 * high-water mark and the shared bot status table. Upserts are idempotent.
 */
public interface MmStore {

  String GUARD_KILL_LIST_KEY = "guard_kill_list";

  long insertQuote(QuoteRecord quote);

  void updateQuoteStatus(long quoteId, String status);

  List<QuoteRecord> activeQuotes();

  List<QuoteRecord> quotesSince(Instant since);

  long insertFill(FillRecord fill);

  void updateFillAdverseSelection(long fillId, Double midAt30s, Double midAt120s);

  List<FillRecord> fillsSince(Instant since);

  /**
   * Fills at or after {@code notBefore} still missing a later mid sample.
   */
  List<FillRecord> fillsPendingAdverseSelection(Instant notBefore);

  void insertRoundTrip(RoundTripRecord roundTrip);

  List<RoundTripRecord> roundTripsSince(Instant since);

  void upsertInventory(InventoryRecord record);

  List<InventoryRecord> inventory();

  void upsertDailyMetrics(DailyMetricsRecord metrics);

  List<DailyMetricsRecord> dailyMetricsSince(LocalDate since);

  Optional<HighWaterMark> highWaterMark();

  /**
   * Record the current portfolio value and return the updated peak.
   */
  double updateHighWaterMark(double currentValue);

  void updateBotStatus(Map<String, ?> fields);

  Optional<String> botStatusField(String key);

  /**
   * A bot status value holding a JSON array of strings; empty when absent or malformed.
   */
  Set<String> botStatusList(String key);

  /**
   * Markets the event-risk guard wants closed.
   */
  default Set<String> guardKillList() {
    return botStatusList(GUARD_KILL_LIST_KEY);
  }
}
