package com.polybot.mm.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.domain.OrderSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMmStoreTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final InMemoryMmStore store = new InMemoryMmStore(Clock.fixed(NOW, ZoneOffset.UTC), new ObjectMapper());

  @Test
  void quoteStatusTransitionsRemoveItFromActiveSet() {
    long first = store.insertQuote(quote());
    long second = store.insertQuote(quote());

    store.updateQuoteStatus(first, QuoteRecord.REPLACED);

    assertThat(store.activeQuotes()).extracting(QuoteRecord::id).containsExactly(second);
    assertThat(store.quotesSince(NOW.minusSeconds(60))).hasSize(2);
  }

  @Test
  void fillsWaitForBothLaterMids() {
    long fillId = store.insertFill(new FillRecord(null, 1L, "o1", "m1", "yes", OrderSide.BUY, 0.48, 10, 0.0, 0.50,
        null, null, NOW));

    store.updateFillAdverseSelection(fillId, 0.49, null);
    assertThat(store.fillsPendingAdverseSelection(NOW.minusSeconds(600))).hasSize(1);

    store.updateFillAdverseSelection(fillId, null, 0.47);
    assertThat(store.fillsPendingAdverseSelection(NOW.minusSeconds(600))).isEmpty();
    FillRecord fill = store.fillsSince(NOW).get(0);
    assertThat(fill.midAt30s()).isEqualTo(0.49);
    assertThat(fill.midAt120s()).isEqualTo(0.47);
  }

  @Test
  void inventoryUpsertIsKeyedByMarketAndToken() {
    store.upsertInventory(new InventoryRecord("m1", "yes", BigDecimal.TEN, new BigDecimal("0.5"), null, null, NOW));
    store.upsertInventory(new InventoryRecord("m1", "yes", BigDecimal.ONE, new BigDecimal("0.5"), null, null, NOW));
    store.upsertInventory(new InventoryRecord("m1", "no", BigDecimal.ONE, null, null, null, NOW));

    assertThat(store.inventory()).hasSize(2);
    assertThat(store.inventory()).filteredOn(r -> r.tokenId().equals("yes"))
        .extracting(InventoryRecord::netPosition).containsExactly(BigDecimal.ONE);
  }

  @Test
  void highWaterMarkIsSeededByFirstValuationAndKeepsPeak() {
    assertThat(store.updateHighWaterMark(100.0)).isEqualTo(100.0);
    assertThat(store.updateHighWaterMark(120.0)).isEqualTo(120.0);
    assertThat(store.updateHighWaterMark(90.0)).isEqualTo(120.0);

    HighWaterMark mark = store.highWaterMark().orElseThrow();
    assertThat(mark.currentValue()).isEqualTo(90.0);
    assertThat(mark.maxDrawdownPct()).isEqualTo(25.0);
  }

  @Test
  void dailyMetricsAreReturnedNewestFirst() {
    store.upsertDailyMetrics(metrics(LocalDate.of(2024, 1, 13)));
    store.upsertDailyMetrics(metrics(LocalDate.of(2024, 1, 15)));
    store.upsertDailyMetrics(metrics(LocalDate.of(2024, 1, 10)));

    assertThat(store.dailyMetricsSince(LocalDate.of(2024, 1, 12)))
        .extracting(DailyMetricsRecord::date)
        .containsExactly(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 13));
  }

  @Test
  void botStatusEncodesNonStringsAsJson() {
    store.updateBotStatus(Map.of("mm_cycle", 42, "mm_mode", "PAPER", MmStore.GUARD_KILL_LIST_KEY, List.of("m1", "m2")));

    assertThat(store.botStatusField("mm_cycle")).contains("42");
    assertThat(store.botStatusField("mm_mode")).contains("PAPER");
    assertThat(store.guardKillList()).containsExactly("m1", "m2");
  }

  @Test
  void malformedStatusListReadsAsEmpty() {
    store.updateBotStatus(Map.of(MmStore.GUARD_KILL_LIST_KEY, "not json ["));

    assertThat(store.guardKillList()).isEmpty();
  }

  private static QuoteRecord quote() {
    return new QuoteRecord(null, "m1", "yes", "b1", "a1", 0.48, 0.52, 0.50, 10, QuoteRecord.ACTIVE, NOW, NOW);
  }

  private static DailyMetricsRecord metrics(LocalDate date) {
    return new DailyMetricsRecord(date, 1, 2, 3, 1, 0.5, 0, 0, 1, 1, 10, 1, 1, 0, 100);
  }
}
