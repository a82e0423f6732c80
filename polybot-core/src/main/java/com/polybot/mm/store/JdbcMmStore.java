package com.polybot.mm.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.mm.domain.OrderSide;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL-backed store. Tables are created by {@code schema.sql}; upserts rely on {@code ON CONFLICT}.
 */
public class JdbcMmStore implements MmStore {

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;
  private final BotStatusCodec codec;

  public JdbcMmStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
    this.codec = new BotStatusCodec(objectMapper);
  }

  @Override
  public long insertQuote(QuoteRecord quote) {
    String sql = """
        INSERT INTO mm_quotes
        (market_id, token_id, bid_order_id, ask_order_id, bid_price, ask_price, mid_price, size, status,
         created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING id
        """;
    Instant now = clock.instant();
    Long id = jdbcTemplate.queryForObject(sql, Long.class,
        quote.marketId(),
        quote.tokenId(),
        quote.bidOrderId(),
        quote.askOrderId(),
        quote.bidPrice(),
        quote.askPrice(),
        quote.midPrice(),
        quote.size(),
        quote.status() == null ? QuoteRecord.ACTIVE : quote.status(),
        ts(quote.createdAt() == null ? now : quote.createdAt()),
        ts(now));
    if (id == null) {
      throw new IllegalStateException("mm_quotes insert returned no id");
    }
    return id;
  }

  @Override
  public void updateQuoteStatus(long quoteId, String status) {
    jdbcTemplate.update("UPDATE mm_quotes SET status = ?, updated_at = ? WHERE id = ?",
        status, ts(clock.instant()), quoteId);
  }

  @Override
  public List<QuoteRecord> activeQuotes() {
    return jdbcTemplate.query("SELECT * FROM mm_quotes WHERE status = ? ORDER BY id",
        QUOTE_MAPPER, QuoteRecord.ACTIVE);
  }

  @Override
  public List<QuoteRecord> quotesSince(Instant since) {
    return jdbcTemplate.query("SELECT * FROM mm_quotes WHERE created_at >= ? ORDER BY id",
        QUOTE_MAPPER, ts(since));
  }

  @Override
  public long insertFill(FillRecord fill) {
    String sql = """
        INSERT INTO mm_fills
        (quote_id, order_id, market_id, token_id, side, price, size, fee, mid_at_fill, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING id
        """;
    Long id = jdbcTemplate.queryForObject(sql, Long.class,
        fill.quoteId(),
        fill.orderId(),
        fill.marketId(),
        fill.tokenId(),
        fill.side().name(),
        fill.price(),
        fill.size(),
        fill.fee(),
        fill.midAtFill(),
        ts(fill.filledAt()));
    if (id == null) {
      throw new IllegalStateException("mm_fills insert returned no id");
    }
    return id;
  }

  @Override
  public void updateFillAdverseSelection(long fillId, Double midAt30s, Double midAt120s) {
    if (midAt30s == null && midAt120s == null) {
      return;
    }
    jdbcTemplate.update("""
        UPDATE mm_fills
        SET mid_at_30s = COALESCE(?, mid_at_30s),
            mid_at_120s = COALESCE(?, mid_at_120s)
        WHERE id = ?
        """, midAt30s, midAt120s, fillId);
  }

  @Override
  public List<FillRecord> fillsSince(Instant since) {
    return jdbcTemplate.query("SELECT * FROM mm_fills WHERE created_at >= ? ORDER BY created_at",
        FILL_MAPPER, ts(since));
  }

  @Override
  public List<FillRecord> fillsPendingAdverseSelection(Instant notBefore) {
    return jdbcTemplate.query("""
        SELECT * FROM mm_fills
        WHERE (mid_at_30s IS NULL OR mid_at_120s IS NULL)
          AND created_at >= ?
        ORDER BY created_at
        """, FILL_MAPPER, ts(notBefore));
  }

  @Override
  public void insertRoundTrip(RoundTripRecord rt) {
    jdbcTemplate.update("""
        INSERT INTO mm_round_trips
        (market_id, token_id, entry_price, exit_price, size, gross_pnl, net_pnl, hold_seconds, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
        rt.marketId(),
        rt.tokenId(),
        rt.entryPrice(),
        rt.exitPrice(),
        rt.size(),
        rt.grossPnl(),
        rt.netPnl(),
        rt.holdSeconds(),
        ts(rt.closedAt()));
  }

  @Override
  public List<RoundTripRecord> roundTripsSince(Instant since) {
    return jdbcTemplate.query("SELECT * FROM mm_round_trips WHERE created_at >= ? ORDER BY created_at",
        (rs, rowNum) -> new RoundTripRecord(
            rs.getString("market_id"),
            rs.getString("token_id"),
            rs.getDouble("entry_price"),
            rs.getDouble("exit_price"),
            rs.getDouble("size"),
            rs.getDouble("gross_pnl"),
            rs.getDouble("net_pnl"),
            nullableDouble(rs, "hold_seconds"),
            instant(rs, "created_at")),
        ts(since));
  }

  @Override
  public void upsertInventory(InventoryRecord r) {
    jdbcTemplate.update("""
        INSERT INTO mm_inventory
        (market_id, token_id, net_position, avg_entry_price, unrealized_pnl, realized_pnl, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (market_id, token_id) DO UPDATE SET
          net_position = EXCLUDED.net_position,
          avg_entry_price = EXCLUDED.avg_entry_price,
          unrealized_pnl = EXCLUDED.unrealized_pnl,
          realized_pnl = EXCLUDED.realized_pnl,
          updated_at = EXCLUDED.updated_at
        """,
        r.marketId(),
        r.tokenId(),
        r.netPosition(),
        r.avgEntryPrice(),
        r.unrealizedPnl(),
        r.realizedPnl(),
        ts(r.updatedAt() == null ? clock.instant() : r.updatedAt()));
  }

  @Override
  public List<InventoryRecord> inventory() {
    return jdbcTemplate.query("SELECT * FROM mm_inventory ORDER BY market_id, token_id",
        (rs, rowNum) -> new InventoryRecord(
            rs.getString("market_id"),
            rs.getString("token_id"),
            rs.getBigDecimal("net_position"),
            rs.getBigDecimal("avg_entry_price"),
            rs.getBigDecimal("unrealized_pnl"),
            rs.getBigDecimal("realized_pnl"),
            instant(rs, "updated_at")));
  }

  @Override
  public void upsertDailyMetrics(DailyMetricsRecord m) {
    jdbcTemplate.update("""
        INSERT INTO mm_daily_metrics
        (date, markets_quoted, quotes_placed, fills_count, round_trips, spread_capture_rate, fill_quality_avg,
         adverse_selection_avg, pnl_gross, pnl_net, max_inventory, inventory_turns, profit_factor, sharpe_7d,
         portfolio_value)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (date) DO UPDATE SET
          markets_quoted = EXCLUDED.markets_quoted,
          quotes_placed = EXCLUDED.quotes_placed,
          fills_count = EXCLUDED.fills_count,
          round_trips = EXCLUDED.round_trips,
          spread_capture_rate = EXCLUDED.spread_capture_rate,
          fill_quality_avg = EXCLUDED.fill_quality_avg,
          adverse_selection_avg = EXCLUDED.adverse_selection_avg,
          pnl_gross = EXCLUDED.pnl_gross,
          pnl_net = EXCLUDED.pnl_net,
          max_inventory = EXCLUDED.max_inventory,
          inventory_turns = EXCLUDED.inventory_turns,
          profit_factor = EXCLUDED.profit_factor,
          sharpe_7d = EXCLUDED.sharpe_7d,
          portfolio_value = EXCLUDED.portfolio_value
        """,
        Date.valueOf(m.date()),
        m.marketsQuoted(),
        m.quotesPlaced(),
        m.fillsCount(),
        m.roundTrips(),
        m.spreadCaptureRate(),
        m.fillQualityAvgBps(),
        m.adverseSelectionAvgBps(),
        m.pnlGross(),
        m.pnlNet(),
        m.maxInventory(),
        m.inventoryTurns(),
        m.profitFactor(),
        m.sharpe7d(),
        m.portfolioValue());
  }

  @Override
  public List<DailyMetricsRecord> dailyMetricsSince(LocalDate since) {
    return jdbcTemplate.query("SELECT * FROM mm_daily_metrics WHERE date >= ? ORDER BY date DESC",
        (rs, rowNum) -> new DailyMetricsRecord(
            rs.getDate("date").toLocalDate(),
            rs.getInt("markets_quoted"),
            rs.getInt("quotes_placed"),
            rs.getInt("fills_count"),
            rs.getInt("round_trips"),
            rs.getDouble("spread_capture_rate"),
            rs.getDouble("fill_quality_avg"),
            rs.getDouble("adverse_selection_avg"),
            rs.getDouble("pnl_gross"),
            rs.getDouble("pnl_net"),
            rs.getDouble("max_inventory"),
            rs.getDouble("inventory_turns"),
            rs.getDouble("profit_factor"),
            rs.getDouble("sharpe_7d"),
            rs.getDouble("portfolio_value")),
        Date.valueOf(since));
  }

  @Override
  public Optional<HighWaterMark> highWaterMark() {
    List<HighWaterMark> rows = jdbcTemplate.query(
        "SELECT peak_value, current_value, max_drawdown_pct, updated_at FROM high_water_mark WHERE id = 1",
        (rs, rowNum) -> new HighWaterMark(
            rs.getDouble("peak_value"),
            rs.getDouble("current_value"),
            rs.getDouble("max_drawdown_pct"),
            instant(rs, "updated_at")));
    return rows.stream().findFirst();
  }

  @Override
  public double updateHighWaterMark(double currentValue) {
    HighWaterMark next = HighWaterMark.next(highWaterMark().orElse(null), currentValue, clock.instant());
    jdbcTemplate.update("""
        INSERT INTO high_water_mark (id, peak_value, current_value, max_drawdown_pct, updated_at)
        VALUES (1, ?, ?, ?, ?)
        ON CONFLICT (id) DO UPDATE SET
          peak_value = EXCLUDED.peak_value,
          current_value = EXCLUDED.current_value,
          max_drawdown_pct = EXCLUDED.max_drawdown_pct,
          updated_at = EXCLUDED.updated_at
        """,
        next.peakValue(),
        next.currentValue(),
        next.maxDrawdownPct(),
        ts(next.updatedAt()));
    return next.peakValue();
  }

  @Override
  public void updateBotStatus(Map<String, ?> fields) {
    Timestamp now = ts(clock.instant());
    fields.forEach((key, value) -> jdbcTemplate.update("""
        INSERT INTO bot_status (key, value, updated_at)
        VALUES (?, ?, ?)
        ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = EXCLUDED.updated_at
        """, key, codec.encode(value), now));
  }

  @Override
  public Optional<String> botStatusField(String key) {
    List<String> rows = jdbcTemplate.query("SELECT value FROM bot_status WHERE key = ?",
        (rs, rowNum) -> rs.getString("value"), key);
    return rows.stream().findFirst();
  }

  @Override
  public Set<String> botStatusList(String key) {
    return codec.decodeStringSet(botStatusField(key).orElse(null));
  }

  private static final RowMapper<QuoteRecord> QUOTE_MAPPER = (rs, rowNum) -> new QuoteRecord(
      rs.getLong("id"),
      rs.getString("market_id"),
      rs.getString("token_id"),
      rs.getString("bid_order_id"),
      rs.getString("ask_order_id"),
      nullableDouble(rs, "bid_price"),
      nullableDouble(rs, "ask_price"),
      rs.getDouble("mid_price"),
      rs.getDouble("size"),
      rs.getString("status"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  private static final RowMapper<FillRecord> FILL_MAPPER = (rs, rowNum) -> new FillRecord(
      rs.getLong("id"),
      nullableLong(rs, "quote_id"),
      rs.getString("order_id"),
      rs.getString("market_id"),
      rs.getString("token_id"),
      OrderSide.valueOf(rs.getString("side")),
      rs.getDouble("price"),
      rs.getDouble("size"),
      rs.getDouble("fee"),
      nullableDouble(rs, "mid_at_fill"),
      nullableDouble(rs, "mid_at_30s"),
      nullableDouble(rs, "mid_at_120s"),
      instant(rs, "created_at"));

  private static Timestamp ts(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp t = rs.getTimestamp(column);
    return t == null ? null : t.toInstant();
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double v = rs.getDouble(column);
    return rs.wasNull() ? null : v;
  }

  private static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long v = rs.getLong(column);
    return rs.wasNull() ? null : v;
  }
}
