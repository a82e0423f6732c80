package com.polybot.mm.strategy.inventory;

import com.polybot.mm.domain.MarketRef;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.domain.TokenLeg;
import com.polybot.mm.store.InventoryRecord;
import com.polybot.mm.strategy.model.InventoryDivergence;
import com.polybot.mm.strategy.model.InventorySnapshot;
import com.polybot.mm.strategy.model.LegPosition;
import com.polybot.mm.strategy.model.MarketInventory;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-market YES/NO inventory with weighted-average cost and realized P&L.
 *
 * Writes come from the loop thread only; each market's state is an immutable {@link MarketInventory} swapped in
 * with {@code compute}, so status readers on other threads always see a consistent snapshot.
 */
@Slf4j
public class InventoryLedger {

    static final BigDecimal RECONCILE_TOLERANCE = new BigDecimal("0.1");
    private static final BigDecimal SPLIT_BASIS = new BigDecimal("0.50");
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal SNAPSHOT_EPS = new BigDecimal("0.001");

    private final Clock clock;
    private final Map<String, MarketInventory> inventoryByMarket = new ConcurrentHashMap<>();

    public InventoryLedger(Clock clock) {
        this.clock = clock;
    }

    public MarketInventory get(String marketId) {
        MarketInventory inv = inventoryByMarket.get(marketId);
        return inv == null ? MarketInventory.empty(marketId) : inv;
    }

    public MarketInventory processFill(String marketId, String tokenId, OrderSide side, double price, double size,
                                       TokenLeg leg) {
        Instant now = clock.instant();
        BigDecimal px = BigDecimal.valueOf(price);
        BigDecimal qty = BigDecimal.valueOf(size);
        MarketInventory updated = inventoryByMarket.compute(marketId, (k, prev) -> {
            MarketInventory current = prev == null ? MarketInventory.empty(k) : prev;
            LegPosition yes = current.yes();
            LegPosition no = current.no();
            if (leg == TokenLeg.NO) {
                no = no.withTokenId(tokenId).applyFill(side, px, qty);
            } else {
                yes = yes.withTokenId(tokenId).applyFill(side, px, qty);
            }
            Instant openedAt = current.openedAt();
            LegPosition touched = leg == TokenLeg.NO ? no : yes;
            if (side == OrderSide.BUY && openedAt == null && touched.position().signum() > 0) {
                openedAt = now;
            }
            if (yes.isFlat() && no.isFlat()) {
                openedAt = null;
            }
            return current.withLegs(yes, no, openedAt, now);
        });
        log.debug("inventory {} ({}): {} {}@{} -> yes={} no={}", marketId, leg, side, size, price,
                updated.yes().position(), updated.no().position());
        return updated;
    }

    /**
     * Burn {@code amount} YES+NO pairs back into collateral. Changes nothing and returns false when either leg is
     * short of the amount.
     */
    public boolean processMerge(String marketId, double amount) {
        BigDecimal qty = BigDecimal.valueOf(amount);
        MarketInventory current = get(marketId);
        if (current.yes().position().compareTo(qty) < 0 || current.no().position().compareTo(qty) < 0) {
            log.warn("merge refused {}: requested {} but yes={} no={}", marketId, amount,
                    current.yes().position(), current.no().position());
            return false;
        }
        Instant now = clock.instant();
        inventoryByMarket.compute(marketId, (k, prev) -> {
            MarketInventory inv = prev == null ? MarketInventory.empty(k) : prev;
            LegPosition yes = burn(inv.yes(), qty);
            LegPosition no = burn(inv.no(), qty);
            Instant openedAt = yes.isFlat() && no.isFlat() ? null : inv.openedAt();
            return inv.withLegs(yes, no, openedAt, now);
        });
        log.info("merged {} pairs on {}", amount, marketId);
        return true;
    }

    private static LegPosition burn(LegPosition leg, BigDecimal qty) {
        BigDecimal left = leg.position().subtract(qty);
        BigDecimal avg = left.signum() == 0 ? BigDecimal.ZERO : leg.avgEntryPrice();
        return new LegPosition(leg.tokenId(), left, avg, leg.realizedPnl());
    }

    /**
     * Record a split of {@code amount} collateral into YES+NO. A leg without a cost basis starts at 0.50.
     */
    public void processSplit(String marketId, double amount, String yesTokenId, String noTokenId) {
        BigDecimal qty = BigDecimal.valueOf(amount);
        Instant now = clock.instant();
        MarketInventory updated = inventoryByMarket.compute(marketId, (k, prev) -> {
            MarketInventory inv = prev == null ? MarketInventory.empty(k) : prev;
            LegPosition yes = splitLeg(inv.yes().withTokenId(yesTokenId), qty);
            LegPosition no = splitLeg(inv.no().withTokenId(noTokenId), qty);
            Instant openedAt = inv.openedAt() == null ? now : inv.openedAt();
            return inv.withLegs(yes, no, openedAt, now);
        });
        log.info("split {} USDC on {} -> yes={} no={}", amount, marketId,
                updated.yes().position(), updated.no().position());
    }

    private static LegPosition splitLeg(LegPosition leg, BigDecimal qty) {
        BigDecimal avg = leg.hasBasis() ? leg.avgEntryPrice() : SPLIT_BASIS;
        return new LegPosition(leg.tokenId(), leg.position().add(qty), avg, leg.realizedPnl());
    }

    /**
     * Absolute exposure in USDC at cost, over both legs of every market.
     */
    public double totalExposure() {
        BigDecimal total = BigDecimal.ZERO;
        for (MarketInventory inv : inventoryByMarket.values()) {
            total = total.add(costValue(inv.yes())).add(costValue(inv.no()));
        }
        return total.doubleValue();
    }

    private static BigDecimal costValue(LegPosition leg) {
        return leg.hasBasis() ? leg.position().abs().multiply(leg.avgEntryPrice()) : BigDecimal.ZERO;
    }

    public double totalRealizedPnl() {
        BigDecimal total = BigDecimal.ZERO;
        for (MarketInventory inv : inventoryByMarket.values()) {
            total = total.add(inv.totalRealizedPnl());
        }
        return total.doubleValue();
    }

    /**
     * Both legs valued at cost, falling back to {@code mid} (YES) and {@code 1 - mid} (NO) without a basis.
     */
    public boolean isAtCapacity(String marketId, double maxPerMarket, double mid) {
        MarketInventory inv = get(marketId);
        double yesPrice = inv.yes().hasBasis() ? inv.yes().avgEntryPrice().doubleValue() : mid;
        double noPrice = inv.no().hasBasis() ? inv.no().avgEntryPrice().doubleValue() : (mid > 0 ? 1 - mid : 0);
        double total = inv.yes().position().abs().doubleValue() * yesPrice
                + inv.no().position().abs().doubleValue() * noPrice;
        return total >= maxPerMarket;
    }

    /**
     * (YES value − NO value) / maxPerMarket; positive when long YES.
     */
    public double skewDirection(String marketId, double maxPerMarket) {
        if (maxPerMarket <= 0) {
            return 0.0;
        }
        MarketInventory inv = get(marketId);
        return (markValue(inv.yes()) - markValue(inv.no())) / maxPerMarket;
    }

    private static double markValue(LegPosition leg) {
        BigDecimal price = leg.hasBasis() ? leg.avgEntryPrice() : HALF;
        return leg.position().multiply(price).doubleValue();
    }

    /**
     * 0 for a fresh position, rising linearly to 1 at {@code maxAge}.
     */
    public double unwindUrgency(String marketId, Duration maxAge) {
        MarketInventory inv = inventoryByMarket.get(marketId);
        if (inv == null || maxAge.isZero() || maxAge.isNegative()) {
            return 0.0;
        }
        double age = inv.positionAge(clock.instant()).toMillis();
        return Math.min(age / maxAge.toMillis(), 1.0);
    }

    /**
     * YES inventory value above {@code unwindThreshold} of the market's capacity.
     */
    public boolean needsUnwind(String marketId, double maxPerMarket, double unwindThreshold) {
        MarketInventory inv = get(marketId);
        return Math.abs(markValue(inv.yes())) > maxPerMarket * unwindThreshold;
    }

    public double mergeAmount(String marketId) {
        return get(marketId).mergeablePairs().doubleValue();
    }

    public List<InventorySnapshot> snapshots() {
        List<InventorySnapshot> out = new ArrayList<>();
        for (MarketInventory inv : inventoryByMarket.values()) {
            if (inv.yes().position().abs().compareTo(SNAPSHOT_EPS) > 0
                    || inv.no().position().abs().compareTo(SNAPSHOT_EPS) > 0) {
                out.add(InventorySnapshot.of(inv));
            }
        }
        return out;
    }

    /**
     * Persistable rows for each leg that has a token id, with unrealized P&L marked at {@code mid}.
     */
    public List<InventoryRecord> records(String marketId, double mid) {
        MarketInventory inv = get(marketId);
        Instant now = clock.instant();
        List<InventoryRecord> out = new ArrayList<>(2);
        if (inv.yes().tokenId() != null) {
            out.add(record(marketId, inv.yes(), mid, now));
        }
        if (inv.no().tokenId() != null) {
            out.add(record(marketId, inv.no(), mid > 0 ? 1 - mid : 0, now));
        }
        return out;
    }

    private static InventoryRecord record(String marketId, LegPosition leg, double mark, Instant now) {
        BigDecimal unrealized = leg.isFlat() || mark <= 0
                ? BigDecimal.ZERO
                : leg.position().multiply(BigDecimal.valueOf(mark).subtract(leg.avgEntryPrice()));
        return new InventoryRecord(marketId, leg.tokenId(), leg.position(), leg.avgEntryPrice(), unrealized,
                leg.realizedPnl(), now);
    }

    /**
     * Replace in-memory state with persisted per-token rows. {@code markets} resolves which token is the NO leg;
     * for an unknown market the first row seen is YES.
     */
    public void loadFrom(List<InventoryRecord> records, Map<String, MarketRef> markets) {
        Map<String, List<InventoryRecord>> byMarket = groupByMarket(records);
        Instant now = clock.instant();
        byMarket.forEach((marketId, rows) -> {
            LegPosition yes = LegPosition.empty(null);
            LegPosition no = LegPosition.empty(null);
            for (InventoryRecord row : rows) {
                LegPosition leg = new LegPosition(row.tokenId(), row.netPosition(), row.avgEntryPrice(), row.realizedPnl());
                if (legOf(markets.get(marketId), yes.tokenId(), row.tokenId()) == TokenLeg.NO) {
                    no = leg;
                } else {
                    yes = leg;
                }
            }
            Instant openedAt = yes.isFlat() && no.isFlat() ? null : now;
            inventoryByMarket.put(marketId, new MarketInventory(marketId, yes, no, openedAt, now));
        });
        log.info("loaded inventory for {} markets ({} records)", byMarket.size(), records.size());
    }

    /**
     * Persisted rows win: any leg more than 0.1 shares away from its stored position is overwritten and reported.
     */
    public List<InventoryDivergence> reconcileWithStore(List<InventoryRecord> records, Map<String, MarketRef> markets) {
        List<InventoryDivergence> divergences = new ArrayList<>();
        Instant now = clock.instant();
        for (InventoryRecord row : records) {
            MarketInventory inv = get(row.marketId());
            TokenLeg leg = legOf(markets.get(row.marketId()), inv.yes().tokenId(), row.tokenId());
            if (leg == TokenLeg.YES && inv.no().tokenId() != null && inv.no().tokenId().equals(row.tokenId())) {
                leg = TokenLeg.NO;
            }
            LegPosition current = leg == TokenLeg.NO ? inv.no() : inv.yes();
            BigDecimal stored = row.netPosition();
            if (current.position().subtract(stored).abs().compareTo(RECONCILE_TOLERANCE) <= 0) {
                continue;
            }
            divergences.add(new InventoryDivergence(row.marketId(), row.tokenId(), leg, current.position(), stored));
            TokenLeg fixedLeg = leg;
            inventoryByMarket.compute(row.marketId(), (k, prev) -> {
                MarketInventory base = prev == null ? MarketInventory.empty(k) : prev;
                LegPosition yes = base.yes();
                LegPosition no = base.no();
                if (fixedLeg == TokenLeg.NO) {
                    no = corrected(no, row);
                } else {
                    yes = corrected(yes, row);
                }
                Instant openedAt = yes.isFlat() && no.isFlat() ? null
                        : base.openedAt() == null ? now : base.openedAt();
                return base.withLegs(yes, no, openedAt, now);
            });
            log.warn("inventory divergence {} {} ({}): memory={} store={}", row.marketId(), row.tokenId(), leg,
                    current.position(), stored);
        }
        return divergences;
    }

    private static LegPosition corrected(LegPosition leg, InventoryRecord row) {
        if (leg.tokenId() == null) {
            return new LegPosition(row.tokenId(), row.netPosition(), row.avgEntryPrice(), row.realizedPnl());
        }
        return leg.withPosition(row.netPosition());
    }

    private static TokenLeg legOf(MarketRef market, String knownYesToken, String tokenId) {
        if (market != null) {
            return tokenId != null && tokenId.equals(market.noTokenId()) ? TokenLeg.NO : TokenLeg.YES;
        }
        if (knownYesToken != null && !knownYesToken.equals(tokenId)) {
            return TokenLeg.NO;
        }
        return TokenLeg.YES;
    }

    private static Map<String, List<InventoryRecord>> groupByMarket(List<InventoryRecord> records) {
        Map<String, List<InventoryRecord>> byMarket = new LinkedHashMap<>();
        for (InventoryRecord r : records) {
            byMarket.computeIfAbsent(r.marketId(), k -> new ArrayList<>()).add(r);
        }
        return byMarket;
    }
}
