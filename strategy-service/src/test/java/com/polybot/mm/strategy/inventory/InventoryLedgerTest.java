package com.polybot.mm.strategy.inventory;

import com.polybot.mm.domain.MarketRef;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.domain.TokenLeg;
import com.polybot.mm.store.InventoryRecord;
import com.polybot.mm.strategy.MutableClock;
import com.polybot.mm.strategy.model.InventoryDivergence;
import com.polybot.mm.strategy.model.MarketInventory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InventoryLedgerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final MarketRef MARKET = new MarketRef("m1", "yes", "no", "0xcond", "Will it rain?", null);

    private MutableClock clock;
    private InventoryLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        ledger = new InventoryLedger(clock);
    }

    @Test
    void roundTripRealizesSpread() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 10, TokenLeg.YES);
        MarketInventory inv = ledger.processFill("m1", "yes", OrderSide.SELL, 0.60, 10, TokenLeg.YES);

        assertThat(inv.yes().position()).isEqualByComparingTo("0");
        assertThat(inv.yes().realizedPnl()).isEqualByComparingTo("1.0");
        assertThat(inv.openedAt()).isNull();
        assertThat(ledger.totalRealizedPnl()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void closedLegTakesSplitBasisOnNextSplit() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.60, 10, TokenLeg.YES);
        MarketInventory closed = ledger.processFill("m1", "yes", OrderSide.SELL, 0.70, 10, TokenLeg.YES);
        assertThat(closed.yes().avgEntryPrice()).isEqualByComparingTo("0");

        ledger.processSplit("m1", 10, "yes", "no");

        MarketInventory inv = ledger.get("m1");
        assertThat(inv.yes().position()).isEqualByComparingTo("10");
        assertThat(inv.yes().avgEntryPrice()).isEqualByComparingTo("0.50");
        assertThat(inv.no().avgEntryPrice()).isEqualByComparingTo("0.50");
        assertThat(inv.yes().realizedPnl()).isEqualByComparingTo("1.0");
        assertThat(ledger.totalExposure()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void buysAverageTheirCost() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.40, 10, TokenLeg.YES);
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.60, 10, TokenLeg.YES);

        assertThat(ledger.get("m1").yes().avgEntryPrice()).isEqualByComparingTo("0.5");
        assertThat(ledger.totalExposure()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void coveringAShortRealizesAgainstEntry() {
        ledger.processFill("m1", "yes", OrderSide.SELL, 0.60, 5, TokenLeg.YES);
        MarketInventory inv = ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 5, TokenLeg.YES);

        assertThat(inv.yes().realizedPnl()).isEqualByComparingTo("0.5");
        assertThat(inv.isFlat()).isTrue();
    }

    @Test
    void noLegFillsAreKeptApart() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 10, TokenLeg.YES);
        ledger.processFill("m1", "no", OrderSide.BUY, 0.45, 6, TokenLeg.NO);

        MarketInventory inv = ledger.get("m1");
        assertThat(inv.yes().position()).isEqualByComparingTo("10");
        assertThat(inv.no().position()).isEqualByComparingTo("6");
        assertThat(inv.no().tokenId()).isEqualTo("no");
        assertThat(ledger.mergeAmount("m1")).isEqualTo(6.0);
    }

    @Test
    void splitThenMergeReturnsToFlat() {
        ledger.processSplit("m1", 20, "yes", "no");

        assertThat(ledger.mergeAmount("m1")).isEqualTo(20.0);
        assertThat(ledger.get("m1").yes().avgEntryPrice()).isEqualByComparingTo("0.50");
        assertThat(ledger.isAtCapacity("m1", 20, 0.5)).isTrue();
        assertThat(ledger.isAtCapacity("m1", 25, 0.5)).isFalse();

        assertThat(ledger.processMerge("m1", 30)).isFalse();
        assertThat(ledger.processMerge("m1", 20)).isTrue();

        MarketInventory inv = ledger.get("m1");
        assertThat(inv.isFlat()).isTrue();
        assertThat(inv.openedAt()).isNull();
        assertThat(ledger.snapshots()).isEmpty();
    }

    @Test
    void skewAndUnwindFollowYesValue() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 40, TokenLeg.YES);

        assertThat(ledger.skewDirection("m1", 50)).isCloseTo(0.4, within(1e-9));
        assertThat(ledger.needsUnwind("m1", 50, 0.8)).isFalse();

        ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 50, TokenLeg.YES);
        assertThat(ledger.needsUnwind("m1", 50, 0.8)).isTrue();
    }

    @Test
    void urgencyGrowsWithPositionAge() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 10, TokenLeg.YES);

        clock.advance(Duration.ofHours(12));
        assertThat(ledger.unwindUrgency("m1", Duration.ofHours(24))).isCloseTo(0.5, within(1e-9));

        clock.advance(Duration.ofHours(24));
        assertThat(ledger.unwindUrgency("m1", Duration.ofHours(24))).isEqualTo(1.0);
        assertThat(ledger.unwindUrgency("other", Duration.ofHours(24))).isZero();
    }

    @Test
    void recordsMarkUnrealizedAtMid() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.40, 10, TokenLeg.YES);

        List<InventoryRecord> records = ledger.records("m1", 0.50);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).unrealizedPnl()).isEqualByComparingTo("1.0");
    }

    @Test
    void loadsLegsUsingMarketTokens() {
        ledger.loadFrom(List.of(
                new InventoryRecord("m1", "no", new BigDecimal("7"), new BigDecimal("0.45"), null, null, NOW),
                new InventoryRecord("m1", "yes", new BigDecimal("5"), new BigDecimal("0.55"), null, null, NOW)
        ), Map.of("m1", MARKET));

        MarketInventory inv = ledger.get("m1");
        assertThat(inv.yes().position()).isEqualByComparingTo("5");
        assertThat(inv.no().position()).isEqualByComparingTo("7");
        assertThat(ledger.mergeAmount("m1")).isEqualTo(5.0);
    }

    @Test
    void storeWinsWhenPositionsDiverge() {
        ledger.processFill("m1", "yes", OrderSide.BUY, 0.50, 10, TokenLeg.YES);

        List<InventoryDivergence> none = ledger.reconcileWithStore(List.of(
                new InventoryRecord("m1", "yes", new BigDecimal("10.05"), null, null, null, NOW)), Map.of("m1", MARKET));
        List<InventoryDivergence> found = ledger.reconcileWithStore(List.of(
                new InventoryRecord("m1", "yes", new BigDecimal("12"), null, null, null, NOW)), Map.of("m1", MARKET));

        assertThat(none).isEmpty();
        assertThat(found).singleElement().satisfies(d -> {
            assertThat(d.leg()).isEqualTo(TokenLeg.YES);
            assertThat(d.memoryPosition()).isEqualByComparingTo("10");
            assertThat(d.storedPosition()).isEqualByComparingTo("12");
        });
        assertThat(ledger.get("m1").yes().position()).isEqualByComparingTo("12");
    }
}
