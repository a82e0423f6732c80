package com.polybot.mm.strategy.loop;

import com.polybot.mm.advisory.Advisors;
import com.polybot.mm.advisory.RiskVerdict;
import com.polybot.mm.advisory.TradeIntent;
import com.polybot.mm.config.MmProperties;
import com.polybot.mm.domain.MarketRef;
import com.polybot.mm.domain.OrderSide;
import com.polybot.mm.domain.TokenLeg;
import com.polybot.mm.events.MmEventPublisher;
import com.polybot.mm.events.MmEventTypes;
import com.polybot.mm.store.FillRecord;
import com.polybot.mm.store.MmStore;
import com.polybot.mm.store.QuoteRecord;
import com.polybot.mm.store.RoundTripRecord;
import com.polybot.mm.strategy.arbitrage.ArbOpportunity;
import com.polybot.mm.strategy.arbitrage.ArbResult;
import com.polybot.mm.strategy.arbitrage.CompleteSetArbitrage;
import com.polybot.mm.strategy.inventory.InventoryLedger;
import com.polybot.mm.strategy.metrics.MmMetricsService;
import com.polybot.mm.strategy.model.DetectedFill;
import com.polybot.mm.strategy.model.InventoryDivergence;
import com.polybot.mm.strategy.model.LegPosition;
import com.polybot.mm.strategy.model.MarketInventory;
import com.polybot.mm.strategy.model.OrderState;
import com.polybot.mm.strategy.model.QuotePair;
import com.polybot.mm.strategy.model.QuoteSide;
import com.polybot.mm.strategy.model.QuoteValidation;
import com.polybot.mm.strategy.model.RiskMode;
import com.polybot.mm.strategy.pricing.KappaEstimator;
import com.polybot.mm.strategy.pricing.PricingEngine;
import com.polybot.mm.strategy.pricing.PricingInput;
import com.polybot.mm.strategy.pricing.QuotePrices;
import com.polybot.mm.strategy.pricing.QuoteSizing;
import com.polybot.mm.strategy.pricing.StaleTracker;
import com.polybot.mm.strategy.pricing.TickMath;
import com.polybot.mm.strategy.pricing.VolTracker;
import com.polybot.mm.strategy.pricing.WeightedMid;
import com.polybot.mm.strategy.proposal.OrderProposal;
import com.polybot.mm.strategy.proposal.ProposalPipeline;
import com.polybot.mm.strategy.proposal.ProposalStages;
import com.polybot.mm.strategy.proposal.QuoteProposal;
import com.polybot.mm.strategy.quote.Quoter;
import com.polybot.mm.strategy.risk.ExposureCheck;
import com.polybot.mm.strategy.risk.MmRiskManager;
import com.polybot.mm.venue.BookSummary;
import com.polybot.mm.venue.VenueGateway;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One pass of the market-making loop over the configured markets: reconcile, size, price, propose, place.
 *
 * <p>Not thread-safe. Every method must run on the loop thread, which owns the quote pairs, the trackers and the
 * inventory ledger writes; other threads read {@link #activeQuoteViews()} and the ledger's snapshots.
 */
@Slf4j
public class MarketMakingCycle {

    static final double MIN_MID = 0.02;
    static final double MAX_MID = 0.98;
    static final int RECONCILE_EVERY_CYCLES = 60;
    static final Duration SCORE_TTL = Duration.ofMinutes(30);
    private static final int SUMMARY_EVERY_CYCLES = 10;

    private final MmProperties properties;
    private final VenueGateway venue;
    private final Quoter quoter;
    private final InventoryLedger ledger;
    private final MmRiskManager risk;
    private final PricingEngine engine;
    private final VolTracker volTracker;
    private final StaleTracker staleTracker;
    private final KappaEstimator kappaEstimator;
    private final Advisors advisors;
    private final MmStore store;
    private final MmEventPublisher events;
    private final MmMetricsService metrics;
    private final CompleteSetArbitrage arbitrage;
    private final Clock clock;
    private final QuoteCooldowns cooldowns;

    private final Map<String, QuotePair> activeQuotes = new LinkedHashMap<>();
    private final Set<String> splitFailed = new HashSet<>();
    private final Map<String, ScoredMarket> scores = new HashMap<>();
    private final Map<String, Double> lastMid = new HashMap<>();
    private volatile long cycle;
    private volatile List<ActiveQuoteView> views = List.of();

    private record ScoredMarket(double score, Instant at) {
    }

    /**
     * Capital available to one cycle's placements.
     */
    record Budget(double balance, double locked, double free, double maxPerMarket, double quoteSizeUsd) {
    }

    public MarketMakingCycle(@NonNull MmProperties properties,
                             @NonNull VenueGateway venue,
                             @NonNull Quoter quoter,
                             @NonNull InventoryLedger ledger,
                             @NonNull MmRiskManager risk,
                             @NonNull PricingEngine engine,
                             @NonNull VolTracker volTracker,
                             @NonNull StaleTracker staleTracker,
                             @NonNull KappaEstimator kappaEstimator,
                             @NonNull Advisors advisors,
                             @NonNull MmStore store,
                             @NonNull MmEventPublisher events,
                             @NonNull MmMetricsService metrics,
                             @NonNull CompleteSetArbitrage arbitrage,
                             @NonNull Clock clock) {
        this.properties = properties;
        this.venue = venue;
        this.quoter = quoter;
        this.ledger = ledger;
        this.risk = risk;
        this.engine = engine;
        this.volTracker = volTracker;
        this.staleTracker = staleTracker;
        this.kappaEstimator = kappaEstimator;
        this.advisors = advisors;
        this.store = store;
        this.events = events;
        this.metrics = metrics;
        this.arbitrage = arbitrage;
        this.clock = clock;
        this.cooldowns = new QuoteCooldowns(clock, properties.quoting(), properties.circuitBreaker());
    }

    /**
     * Restore inventory from the store and re-adopt quotes whose orders are still open on the venue. Open orders
     * that no stored quote accounts for are cancelled; stored quotes with nothing left open are closed.
     */
    public void initialize(List<MarketRef> markets) {
        Map<String, MarketRef> byId = byId(markets);
        ledger.loadFrom(store.inventory(), byId);

        Set<String> openIds = venue.getOpenOrderIds();
        Set<String> adopted = new HashSet<>();
        for (QuoteRecord stored : store.activeQuotes()) {
            MarketRef market = byId.get(stored.marketId());
            boolean bidOpen = stored.bidOrderId() != null && openIds.contains(stored.bidOrderId());
            boolean askOpen = stored.askOrderId() != null && openIds.contains(stored.askOrderId());
            if (market == null || (!bidOpen && !askOpen) || activeQuotes.containsKey(stored.marketId())) {
                store.updateQuoteStatus(stored.id(), QuoteRecord.CANCELLED);
                continue;
            }
            QuotePair pair = new QuotePair(market,
                    stored.bidPrice() != null ? stored.bidPrice() : 0.0,
                    stored.askPrice() != null ? stored.askPrice() : 0.0,
                    stored.size(), stored.size(), stored.createdAt() != null ? stored.createdAt() : clock.instant());
            pair.markPlaced(QuoteSide.BID, bidOpen ? stored.bidOrderId() : null,
                    bidOpen ? OrderState.LIVE : OrderState.CANCELLED);
            pair.markPlaced(QuoteSide.ASK, askOpen ? stored.askOrderId() : null,
                    askOpen ? OrderState.LIVE : OrderState.CANCELLED);
            pair.setStoreId(stored.id());
            pair.setQuotedMid(stored.midPrice());
            activeQuotes.put(stored.marketId(), pair);
            if (bidOpen) {
                adopted.add(stored.bidOrderId());
            }
            if (askOpen) {
                adopted.add(stored.askOrderId());
            }
        }

        int orphans = 0;
        for (String orderId : openIds) {
            if (!adopted.contains(orderId) && venue.cancelOrder(orderId)) {
                orphans++;
            }
        }
        publishViews();
        log.info("MM initialized: {} quotes re-adopted, {} orphan orders cancelled, {} markets configured",
                activeQuotes.size(), orphans, markets.size());
    }

    public void run(List<MarketRef> markets) {
        cycle++;
        boolean diag = cycle <= 3 || cycle % 100 == 1;

        if (risk.isPaused()) {
            reconcileAll();
            publishViews();
            if (diag) {
                log.info("MM cycle {}: paused, reconciliation only ({} quotes tracked)", cycle, activeQuotes.size());
            }
            return;
        }

        MmProperties.Quoting quoting = properties.quoting();
        boolean reduce = risk.riskMode() == RiskMode.REDUCE;
        int maxMarkets = reduce ? Math.max(1, quoting.maxMarkets() / 2) : quoting.maxMarkets();
        double quoteSize = reduce ? quoting.quoteSizeUsd() / 2.0 : quoting.quoteSizeUsd();

        Set<String> killList = advisors.eventRiskGuard().killList();
        List<MarketRef> selected = selectMarkets(markets, killList, maxMarkets);
        evict(selected, killList);

        reconcileAll();

        Optional<Budget> budget = budget(maxMarkets, quoteSize, diag);
        if (budget.isPresent()) {
            quoteMarkets(selected, budget.get(), diag);
        }

        Map<String, MarketRef> byId = byId(markets);
        housekeeping(byId);

        store.updateBotStatus(statusFields());
        metrics.updateBook(ledger.totalRealizedPnl(), ledger.totalExposure(), activeQuotes.size());
        publishViews();
        if (cycle % SUMMARY_EVERY_CYCLES == 0) {
            log.info("MM cycle {}: {} quotes, exposure ${}, realized P&L ${}, mode={}", cycle, activeQuotes.size(),
                    TickMath.round2(ledger.totalExposure()), TickMath.round4(ledger.totalRealizedPnl()),
                    risk.riskMode());
        }
    }

    /**
     * Cancel every tracked quote and record {@code status} for it.
     */
    public void cancelAll(String status) {
        for (QuotePair pair : new ArrayList<>(activeQuotes.values())) {
            quoter.cancelQuotePair(pair);
            if (pair.getStoreId() != null) {
                store.updateQuoteStatus(pair.getStoreId(), status);
            }
        }
        log.info("MM cancelled {} quotes ({})", activeQuotes.size(), status);
        activeQuotes.clear();
        publishViews();
    }

    public List<ActiveQuoteView> activeQuoteViews() {
        return views;
    }

    public long cycle() {
        return cycle;
    }

    QuoteCooldowns cooldowns() {
        return cooldowns;
    }

    private List<MarketRef> selectMarkets(List<MarketRef> markets, Set<String> killList, int maxMarkets) {
        double minScore = properties.advisory().minMarketScore();
        List<MarketRef> selected = new ArrayList<>();
        for (MarketRef market : markets) {
            if (selected.size() >= maxMarkets) {
                break;
            }
            if (killList.contains(market.marketId())) {
                continue;
            }
            if (score(market) >= minScore) {
                selected.add(market);
            }
        }
        return selected;
    }

    private double score(MarketRef market) {
        Instant now = clock.instant();
        ScoredMarket cached = scores.get(market.marketId());
        if (cached != null && Duration.between(cached.at(), now).compareTo(SCORE_TTL) < 0) {
            return cached.score();
        }
        double score = advisors.marketScorer().score(market);
        scores.put(market.marketId(), new ScoredMarket(score, now));
        return score;
    }

    private void evict(List<MarketRef> selected, Set<String> killList) {
        Set<String> keep = new HashSet<>();
        selected.forEach(m -> keep.add(m.marketId()));
        for (String marketId : new ArrayList<>(activeQuotes.keySet())) {
            if (keep.contains(marketId)) {
                continue;
            }
            QuotePair pair = activeQuotes.get(marketId);
            if (!quoter.cancelQuotePair(pair)) {
                log.warn("MM: could not fully cancel {} while evicting, polling it next cycle", marketId);
                continue;
            }
            activeQuotes.remove(marketId);
            boolean killed = killList.contains(marketId);
            if (pair.getStoreId() != null) {
                store.updateQuoteStatus(pair.getStoreId(), killed ? QuoteRecord.KILLED_BY_GUARD : QuoteRecord.CANCELLED);
            }
            volTracker.reset(marketId);
            staleTracker.reset(marketId);
            kappaEstimator.reset(marketId);
            cooldowns.clear(marketId);
            lastMid.remove(marketId);
            if (killed) {
                log.warn("MM: evicted {} per event-risk kill list", marketId);
            } else {
                log.info("MM: stopped quoting {}", marketId);
            }
        }
    }

    /**
     * Poll every tracked pair, book the fills and drop pairs that are finished.
     */
    void reconcileAll() {
        for (String marketId : new ArrayList<>(activeQuotes.keySet())) {
            QuotePair pair = activeQuotes.get(marketId);
            for (DetectedFill fill : quoter.reconcileQuote(pair)) {
                bookFill(pair, fill);
            }
            if (pair.isTerminal()) {
                activeQuotes.remove(marketId);
                if (pair.getStoreId() != null) {
                    boolean anyFilled = pair.getBidState() == OrderState.FILLED || pair.getAskState() == OrderState.FILLED;
                    store.updateQuoteStatus(pair.getStoreId(), anyFilled ? QuoteRecord.FILLED : QuoteRecord.CANCELLED);
                }
            }
        }
    }

    private void bookFill(QuotePair pair, DetectedFill fill) {
        Instant now = clock.instant();
        String marketId = fill.marketId();
        MarketInventory before = ledger.get(marketId);
        LegPosition yesBefore = before.yes();

        MarketInventory after = ledger.processFill(marketId, fill.tokenId(), fill.orderSide(), fill.price(),
                fill.size(), TokenLeg.YES);

        BigDecimal realized = after.yes().realizedPnl().subtract(yesBefore.realizedPnl());
        if (fill.orderSide() == OrderSide.SELL && realized.signum() != 0) {
            double closed = Math.min(fill.size(), yesBefore.position().doubleValue());
            Double holdSeconds = before.openedAt() != null
                    ? (double) Duration.between(before.openedAt(), now).toSeconds()
                    : null;
            double gross = realized.doubleValue();
            store.insertRoundTrip(new RoundTripRecord(marketId, fill.tokenId(),
                    yesBefore.avgEntryPrice().doubleValue(), fill.price(), closed, gross, gross - fill.fee(),
                    holdSeconds, now));
        }

        double mid = pair.getQuotedMid() > 0 ? pair.getQuotedMid() : pair.mid();
        store.insertFill(new FillRecord(null, fill.quoteStoreId(), fill.orderId(), marketId, fill.tokenId(),
                fill.orderSide(), fill.price(), fill.size(), fill.fee(), mid > 0 ? mid : null, null, null, now));
        ledger.records(marketId, lastMid.getOrDefault(marketId, mid)).forEach(store::upsertInventory);

        kappaEstimator.recordFill(marketId);
        metrics.recordFill(fill.orderSide());
        events.publish(MmEventTypes.QUOTE_FILL, marketId, fill);
        log.info("MM fill: {} {} @ {} on {}{}", fill.orderSide(), fill.size(), fill.price(), marketId,
                fill.complete() ? " (complete)" : "");
    }

    private Optional<Budget> budget(int maxMarkets, double quoteSize, boolean diag) {
        OptionalDouble balance = venue.getAvailableBalance();
        if (balance.isEmpty()) {
            log.warn("MM: could not fetch available balance, skipping placement this cycle");
            return Optional.empty();
        }
        double available = balance.getAsDouble();
        double locked = lockedCapital(activeQuotes.values());
        double free = Math.max(0.0, available - locked);
        int remainingSlots = Math.max(1, maxMarkets - activeQuotes.size());
        double maxPerMarket = free / remainingSlots;

        ExposureCheck exposure = risk.checkGlobalExposure(available, ledger.totalExposure(), 0.0);
        if (!exposure.withinLimit()) {
            if (diag) {
                log.warn("MM: global exposure {}% exceeds limit, skipping placement", exposure.exposurePct());
            }
            return Optional.empty();
        }
        if (free < quoteSize) {
            if (diag) {
                log.warn("MM: free capital ${} too low to quote (balance=${}, locked=${})", TickMath.round2(free),
                        TickMath.round2(available), TickMath.round2(locked));
            }
            return Optional.empty();
        }
        return Optional.of(new Budget(available, locked, free, maxPerMarket, quoteSize));
    }

    /**
     * USDC tied up in resting bids. Asks sell shares already held and lock no collateral.
     */
    static double lockedCapital(Collection<QuotePair> pairs) {
        double locked = 0.0;
        for (QuotePair pair : pairs) {
            if (pair.getBidOrderId() != null && pair.getBidState().isOpen()) {
                locked += pair.getBidSize() * pair.getBidPrice();
            }
        }
        return locked;
    }

    private void quoteMarkets(List<MarketRef> markets, Budget budget, boolean diag) {
        List<MarketRef> eligible = new ArrayList<>();
        for (MarketRef market : markets) {
            if (cooldowns.isBlocked(market.marketId())) {
                if (diag) {
                    log.info("MM skip {}: cooling down", market.marketId());
                }
                continue;
            }
            eligible.add(market);
        }
        if (eligible.isEmpty()) {
            return;
        }
        Map<String, Optional<BookSummary>> books = venue.fetchBooks(eligible.stream().map(MarketRef::tokenId).toList());

        double[] committed = {0.0};
        for (MarketRef market : eligible) {
            Optional<BookSummary> book = books.getOrDefault(market.tokenId(), Optional.empty());
            if (book.isEmpty() || !book.get().hasMid()) {
                if (diag) {
                    log.warn("MM skip {}: no usable book", market.marketId());
                }
                continue;
            }
            quoteMarket(market, book.get(), budget, committed, diag);
        }
    }

    private void quoteMarket(MarketRef market, BookSummary book, Budget budget, double[] committed, boolean diag) {
        String marketId = market.marketId();
        MmProperties.Quoting quoting = properties.quoting();
        MmProperties.Pricing pricing = properties.pricing();

        double mid = WeightedMid.compute(book).orElse(book.mid());
        if (mid < MIN_MID || mid > MAX_MID) {
            if (diag) {
                log.info("MM skip {}: extreme mid {}", marketId, TickMath.round4(mid));
            }
            return;
        }
        lastMid.put(marketId, mid);
        staleTracker.updateIfChanged(marketId, mid);
        double trackedVol = volTracker.update(marketId, mid);

        double maxPerMarket = budget.maxPerMarket();
        LegPosition yes = ledger.get(marketId).yes();
        PricingInput input = new PricingInput(
                mid,
                book.spread() * 100.0,
                book.imbalance(),
                staleTracker.staleness(marketId),
                trackedVol,
                yes.position().doubleValue(),
                yes.avgEntryPrice().doubleValue(),
                maxPerMarket,
                ledger.skewDirection(marketId, maxPerMarket),
                ledger.unwindUrgency(marketId, Duration.ofHours(quoting.maxPositionAgeHours())),
                kappaEstimator.kappa(marketId),
                market.daysToResolution());
        QuotePrices prices = engine.quote(input);

        QuoteValidation validation = risk.validateMmQuote(prices.bid(), prices.ask(), mid, pricing.deltaMax());
        if (!validation.allowed()) {
            if (diag) {
                log.warn("MM skip {}: risk rejected: {} (bid={} ask={} mid={})", marketId, validation.reason(),
                        prices.bid(), prices.ask(), TickMath.round4(mid));
            }
            return;
        }

        double minShares = Math.max(quoting.minOrderShares(), book.minOrderSize());
        boolean placeBid = !ledger.isAtCapacity(marketId, maxPerMarket, mid)
                && !ledger.needsUnwind(marketId, maxPerMarket, quoting.unwindThreshold());
        boolean placeAsk = yes.position().doubleValue() >= minShares;

        if (!placeAsk && wantsSplit(market, budget, committed[0])) {
            placeAsk = split(market, budget, committed, minShares);
        }

        double yesShares = ledger.get(marketId).yes().position().doubleValue();
        double bidShares = 0.0;
        if (placeBid) {
            double sizeUsd = QuoteSizing.computeQuoteSize(budget.free() - committed[0], maxPerMarket,
                    Math.abs(yesShares) * mid, maxPerMarket, budget.quoteSizeUsd());
            bidShares = sizeUsd > 0 ? TickMath.round1(sizeUsd / mid) : 0.0;
        }
        double askShares = placeAsk ? TickMath.round1(Math.min(yesShares, maxPerMarket / mid)) : 0.0;

        QuoteProposal proposal = pipeline(marketId, trackedVol, budget, committed[0]).run(
                ProposalStages.createBase(marketId, market.tokenId(), prices.bid(), prices.ask(),
                        bidShares, askShares, mid, (prices.bid() + prices.ask()) / 2.0),
                quoting.postOnly() ? book.bestBid() : 0.0,
                quoting.postOnly() ? book.bestAsk() : 0.0);

        Optional<OrderProposal> bid = proposal.bestBid().filter(o -> o.getSize() >= minShares);
        Optional<OrderProposal> ask = proposal.bestAsk().filter(o -> o.getSize() >= minShares);
        placeBid = bid.isPresent();
        placeAsk = ask.isPresent();
        if (!placeBid && !placeAsk) {
            if (diag) {
                log.warn("MM skip {}: no side to quote (bidShares={}, askShares={}, minShares={})", marketId,
                        bidShares, askShares, minShares);
            }
            return;
        }
        double bidPrice = bid.map(OrderProposal::getPrice).orElse(prices.bid());
        double askPrice = ask.map(OrderProposal::getPrice).orElse(prices.ask());
        double bidSize = bid.map(OrderProposal::getSize).orElse(0.0);
        double askSize = ask.map(OrderProposal::getSize).orElse(0.0);

        QuotePair existing = activeQuotes.get(marketId);
        if (existing != null && existing.isZombie()) {
            if (!quoter.cancelQuotePair(existing)) {
                log.warn("MM: could not cancel zombie quote on {}, polling it next cycle", marketId);
                return;
            }
            if (existing.getStoreId() != null) {
                store.updateQuoteStatus(existing.getStoreId(), QuoteRecord.CANCELLED);
            }
            activeQuotes.remove(marketId);
            log.warn("MM: dropped zombie quote on {}", marketId);
            existing = null;
        }

        Optional<QuotePair> placed;
        if (existing != null && existing.isActive()) {
            boolean sidesChanged = placeBid != hasOpenSide(existing, QuoteSide.BID)
                    || placeAsk != hasOpenSide(existing, QuoteSide.ASK);
            boolean moved = QuoteSizing.shouldCancelForRequote(existing, mid, quoting.requoteThresholdPts(),
                    Duration.ofSeconds(quoting.minQuoteLifetimeSeconds()), clock.instant());
            if (!moved && !sidesChanged) {
                committed[0] += openBidCost(existing);
                return;
            }
            placed = quoting.hangingOrders()
                    ? quoter.requotePreservingHanging(existing, market, bidPrice, askPrice, bidSize, askSize,
                    placeBid, placeAsk)
                    : quoter.requote(existing, market, bidPrice, askPrice, bidSize, askSize, placeBid, placeAsk);
        } else {
            placed = quoter.placeQuotePair(market, bidPrice, askPrice, bidSize, askSize, placeBid, placeAsk);
        }

        if (placed.isEmpty()) {
            cooldowns.registerFailure(marketId, quoter.lastFailure());
            metrics.recordQuoteFailed();
            if (existing != null && existing.isTerminal()) {
                activeQuotes.remove(marketId);
                if (existing.getStoreId() != null) {
                    store.updateQuoteStatus(existing.getStoreId(), QuoteRecord.CANCELLED);
                }
            }
            return;
        }

        QuotePair pair = placed.get();
        pair.setQuotedMid(mid);
        pair.setStoreId(store.insertQuote(toRecord(pair, mid)));
        if (existing != null && existing.getStoreId() != null) {
            store.updateQuoteStatus(existing.getStoreId(), QuoteRecord.REPLACED);
        }
        activeQuotes.put(marketId, pair);
        cooldowns.registerSuccess(marketId);
        metrics.recordQuotePlaced();
        committed[0] += openBidCost(pair);
    }

    private ProposalPipeline pipeline(String marketId, double volPts, Budget budget, double committed) {
        MmProperties.Proposal cfg = properties.proposal();
        return new ProposalPipeline()
                .add(ProposalStages.multiLevel(cfg.levels(), cfg.levelSpreadMult(), cfg.levelSizeMult()))
                .add(ProposalStages.volatilityWidening(volPts, cfg.volWidenThreshold()))
                .add(ProposalStages.eventRisk(advisors.eventRiskGuard().hasWarning(marketId), cfg.eventRiskWidenPct()))
                .add(ProposalStages.budgetCap(budget.free(), committed, cfg.minViableSize()));
    }

    private boolean wantsSplit(MarketRef market, Budget budget, double committed) {
        MmProperties.SplitMerge splitMerge = properties.splitMerge();
        return properties.quoting().twoSided()
                && splitMerge.enabled()
                && market.supportsCompleteSet()
                && !splitFailed.contains(market.marketId())
                && budget.free() - committed >= splitMerge.splitSizeUsd();
    }

    /**
     * Split collateral into YES+NO so there is something to offer. A failed split is not retried for the
     * market until restart.
     */
    private boolean split(MarketRef market, Budget budget, double[] committed, double minShares) {
        double amount = properties.splitMerge().splitSizeUsd();
        log.info("MM: splitting ${} for two-sided quoting on {}", amount, market.marketId());
        if (!venue.splitPosition(market.conditionId(), amount)) {
            splitFailed.add(market.marketId());
            log.warn("MM: split failed for {}, not retrying until restart", market.marketId());
            return false;
        }
        ledger.processSplit(market.marketId(), amount, market.tokenId(), market.noTokenId());
        ledger.records(market.marketId(), lastMid.getOrDefault(market.marketId(), 0.5)).forEach(store::upsertInventory);
        committed[0] += amount;
        return ledger.get(market.marketId()).yes().position().doubleValue() >= minShares;
    }

    private void housekeeping(Map<String, MarketRef> byId) {
        MmProperties.SplitMerge splitMerge = properties.splitMerge();
        if (splitMerge.enabled() && cycle % splitMerge.mergeEveryCycles() == 0) {
            mergePairs(byId, splitMerge.mergeThreshold());
        }
        MmProperties.Arbitrage arb = properties.arbitrage();
        if (arb.enabled() && cycle % arb.scanEveryCycles() == 0) {
            scanArbitrage(byId.values());
        }
        if (cycle % RECONCILE_EVERY_CYCLES == 0) {
            reconcileInventory(byId);
            detectPhantomOrders();
        }
    }

    void mergePairs(Map<String, MarketRef> byId, double threshold) {
        for (MarketRef market : byId.values()) {
            double amount = TickMath.round1(Math.floor(ledger.mergeAmount(market.marketId()) * 10.0) / 10.0);
            if (amount < threshold || !market.supportsCompleteSet()) {
                continue;
            }
            if (!venue.mergePositions(market.conditionId(), amount)) {
                log.warn("MM: merge of {} pairs failed on {}", amount, market.marketId());
                continue;
            }
            if (ledger.processMerge(market.marketId(), amount)) {
                ledger.records(market.marketId(), lastMid.getOrDefault(market.marketId(), 0.5))
                        .forEach(store::upsertInventory);
            }
        }
    }

    void scanArbitrage(Collection<MarketRef> markets) {
        List<MarketRef> candidates = markets.stream().filter(MarketRef::supportsCompleteSet).toList();
        if (candidates.isEmpty()) {
            return;
        }
        List<String> tokens = new ArrayList<>();
        for (MarketRef market : candidates) {
            tokens.add(market.tokenId());
            tokens.add(market.noTokenId());
        }
        Map<String, Optional<BookSummary>> books = venue.fetchBooks(tokens);
        for (MarketRef market : candidates) {
            BookSummary yesBook = books.getOrDefault(market.tokenId(), Optional.empty()).orElse(null);
            BookSummary noBook = books.getOrDefault(market.noTokenId(), Optional.empty()).orElse(null);
            Optional<ArbOpportunity> found = arbitrage.scan(market, yesBook, noBook);
            if (found.isEmpty()) {
                continue;
            }
            ArbOpportunity opp = found.get();
            double sizeUsd = Math.min(opp.maxSize() * (opp.yesPrice() + opp.noPrice()), properties.arbitrage().maxSizeUsd());
            RiskVerdict verdict = advisors.riskOfficer().review(new TradeIntent(market.marketId(),
                    "complete_set_arbitrage", sizeUsd, opp.netProfitPct(),
                    "%s YES@%.2f NO@%.2f".formatted(opp.type(), opp.yesPrice(), opp.noPrice())));
            if (!verdict.approved()) {
                log.info("ARB on {} vetoed by risk officer: {}", market.marketId(), verdict.reason());
                continue;
            }
            ArbResult result = arbitrage.execute(opp);
            ledger.records(market.marketId(), lastMid.getOrDefault(market.marketId(), 0.5)).forEach(store::upsertInventory);
            if (result.success()) {
                metrics.recordArbitrage();
            }
        }
    }

    void reconcileInventory(Map<String, MarketRef> byId) {
        List<InventoryDivergence> divergences = ledger.reconcileWithStore(store.inventory(), byId);
        if (divergences.isEmpty()) {
            return;
        }
        log.warn("MM reconciliation: {} inventory divergences corrected from the store", divergences.size());
        metrics.recordDivergences(divergences.size());
        for (InventoryDivergence divergence : divergences) {
            events.publish(MmEventTypes.INVENTORY_DIVERGENCE, divergence.marketId(), divergence);
        }
    }

    /**
     * Sides we believe are resting but the venue no longer lists. Reported only; the next status poll settles
     * their state.
     */
    int detectPhantomOrders() {
        Set<String> openIds = venue.getOpenOrderIds();
        int phantoms = 0;
        for (QuotePair pair : activeQuotes.values()) {
            for (QuoteSide side : QuoteSide.values()) {
                String orderId = pair.orderId(side);
                if (orderId != null && pair.state(side) == OrderState.LIVE && !openIds.contains(orderId)) {
                    log.warn("phantom {} on {}: {}", side, pair.getMarketId(), orderId);
                    phantoms++;
                }
            }
        }
        return phantoms;
    }

    private Map<String, Object> statusFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("mm_cycle", cycle);
        fields.put("mm_active_markets", activeQuotes.size());
        fields.put("mm_total_exposure", TickMath.round2(ledger.totalExposure()));
        fields.put("mm_realized_pnl", TickMath.round4(ledger.totalRealizedPnl()));
        fields.put("mm_last_cycle", clock.instant().toString());
        return fields;
    }

    private QuoteRecord toRecord(QuotePair pair, double mid) {
        Instant now = clock.instant();
        boolean hasBid = pair.getBidOrderId() != null;
        boolean hasAsk = pair.getAskOrderId() != null;
        return new QuoteRecord(null, pair.getMarketId(), pair.getTokenId(), pair.getBidOrderId(), pair.getAskOrderId(),
                hasBid ? pair.getBidPrice() : null, hasAsk ? pair.getAskPrice() : null, mid,
                Math.max(hasBid ? pair.getBidSize() : 0.0, hasAsk ? pair.getAskSize() : 0.0),
                QuoteRecord.ACTIVE, now, now);
    }

    private void publishViews() {
        views = activeQuotes.values().stream().map(ActiveQuoteView::of).toList();
    }

    private static boolean hasOpenSide(QuotePair pair, QuoteSide side) {
        return pair.orderId(side) != null && pair.state(side).isOpen();
    }

    private static double openBidCost(QuotePair pair) {
        return hasOpenSide(pair, QuoteSide.BID) ? pair.getBidSize() * pair.getBidPrice() : 0.0;
    }

    private static Map<String, MarketRef> byId(List<MarketRef> markets) {
        Map<String, MarketRef> byId = new LinkedHashMap<>();
        markets.forEach(m -> byId.put(m.marketId(), m));
        return byId;
    }
}
