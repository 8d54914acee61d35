package com.gridbot.application.ledger;

import com.gridbot.application.ports.PositionStore;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.portfolio.Fill;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.HysteresisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-symbol position and cost ledger.
 *
 * <p>Every mutation is written to the {@link PositionStore} before the in-memory copy changes and
 * before the call returns. If the write fails the in-memory state stays as it was and a
 * {@link PersistenceException} propagates.
 *
 * <p>An order is recorded with {@link #markSubmitted} before it is sent and cleared by the fill
 * that settles it (or by {@link #clearOpenOrder}). A crash in between leaves the client id on disk,
 * and the trade loop resolves it against the exchange on restart.
 *
 * <p>Fills of one symbol are serialised by a per-symbol lock; different symbols never contend.
 */
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    /** Number of recent fill tokens remembered per symbol for duplicate detection. */
    static final int TOKEN_WINDOW = 64;

    private final PositionStore store;
    private final Clock clock;
    private final Map<MarketSymbol, SymbolState> states = new ConcurrentHashMap<>();
    private final Map<MarketSymbol, ReentrantLock> locks = new ConcurrentHashMap<>();

    public PositionLedger(PositionStore store) {
        this(store, Clock.systemUTC());
    }

    public PositionLedger(PositionStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads the persisted record of {@code symbol}, or starts a fresh one. Called once at startup.
     */
    public SymbolState load(MarketSymbol symbol) {
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            SymbolState loaded = store.load(symbol).orElseGet(() -> SymbolState.fresh(symbol));
            states.put(symbol, loaded);
            Position p = loaded.position();
            log.info("[POS] loaded {} qty={} avg_cost={} realized={} last_trade_px={} band={}",
                    symbol, p.quantity(), p.averageCost(), p.realizedPnl(),
                    loaded.hysteresis().lastTradePrice(), loaded.hysteresis().currentBand());
            if (loaded.openOrder() != null) {
                log.warn("[SYNC] {} has unresolved {} order clientId={} from {}", symbol,
                        loaded.openOrder().side(), loaded.openOrder().clientId(), loaded.openOrder().submittedAt());
            }
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    public SymbolState state(MarketSymbol symbol) {
        SymbolState s = states.get(symbol);
        return s != null ? s : load(symbol);
    }

    public Position position(MarketSymbol symbol) {
        return state(symbol).position();
    }

    public HysteresisState hysteresis(MarketSymbol symbol) {
        return state(symbol).hysteresis();
    }

    public Position applyFill(MarketSymbol symbol, Side side, BigDecimal quantity, BigDecimal price) {
        return applyFill(Fill.of(symbol, side, quantity, price));
    }

    public Position applyFill(Fill fill) {
        return mutate(fill, null);
    }

    /**
     * Applies {@code fill} and replaces the hysteresis state in one persisted write.
     */
    public Position recordFill(Fill fill, HysteresisState next) {
        return mutate(fill, Objects.requireNonNull(next, "next"));
    }

    /**
     * Persists {@code order} as the symbol's open order. Must succeed before the order is sent, so a
     * crash after sending still leaves its client id on disk.
     */
    public SymbolState markSubmitted(MarketSymbol symbol, OpenOrder order) {
        Objects.requireNonNull(order, "order");
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            SymbolState current = state(symbol);
            if (current.openOrder() != null && !current.openOrder().clientId().equals(order.clientId())) {
                throw new IllegalStateException(symbol + " already has open order " + current.openOrder().clientId());
            }
            return save(current.withOpenOrder(order, Instant.now(clock)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forgets the open order of {@code symbol} after it was rejected, cancelled without a fill or
     * never reached the exchange. No write when there is none.
     */
    public SymbolState clearOpenOrder(MarketSymbol symbol) {
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            SymbolState current = state(symbol);
            if (current.openOrder() == null) return current;
            return save(current.withOpenOrder(null, Instant.now(clock)));
        } finally {
            lock.unlock();
        }
    }

    public Optional<OpenOrder> openOrder(MarketSymbol symbol) {
        return Optional.ofNullable(state(symbol).openOrder());
    }

    private Position mutate(Fill fill, HysteresisState nextHysteresis) {
        Objects.requireNonNull(fill, "fill");
        MarketSymbol symbol = fill.symbol();
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            SymbolState current = state(symbol);
            if (current.hasApplied(fill.clientId())) {
                log.warn("[POS] duplicate fill ignored for {} clientId={}", symbol, fill.clientId());
                if (settles(current.openOrder(), fill)) {
                    save(current.withOpenOrder(null, Instant.now(clock)));
                }
                return current.position();
            }

            Position before = current.position();
            Position after = fill.side() == Side.BUY
                    ? before.afterBuy(fill.qtyBase(), fill.price(), fill.feeQuote())
                    : before.afterSell(fill.qtyBase(), fill.price(), fill.feeQuote());

            SymbolState next = new SymbolState(
                    symbol,
                    after,
                    nextHysteresis != null ? nextHysteresis : current.hysteresis(),
                    rememberToken(current.appliedTokens(), fill.clientId()),
                    settles(current.openOrder(), fill) ? null : current.openOrder(),
                    Instant.now(clock));

            save(next);
            return after;
        } finally {
            lock.unlock();
        }
    }

    private SymbolState save(SymbolState next) {
        store.save(next);
        states.put(next.symbol(), next);
        return next;
    }

    private static boolean settles(OpenOrder open, Fill fill) {
        return open != null && open.clientId().equals(fill.clientId());
    }

    private static List<String> rememberToken(List<String> tokens, String token) {
        if (token == null) return tokens;
        List<String> out = new ArrayList<>(tokens);
        out.add(token);
        while (out.size() > TOKEN_WINDOW) {
            out.remove(0);
        }
        return out;
    }

    private ReentrantLock lockFor(MarketSymbol symbol) {
        return locks.computeIfAbsent(symbol, s -> new ReentrantLock());
    }
}
