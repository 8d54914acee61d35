package com.gridbot.application.ports.impl;

import com.gridbot.application.ledger.SymbolState;
import com.gridbot.application.ports.PositionStore;
import com.gridbot.domain.market.MarketSymbol;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for backtests.
 */
public class InMemoryPositionStore implements PositionStore {

    private final Map<MarketSymbol, SymbolState> records = new ConcurrentHashMap<>();

    @Override
    public Optional<SymbolState> load(MarketSymbol symbol) {
        return Optional.ofNullable(records.get(symbol));
    }

    @Override
    public void save(SymbolState state) {
        records.put(state.symbol(), state);
    }
}
