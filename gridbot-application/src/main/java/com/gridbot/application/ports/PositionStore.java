package com.gridbot.application.ports;

import com.gridbot.application.ledger.PersistenceException;
import com.gridbot.application.ledger.SymbolState;
import com.gridbot.domain.market.MarketSymbol;

import java.util.Optional;

/**
 * Durable per-symbol state. {@link #save} must be atomic with respect to a process crash: a later
 * {@link #load} sees either the previous record or the new one, never a partial write.
 */
public interface PositionStore {

    Optional<SymbolState> load(MarketSymbol symbol) throws PersistenceException;

    void save(SymbolState state) throws PersistenceException;
}
