package com.gridbot.infrastructure.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gridbot.application.ledger.OpenOrder;
import com.gridbot.application.ledger.PersistenceException;
import com.gridbot.application.ledger.SymbolState;
import com.gridbot.application.ports.PositionStore;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.HysteresisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One JSON file per symbol: {@code <dir>/<BASE_QUOTE>.json}.
 *
 * Saves write a temp file in the same directory and rename it over the target with
 * {@code ATOMIC_MOVE}, so a crash leaves either the old record or the new one.
 */
public final class JsonFileStateStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path dir;
    private final ObjectMapper om = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public JsonFileStateStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public Path dir() {
        return dir;
    }

    public Path fileOf(MarketSymbol symbol) {
        return dir.resolve(symbol.key() + ".json");
    }

    @Override
    public Optional<SymbolState> load(MarketSymbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        Path file = fileOf(symbol);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        StateRecord rec;
        try {
            rec = om.readValue(file.toFile(), StateRecord.class);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read state " + file, e);
        }
        try {
            return Optional.of(rec.toState(symbol));
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new PersistenceException("Corrupt state " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(SymbolState state) {
        Objects.requireNonNull(state, "state");
        Path target = fileOf(state.symbol());
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, state.symbol().key() + ".", ".tmp");
            Files.write(tmp, om.writeValueAsBytes(StateRecord.of(state)));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[STATE] atomic move not supported in {}, falling back to replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            PersistenceException failure = new PersistenceException("Cannot write state " + target, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    record StateRecord(@JsonProperty("symbol") String symbol,
                       @JsonProperty("quantity") BigDecimal quantity,
                       @JsonProperty("average_cost") BigDecimal averageCost,
                       @JsonProperty("realized_pnl") BigDecimal realizedPnl,
                       @JsonProperty("fees_paid") BigDecimal feesPaid,
                       @JsonProperty("last_trade_price") BigDecimal lastTradePrice,
                       @JsonProperty("current_band") Integer currentBand,
                       @JsonProperty("applied_tokens") List<String> appliedTokens,
                       @JsonProperty("open_order") OpenOrderRecord openOrder,
                       @JsonProperty("updated_at") String updatedAt) {

        static StateRecord of(SymbolState s) {
            Position p = s.position();
            HysteresisState h = s.hysteresis();
            return new StateRecord(
                    s.symbol().key(),
                    p.quantity(),
                    p.averageCost(),
                    p.realizedPnl(),
                    p.feesPaid(),
                    h.lastTradePrice(),
                    h.currentBand(),
                    s.appliedTokens(),
                    s.openOrder() == null ? null : OpenOrderRecord.of(s.openOrder()),
                    s.updatedAt() == null ? null : s.updatedAt().toString());
        }

        SymbolState toState(MarketSymbol expected) {
            MarketSymbol stored = MarketSymbol.parse(Objects.requireNonNull(symbol, "symbol"));
            if (!stored.equals(expected)) {
                throw new IllegalArgumentException("file holds " + stored + ", expected " + expected);
            }
            BigDecimal qty = quantity == null ? BigDecimal.ZERO : quantity;
            // a flat position carries no average cost even if an older file wrote one
            BigDecimal avg = qty.signum() == 0 ? null : averageCost;
            Position position = new Position(stored, qty, avg, realizedPnl, feesPaid);
            return new SymbolState(
                    stored,
                    position,
                    new HysteresisState(lastTradePrice, currentBand),
                    appliedTokens,
                    openOrder == null ? null : openOrder.toOpenOrder(),
                    updatedAt == null ? null : Instant.parse(updatedAt));
        }
    }

    record OpenOrderRecord(@JsonProperty("client_id") String clientId,
                           @JsonProperty("side") Side side,
                           @JsonProperty("quantity") BigDecimal quantity,
                           @JsonProperty("limit_price") BigDecimal limitPrice,
                           @JsonProperty("decision_price") BigDecimal decisionPrice,
                           @JsonProperty("decision_band") int decisionBand,
                           @JsonProperty("submitted_at") String submittedAt) {

        static OpenOrderRecord of(OpenOrder o) {
            return new OpenOrderRecord(o.clientId(), o.side(), o.quantity(), o.limitPrice(),
                    o.decisionPrice(), o.decisionBand(),
                    o.submittedAt() == null ? null : o.submittedAt().toString());
        }

        OpenOrder toOpenOrder() {
            return new OpenOrder(clientId, side, quantity, limitPrice, decisionPrice, decisionBand,
                    submittedAt == null ? null : Instant.parse(submittedAt));
        }
    }
}
