package com.gridbot.infrastructure.state;

import com.gridbot.application.ledger.OpenOrder;
import com.gridbot.application.ledger.PersistenceException;
import com.gridbot.application.ledger.PositionLedger;
import com.gridbot.application.ledger.SymbolState;
import com.gridbot.domain.market.MarketSymbol;
import com.gridbot.domain.order.Side;
import com.gridbot.domain.portfolio.Fill;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.domain.signal.HysteresisState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileStateStoreTest {

    private static final MarketSymbol XRP = MarketSymbol.parse("XRP_THB");

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsEmpty() {
        assertThat(new JsonFileStateStore(dir).load(XRP)).isEmpty();
    }

    @Test
    void savedRecordReadsBackWithSnakeCaseFields() throws Exception {
        JsonFileStateStore store = new JsonFileStateStore(dir.resolve("state"));
        SymbolState state = new SymbolState(XRP,
                new Position(XRP, new BigDecimal("7.5"), new BigDecimal("19.98"), new BigDecimal("3.25"), new BigDecimal("0.5")),
                new HysteresisState(new BigDecimal("20.10"), 4),
                List.of("a", "b"),
                Instant.parse("2024-01-01T00:00:00Z"));

        store.save(state);

        Path file = dir.resolve("state").resolve("XRP_THB.json");
        String json = Files.readString(file);
        assertThat(json).contains("\"average_cost\"", "\"realized_pnl\"", "\"fees_paid\"",
                "\"last_trade_price\"", "\"current_band\"", "\"applied_tokens\"", "\"updated_at\"");
        assertThat(json).contains("19.98").doesNotContain("E+");

        SymbolState loaded = store.load(XRP).orElseThrow();
        assertThat(loaded.position().quantity()).isEqualByComparingTo("7.5");
        assertThat(loaded.position().averageCost()).isEqualByComparingTo("19.98");
        assertThat(loaded.position().realizedPnl()).isEqualByComparingTo("3.25");
        assertThat(loaded.position().feesPaid()).isEqualByComparingTo("0.5");
        assertThat(loaded.hysteresis().lastTradePrice()).isEqualByComparingTo("20.10");
        assertThat(loaded.hysteresis().currentBand()).isEqualTo(4);
        assertThat(loaded.appliedTokens()).containsExactly("a", "b");
        assertThat(loaded.updatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void flatPositionHasNullAverageCost() {
        JsonFileStateStore store = new JsonFileStateStore(dir);
        store.save(SymbolState.fresh(XRP));

        SymbolState loaded = store.load(XRP).orElseThrow();

        assertThat(loaded.position().isOpen()).isFalse();
        assertThat(loaded.position().averageCost()).isNull();
        assertThat(loaded.hysteresis().hasTraded()).isFalse();
    }

    @Test
    void overwriteLeavesNoTempFiles() throws Exception {
        JsonFileStateStore store = new JsonFileStateStore(dir);
        store.save(SymbolState.fresh(XRP));
        store.save(SymbolState.fresh(XRP));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("XRP_THB.json");
        }
    }

    @Test
    void corruptFileIsAPersistenceFailure() throws Exception {
        Files.writeString(dir.resolve("XRP_THB.json"), "{ not json");

        assertThatThrownBy(() -> new JsonFileStateStore(dir).load(XRP))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("XRP_THB.json");
    }

    @Test
    void negativeQuantityOnDiskIsRejected() throws Exception {
        Files.writeString(dir.resolve("XRP_THB.json"),
                "{\"symbol\":\"XRP_THB\",\"quantity\":-1,\"average_cost\":10}");

        assertThatThrownBy(() -> new JsonFileStateStore(dir).load(XRP))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("Corrupt");
    }

    @Test
    void zeroLastTradePriceOnDiskIsRejected() throws Exception {
        Files.writeString(dir.resolve("XRP_THB.json"),
                "{\"symbol\":\"XRP_THB\",\"quantity\":0,\"last_trade_price\":0,\"current_band\":1}");

        assertThatThrownBy(() -> new JsonFileStateStore(dir).load(XRP))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("Corrupt");
    }

    @Test
    void openOrderSurvivesRestart() throws Exception {
        JsonFileStateStore store = new JsonFileStateStore(dir);
        OpenOrder order = new OpenOrder("gb-1", Side.SELL, new BigDecimal("0.5"), new BigDecimal("104.9"),
                new BigDecimal("105"), 2, Instant.parse("2024-01-01T00:00:05Z"));
        store.save(SymbolState.fresh(XRP).withOpenOrder(order, Instant.parse("2024-01-01T00:00:05Z")));

        assertThat(Files.readString(dir.resolve("XRP_THB.json")))
                .contains("\"open_order\"", "\"client_id\"", "\"decision_band\"");

        SymbolState loaded = new JsonFileStateStore(dir).load(XRP).orElseThrow();
        assertThat(loaded.openOrder()).isEqualTo(order);
    }

    @Test
    void recordOfAnotherSymbolIsRejected() throws Exception {
        Files.writeString(dir.resolve("XRP_THB.json"), "{\"symbol\":\"BTC_THB\",\"quantity\":0}");

        assertThatThrownBy(() -> new JsonFileStateStore(dir).load(XRP))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void writeFailureIsAPersistenceFailure() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "regular file where a directory should be");

        assertThatThrownBy(() -> new JsonFileStateStore(blocker.resolve("state")).save(SymbolState.fresh(XRP)))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void ledgerRecoversPositionAndHysteresisAfterRestart() {
        PositionLedger first = new PositionLedger(new JsonFileStateStore(dir));
        first.load(XRP);
        first.recordFill(new Fill(XRP, Side.BUY, new BigDecimal("10"), new BigDecimal("90"), BigDecimal.ZERO, "t1", null),
                new HysteresisState(new BigDecimal("90"), 0));
        first.recordFill(new Fill(XRP, Side.BUY, new BigDecimal("10"), new BigDecimal("110"), BigDecimal.ZERO, "t2", null),
                new HysteresisState(new BigDecimal("110"), 2));

        PositionLedger restarted = new PositionLedger(new JsonFileStateStore(dir));
        SymbolState recovered = restarted.load(XRP);

        assertThat(recovered.position().quantity()).isEqualByComparingTo("20");
        assertThat(recovered.position().averageCost()).isEqualByComparingTo("100");
        assertThat(recovered.hysteresis().currentBand()).isEqualTo(2);
        assertThat(recovered.appliedTokens()).containsExactly("t1", "t2");

        // replaying an already applied fill changes nothing
        restarted.recordFill(new Fill(XRP, Side.BUY, new BigDecimal("10"), new BigDecimal("110"), BigDecimal.ZERO, "t2", null),
                new HysteresisState(new BigDecimal("110"), 2));
        assertThat(restarted.position(XRP).quantity()).isEqualByComparingTo("20");
    }
}
