package com.gridbot.cli.bootstrap;

import com.gridbot.application.config.SymbolSettings;
import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.exchange.ExchangeClient;
import com.gridbot.application.execution.impl.DefaultJobScheduler;
import com.gridbot.application.ledger.PositionLedger;
import com.gridbot.application.metrics.TradingMetrics;
import com.gridbot.application.paper.PaperExchangeClient;
import com.gridbot.application.paper.PaperExecutionModel;
import com.gridbot.application.ports.ConfigPort;
import com.gridbot.application.service.SessionService;
import com.gridbot.application.service.TradeLoopFactory;
import com.gridbot.application.usecase.TradeLoop;
import com.gridbot.domain.portfolio.Position;
import com.gridbot.infrastructure.exchange.BitkubExchangeClient;
import com.gridbot.infrastructure.state.JsonFileStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires config -> exchange -> ledger -> trade loops -> sessions.
 */
public final class Bootstrap {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    /** Paper state lives apart from live state so a dry run never touches the real position. */
    static final String PAPER_STATE_SUBDIR = "paper";

    private Bootstrap() {
    }

    public static GridBotRuntime createRuntime(ConfigPort config) {
        return createRuntime(config, Clock.systemUTC());
    }

    public static GridBotRuntime createRuntime(ConfigPort config, Clock clock) {
        TradingConfig trading = TradingConfig.from(config);
        TradingMetrics metrics = new TradingMetrics(new SimpleMeterRegistry());

        Path stateDir = Path.of(trading.stateDir());
        if (trading.dryRun()) stateDir = stateDir.resolve(PAPER_STATE_SUBDIR);
        PositionLedger ledger = new PositionLedger(new JsonFileStateStore(stateDir), clock);
        for (SymbolSettings s : trading.symbols()) {
            ledger.load(s.symbol());
        }

        BitkubExchangeClient bitkub = BitkubExchangeClient.fromConfig(config, metrics, clock);
        ExchangeClient exchange = trading.dryRun() ? paperOver(bitkub, trading, ledger, clock) : bitkub;

        TradeLoopFactory factory = new TradeLoopFactory(trading, metrics, clock);
        List<TradeLoop> loops = new ArrayList<>();
        for (SymbolSettings s : trading.symbols()) {
            loops.add(factory.create(s, exchange, ledger));
            log.info("[GRID] {} lines={} range=[{} .. {}] notional={} minMove={}%",
                    s.symbol(), s.grid().lines().size(), s.grid().lower(), s.grid().upper(),
                    s.grid().orderNotional(), s.minMovePct().movePointRight(2).stripTrailingZeros().toPlainString());
        }

        DefaultJobScheduler scheduler = new DefaultJobScheduler(trading.symbols().size());
        SessionService sessions = new SessionService(scheduler);
        log.info("Exchange={} dryRun={} strategy={} state={} refresh={}s", exchange.id(), trading.dryRun(),
                trading.strategy().type(), stateDir.toAbsolutePath(), trading.refresh().toSeconds());
        return new GridBotRuntime(trading, exchange, loops, sessions, scheduler, metrics);
    }

    /**
     * Real Bitkub prices, simulated fills and balances. The paper wallet is rebuilt from the loaded
     * paper ledger so a restarted dry run can still sell what it bought: the base balance is the
     * held quantity and the quote balance is the initial amount less the cost of the open position,
     * plus realized P&amp;L, less fees.
     */
    static PaperExchangeClient paperOver(BitkubExchangeClient prices, TradingConfig trading,
                                         PositionLedger ledger, Clock clock) {
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        for (SymbolSettings s : trading.symbols()) {
            balances.putIfAbsent(s.symbol().quote(), trading.paperInitialQuote());
        }
        for (SymbolSettings s : trading.symbols()) {
            Position p = ledger.position(s.symbol());
            BigDecimal held = p.isOpen() ? p.quantity().multiply(p.averageCost()) : BigDecimal.ZERO;
            BigDecimal net = p.realizedPnl().subtract(p.feesPaid()).subtract(held);
            balances.merge(s.symbol().quote(), net, BigDecimal::add);
            balances.merge(s.symbol().base(), p.quantity(), BigDecimal::add);
        }
        balances.replaceAll((asset, amount) -> amount.signum() < 0 ? BigDecimal.ZERO : amount);
        log.info("[PAPER] wallet {}", balances);
        return new PaperExchangeClient(prices::getPrice,
                new PaperExecutionModel(trading.feeRate(), trading.slippageRate()), balances, clock);
    }
}
