package com.gridbot.cli;

import com.gridbot.application.config.ConfigValidationResult;
import com.gridbot.application.config.ConfigValidator;
import com.gridbot.application.config.TradingConfig;
import com.gridbot.application.ports.ConfigPort;
import com.gridbot.application.usecase.TradeLoop;
import com.gridbot.cli.bootstrap.Bootstrap;
import com.gridbot.cli.bootstrap.GridBotRuntime;
import com.gridbot.cli.tools.BacktestTool;
import com.gridbot.cli.tools.ConfigDoctor;
import com.gridbot.infrastructure.config.FileConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
    private static final long WAIT_POLL_MS = 1000;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Path configDir = null;
        List<String> rest = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--config".equalsIgnoreCase(a) && i + 1 < args.length) {
                configDir = Path.of(args[++i]);
            } else {
                rest.add(a);
            }
        }

        String cmd = rest.isEmpty() ? "help" : rest.get(0).trim().toLowerCase();
        List<String> tail = rest.isEmpty() ? List.of() : rest.subList(1, rest.size());

        switch (cmd) {
            case "help":
            case "--help":
            case "-h":
                printHelp(out);
                return 0;

            case "validate-config":
            case "doctor": {
                ConfigPort config = loadConfig(configDir, out);
                if (config == null) return ConfigDoctor.PROBLEMS;
                boolean full = "doctor".equals(cmd) || tail.stream().anyMatch("--full"::equalsIgnoreCase);
                boolean json = tail.stream().anyMatch("--json"::equalsIgnoreCase);
                return new ConfigDoctor(out, Clock.systemUTC()).run(config, full, json);
            }

            case "backtest": {
                ConfigPort config = loadConfig(configDir, out);
                if (config == null) return 2;
                Path csv = null;
                String symbol = null;
                for (int i = 0; i < tail.size(); i++) {
                    String t = tail.get(i);
                    if ("--symbol".equalsIgnoreCase(t) && i + 1 < tail.size()) {
                        symbol = tail.get(++i);
                    } else if (csv == null && !t.startsWith("--")) {
                        csv = Path.of(t);
                    }
                }
                TradingConfig trading;
                try {
                    trading = TradingConfig.from(config);
                } catch (IllegalArgumentException e) {
                    out.println("Invalid trading config: " + e.getMessage());
                    return 2;
                }
                return new BacktestTool(out).run(trading, csv, symbol);
            }

            case "run": {
                ConfigPort config = loadConfig(configDir, out);
                if (config == null) return 2;
                return runBot(config, out);
            }

            default:
                out.println("Unknown command: " + cmd);
                printHelp(out);
                return 1;
        }
    }

    private static ConfigPort loadConfig(Path configDir, PrintStream out) {
        try {
            return configDir == null ? FileConfigService.defaultFromWorkingDir() : FileConfigService.load(configDir);
        } catch (IOException e) {
            out.println("Failed to load config: " + e.getMessage());
            return null;
        }
    }

    private static int runBot(ConfigPort config, PrintStream out) {
        ConfigValidationResult res = new ConfigValidator().validate(config);
        for (String w : res.warnings()) {
            log.warn("[CONFIG] {}", w);
        }
        if (!res.isValid()) {
            out.println("Config problems:");
            res.errors().forEach(e -> out.println(" - " + e));
            out.println("Run: java -jar gridbot-cli.jar validate-config");
            return 2;
        }

        GridBotRuntime runtime = Bootstrap.createRuntime(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(runtime), "gridbot-shutdown"));
        runtime.start();

        try {
            while (runtime.isActive()) {
                Thread.sleep(WAIT_POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted, stopping");
        }
        shutdown(runtime);

        boolean halted = false;
        for (TradeLoop loop : runtime.loops()) {
            if (loop.isHalted()) {
                halted = true;
                log.error("{} halted: {}", loop.symbol(), loop.haltReason());
            }
        }
        return halted ? 3 : 0;
    }

    private static void shutdown(GridBotRuntime runtime) {
        try {
            if (!runtime.shutdown(SHUTDOWN_GRACE)) {
                log.warn("Some cycles were still running after {}s", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for cycles to finish");
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Bitkub grid bot");
        out.println("Usage:");
        out.println("  java -jar gridbot-cli.jar [--config DIR] run");
        out.println("  java -jar gridbot-cli.jar [--config DIR] backtest <candles.csv> [--symbol XRP_THB]");
        out.println("  java -jar gridbot-cli.jar [--config DIR] validate-config [--full] [--json]");
        out.println("  java -jar gridbot-cli.jar [--config DIR] doctor [--json]");
        out.println("  java -jar gridbot-cli.jar help");
        out.println();
        out.println("Config is read from ./config (config.properties, .env, secrets.properties),");
        out.println("then GRIDBOT_* and BITKUB_* environment variables.");
        out.println("Exit codes: 0 ok, 1 usage, 2 config problems, 3 a symbol halted.");
    }
}
