package com.gridbot.infrastructure.config;

import com.gridbot.application.config.ConfigKey;
import com.gridbot.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties (config dir)
 *  2) .env (config dir, optional)
 *  3) secrets.properties (config dir, optional)
 *  4) OS environment variables (highest priority)
 *
 * Environment overrides apply to every known key: either through the GRIDBOT_* mapping
 * ({@code order.notional -> GRIDBOT_ORDER_NOTIONAL}) or under the key's own name
 * ({@code BITKUB_API_KEY}).
 */
public final class FileConfigService implements ConfigPort {

    private static final Logger log = LoggerFactory.getLogger(FileConfigService.class);

    public static final String ENV_PREFIX = "GRIDBOT_";

    private final Properties props = new Properties();
    private final Path configDir;

    FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = Objects.requireNonNull(configDir, "configDir");
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService load(Path configDir) throws IOException {
        return new FileConfigService(configDir, System.getenv());
    }

    /** {@code ./config} under the working directory. */
    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return load(Path.of(System.getProperty("user.dir")).resolve("config"));
    }

    public Path getConfigDir() {
        return configDir;
    }

    private void loadAll() throws IOException {
        if (!Files.isDirectory(configDir)) {
            log.warn("[CONFIG] config dir {} does not exist, using defaults and environment only", configDir);
            return;
        }

        loadPropsIfExists(configDir.resolve("config.properties"));

        Map<String, String> env = DotEnv.read(configDir.resolve(".env"), knownKeys());
        for (Map.Entry<String, String> e : env.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(configDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (file == null || !Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        log.debug("[CONFIG] loaded {}", file);
    }

    /** Keys already present plus every {@link ConfigKey}. */
    private Set<String> knownKeys() {
        Set<String> known = new LinkedHashSet<>(props.stringPropertyNames());
        for (ConfigKey ck : ConfigKey.values()) {
            known.add(ck.key());
        }
        return known;
    }

    private void applyEnvOverrides(Map<String, String> env) {
        for (String key : knownKeys()) {
            // direct env overrides: BITKUB_API_KEY etc.
            String direct = env.get(key);
            if (direct != null) props.setProperty(key, direct);

            String mapped = env.get(toEnvKey(key));
            if (mapped != null) props.setProperty(key, mapped);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - order.notional        -> GRIDBOT_ORDER_NOTIONAL
     * - hysteresis.minMovePct -> GRIDBOT_HYSTERESIS_MIN_MOVE_PCT
     * - grid.XRP_THB.lower    -> GRIDBOT_GRID_XRP_THB_LOWER
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return ENV_PREFIX + s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = props.getProperty(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] {}={} is not an integer, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] {}={} is not a number, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String getSecret(String key) {
        String v = props.getProperty(key);
        return v == null ? null : v.trim();
    }
}
