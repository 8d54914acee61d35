package com.gridbot.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reader for the optional {@code .env} file next to {@code config.properties}.
 *
 * <p>Lines look like {@code KEY=value} with an optional {@code export} prefix. An unquoted value ends
 * at {@code " #"}; a quoted one keeps everything between the quotes. Names in the
 * {@code GRIDBOT_*} form are stored under the property they stand for
 * ({@code GRIDBOT_ORDER_NOTIONAL -> order.notional}) when that property is known; credentials such as
 * {@code BITKUB_API_KEY} keep their own name. Malformed lines are skipped with a warning.
 */
final class DotEnv {

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    private static final Pattern LINE =
            Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_.]*)\\s*=\\s*(.*)$");

    private DotEnv() {
    }

    /**
     * @param knownKeys property names a {@code GRIDBOT_*} entry may stand for
     * @return entries keyed by property name, in file order; empty when the file does not exist
     */
    static Map<String, String> read(Path envFile, Collection<String> knownKeys) throws IOException {
        Map<String, String> out = new LinkedHashMap<>();
        if (envFile == null || !Files.exists(envFile)) return out;

        Map<String, String> byEnvName = new HashMap<>();
        for (String key : knownKeys) {
            byEnvName.put(FileConfigService.toEnvKey(key), key);
        }

        List<String> lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String t = lines.get(i).trim();
            if (t.isEmpty() || t.startsWith("#")) continue;

            Matcher m = LINE.matcher(t);
            if (!m.matches()) {
                log.warn("[CONFIG] {}:{} ignored, expected KEY=value", envFile.getFileName(), i + 1);
                continue;
            }
            String name = m.group(1);
            String key = name;
            if (name.startsWith(FileConfigService.ENV_PREFIX)) {
                key = byEnvName.get(name);
                if (key == null) {
                    log.warn("[CONFIG] {}:{} {} does not match a known setting", envFile.getFileName(), i + 1, name);
                    key = name;
                }
            }
            out.put(key, value(m.group(2)));
        }
        log.debug("[CONFIG] {} entries from {}", out.size(), envFile);
        return out;
    }

    private static String value(String raw) {
        if (raw.length() >= 2) {
            char q = raw.charAt(0);
            if ((q == '"' || q == '\'') && raw.indexOf(q, 1) > 0) {
                return raw.substring(1, raw.indexOf(q, 1));
            }
        }
        int comment = raw.indexOf(" #");
        return (comment >= 0 ? raw.substring(0, comment) : raw).trim();
    }
}
