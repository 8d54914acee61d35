package com.gridbot.application.ports;

/**
 * Abstraction over configuration and secrets.
 * Infrastructure provides implementation (file/env).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    double getDouble(String key, double defaultValue);

    default boolean getBoolean(String key, boolean defaultValue) {
        String v = get(key, null);
        if (v == null || v.isBlank()) return defaultValue;
        return Boolean.parseBoolean(v.trim());
    }

    /** Returns a secret value (API keys). */
    String getSecret(String key);
}
