package com.hcltech.graphs.common;

import java.util.Map;

/**
 * Source of configuration values, normally the process environment.
 * <p>
 * Code reads settings through this instead of calling {@link System#getenv(String)} directly,
 * so tests can hand in a map or a mock.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the raw value, or {@code null} if unset.
     */
    String get(String name);

    static IEnvGetter fromMap(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return copy::get;
    }

    /**
     * Returns the value of the variable, throwing if missing or blank.
     */
    static String getString(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return value;
    }

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    /**
     * Only the case-insensitive string "true" is considered true; everything else is false.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }

    /**
     * Like {@link #getIntOr} but the result, including a set value, must be at least 1.
     */
    static int getPositiveIntOr(IEnvGetter env, String name, int defaultValue) {
        int value = getIntOr(env, name, defaultValue);
        if (value < 1) {
            throw new IllegalStateException("Environment variable " + name + " must be positive but was " + value);
        }
        return value;
    }
}
