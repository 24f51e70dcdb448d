package com.hcltech.graphs.engine;

import com.hcltech.graphs.common.IEnvGetter;

/**
 * Engine settings.
 *
 * @param defaultCapacity capacity given to max-flow edges that do not state one
 * @param logSummaries    log a one-line summary of every analysis at info
 */
public record EngineConfig(int defaultCapacity, boolean logSummaries) {
    public static final String DEFAULT_CAPACITY_ENV = "GRAPH_DEFAULT_CAPACITY";
    public static final String LOG_SUMMARIES_ENV = "GRAPH_LOG_SUMMARIES";
    public static final int DEFAULT_CAPACITY = 1;

    public EngineConfig {
        if (defaultCapacity < 1) {
            throw new IllegalArgumentException("defaultCapacity must be positive but was " + defaultCapacity);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_CAPACITY, false);
    }

    public static EngineConfig fromEnv(IEnvGetter env) {
        return new EngineConfig(
                IEnvGetter.getPositiveIntOr(env, DEFAULT_CAPACITY_ENV, DEFAULT_CAPACITY),
                IEnvGetter.getBooleanOr(env, LOG_SUMMARIES_ENV, false));
    }
}
