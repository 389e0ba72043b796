package com.jobflow.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Worker process settings, read from the environment.
 *
 * <ul>
 *   <li>{@code JOBFLOW_DEBUG}: {@code true} switches logging to FINE</li>
 *   <li>{@code JOBFLOW_HEALTH_PORT}: port of the health server, default 8080, 0 disables it</li>
 *   <li>{@code JOBFLOW_QUEUE_CONCURRENCY}: per-queue concurrency overrides, e.g. {@code email=10,reports=2}</li>
 * </ul>
 */
public final class WorkerSettings {

    public static final String DEBUG = "JOBFLOW_DEBUG";
    public static final String HEALTH_PORT = "JOBFLOW_HEALTH_PORT";
    public static final String QUEUE_CONCURRENCY = "JOBFLOW_QUEUE_CONCURRENCY";

    public static final int DEFAULT_HEALTH_PORT = 8080;

    private final boolean debug;
    private final int healthPort;
    private final Map<String, Integer> queueConcurrency;

    private WorkerSettings(boolean debug, int healthPort, Map<String, Integer> queueConcurrency) {
        this.debug = debug;
        this.healthPort = healthPort;
        this.queueConcurrency = Map.copyOf(queueConcurrency);
    }

    public static WorkerSettings fromEnvironment() {
        return from(System::getenv);
    }

    /**
     * @param env variable lookup, returning null for unset variables
     * @throws IllegalStateException if a variable has an invalid value
     */
    public static WorkerSettings from(Function<String, String> env) {
        boolean debug = Boolean.parseBoolean(BrokerSettings.trimToNull(env.apply(DEBUG)));

        int healthPort = DEFAULT_HEALTH_PORT;
        String port = BrokerSettings.trimToNull(env.apply(HEALTH_PORT));
        if (port != null) {
            healthPort = parseInt(HEALTH_PORT, port);
            if (healthPort < 0 || healthPort > 65535) {
                throw new IllegalStateException(HEALTH_PORT + " out of range: " + port);
            }
        }

        return new WorkerSettings(debug, healthPort, parseConcurrency(env.apply(QUEUE_CONCURRENCY)));
    }

    static Map<String, Integer> parseConcurrency(String value) {
        Map<String, Integer> overrides = new LinkedHashMap<>();
        if (BrokerSettings.trimToNull(value) == null) {
            return overrides;
        }
        for (String entry : value.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            String[] parts = entry.split("=", 2);
            if (parts.length != 2 || parts[0].isBlank()) {
                throw new IllegalStateException(QUEUE_CONCURRENCY + " entry must look like queue=n: '" + entry + "'");
            }
            int concurrency = parseInt(QUEUE_CONCURRENCY, parts[1].trim());
            if (concurrency < 1) {
                throw new IllegalStateException(QUEUE_CONCURRENCY + " must be at least 1 for queue " + parts[0].trim());
            }
            overrides.put(parts[0].trim(), concurrency);
        }
        return overrides;
    }

    private static int parseInt(String variable, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(variable + " is not a number: '" + value + "'", e);
        }
    }

    public boolean isDebug() {
        return debug;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public boolean isHealthServerEnabled() {
        return healthPort > 0;
    }

    public Map<String, Integer> getQueueConcurrency() {
        return queueConcurrency;
    }

    @Override
    public String toString() {
        return "WorkerSettings{debug=" + debug + ", healthPort=" + healthPort + ", queueConcurrency="
                + queueConcurrency + "}";
    }
}
