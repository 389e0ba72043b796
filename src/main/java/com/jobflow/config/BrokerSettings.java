package com.jobflow.config;

import java.time.Duration;
import java.util.function.Function;

import com.jobflow.db.Database;

/**
 * Broker and data-store connection settings, read from the environment.
 *
 * <ul>
 *   <li>{@code JOBFLOW_BROKER_URL}: JDBC URL of the broker database (required)</li>
 *   <li>{@code JOBFLOW_BROKER_USER}, {@code JOBFLOW_BROKER_PASSWORD}: credentials, default {@code sa} / empty</li>
 *   <li>{@code JOBFLOW_DATA_URL}: database handed to job handlers, defaults to the broker URL</li>
 *   <li>{@code JOBFLOW_ENV}: {@code development} shortens timeouts to 5 s connect / 10 s command,
 *       otherwise 30 s / 60 s</li>
 * </ul>
 */
public final class BrokerSettings {

    public static final String BROKER_URL = "JOBFLOW_BROKER_URL";
    public static final String BROKER_USER = "JOBFLOW_BROKER_USER";
    public static final String BROKER_PASSWORD = "JOBFLOW_BROKER_PASSWORD";
    public static final String DATA_URL = "JOBFLOW_DATA_URL";
    public static final String ENVIRONMENT = "JOBFLOW_ENV";

    private final String url;
    private final String user;
    private final String password;
    private final String dataUrl;
    private final boolean development;

    private BrokerSettings(String url, String user, String password, String dataUrl, boolean development) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.dataUrl = dataUrl;
        this.development = development;
    }

    public static BrokerSettings fromEnvironment() {
        return from(System::getenv);
    }

    /**
     * @param env variable lookup, returning null for unset variables
     * @throws IllegalStateException if the broker URL is missing
     */
    public static BrokerSettings from(Function<String, String> env) {
        String url = trimToNull(env.apply(BROKER_URL));
        if (url == null) {
            throw new IllegalStateException(BROKER_URL + " is not set");
        }
        String user = trimToNull(env.apply(BROKER_USER));
        String password = env.apply(BROKER_PASSWORD);
        String dataUrl = trimToNull(env.apply(DATA_URL));
        boolean development = "development".equalsIgnoreCase(trimToNull(env.apply(ENVIRONMENT)));

        return new BrokerSettings(url, user != null ? user : "sa", password != null ? password : "",
                dataUrl != null ? dataUrl : url, development);
    }

    public String getUrl() {
        return url;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getDataUrl() {
        return dataUrl;
    }

    public boolean isDevelopment() {
        return development;
    }

    public Duration getConnectTimeout() {
        return development ? Duration.ofSeconds(5) : Duration.ofSeconds(30);
    }

    public Duration getCommandTimeout() {
        return development ? Duration.ofSeconds(10) : Duration.ofSeconds(60);
    }

    public Database openBrokerDatabase() {
        return new Database(url, user, password, Database.DEFAULT_POOL_SIZE, getConnectTimeout(), getCommandTimeout());
    }

    public Database openDataDatabase() {
        return new Database(dataUrl, user, password, Database.DEFAULT_POOL_SIZE, getConnectTimeout(), getCommandTimeout());
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        // password left out
        return "BrokerSettings{url='" + url + "', user='" + user + "', dataUrl='" + dataUrl + "', development="
                + development + "}";
    }
}
