package com.jobflow.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

/**
 * JSON conversion of job payloads and handler results.
 *
 * <p>Payloads travel through the broker as JSON text. A single shared {@link Gson} instance is used
 * for every conversion (Gson is thread-safe once built).</p>
 */
public final class Payloads {

    private static final Gson gson = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private Payloads() {
    }

    public static Gson gson() {
        return gson;
    }

    /**
     * Convert any payload (a JSON tree, a map, a record, a bean) into a JSON tree.
     */
    public static JsonElement toTree(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonElement) {
            return (JsonElement) value;
        }
        return gson.toJsonTree(value);
    }

    public static String toJson(Object value) {
        return gson.toJson(toTree(value));
    }

    /**
     * Parse stored JSON text. Null or empty text yields {@link JsonNull}.
     *
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static JsonElement parse(String json) {
        if (json == null || json.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        try {
            return JsonParser.parseString(json);
        } catch (JsonSyntaxException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }

    public static <T> T fromTree(JsonElement tree, Class<T> type) {
        return gson.fromJson(tree, type);
    }
}
