package com.jobflow.broker;

import java.util.List;
import java.util.Map;

import com.google.gson.JsonElement;

/**
 * Children of a flow parent split by whether they already completed.
 * Keys have the form {@code <queue>:<jobId>}.
 */
public final class Dependencies {

    private final Map<String, JsonElement> processed;
    private final List<String> unprocessed;

    public Dependencies(Map<String, JsonElement> processed, List<String> unprocessed) {
        this.processed = Map.copyOf(processed);
        this.unprocessed = List.copyOf(unprocessed);
    }

    public Map<String, JsonElement> getProcessed() {
        return processed;
    }

    public List<String> getUnprocessed() {
        return unprocessed;
    }
}
