package com.jobflow.broker;

import java.util.Objects;

import org.json.JSONObject;

/**
 * Delay strategy between execution attempts of a failed job.
 *
 * <p><b>Exponential:</b> {@code delay * 2^(attemptsMade - 1)}, so with the default 2000ms base the
 * retries run 2s, 4s, 8s ... after each failure.</p>
 * <p><b>Fixed:</b> {@code delay} after every failure.</p>
 */
public final class Backoff {

    public enum Type {
        EXPONENTIAL,
        FIXED
    }

    private final Type type;
    private final long delayMillis;

    private Backoff(Type type, long delayMillis) {
        if (delayMillis < 0) {
            throw new IllegalArgumentException("Backoff delay must not be negative: " + delayMillis);
        }
        this.type = Objects.requireNonNull(type, "type");
        this.delayMillis = delayMillis;
    }

    public static Backoff exponential(long delayMillis) {
        return new Backoff(Type.EXPONENTIAL, delayMillis);
    }

    public static Backoff fixed(long delayMillis) {
        return new Backoff(Type.FIXED, delayMillis);
    }

    public Type getType() {
        return type;
    }

    public long getDelayMillis() {
        return delayMillis;
    }

    /**
     * Delay to wait before the next attempt.
     *
     * @param attemptsMade number of attempts already made, including the one that just failed (1-indexed)
     * @return delay in milliseconds
     */
    public long computeDelay(int attemptsMade) {
        if (type == Type.FIXED) {
            return delayMillis;
        }
        int exponent = Math.max(0, Math.min(attemptsMade - 1, 30));
        return delayMillis * (1L << exponent);
    }

    JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("type", type.name());
        json.put("delay", delayMillis);
        return json;
    }

    static Backoff fromJson(JSONObject json) {
        return new Backoff(Type.valueOf(json.getString("type")), json.getLong("delay"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Backoff)) {
            return false;
        }
        Backoff other = (Backoff) o;
        return type == other.type && delayMillis == other.delayMillis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, delayMillis);
    }

    @Override
    public String toString() {
        return "Backoff{type=" + type + ", delay=" + delayMillis + "ms}";
    }
}
