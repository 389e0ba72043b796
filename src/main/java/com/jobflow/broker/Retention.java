package com.jobflow.broker;

import java.time.Duration;
import java.util.Objects;

import org.json.JSONObject;

/**
 * How many finished jobs of one state a queue keeps, and for how long.
 *
 * <p>Either bound may be absent: a retention with only a count keeps the newest {@code count}
 * jobs forever, one with only a max age keeps every job younger than the age.</p>
 */
public final class Retention {

    private final Integer count;
    private final Long maxAgeSeconds;

    private Retention(Integer count, Long maxAgeSeconds) {
        if (count != null && count < 0) {
            throw new IllegalArgumentException("Retention count must not be negative: " + count);
        }
        if (maxAgeSeconds != null && maxAgeSeconds < 0) {
            throw new IllegalArgumentException("Retention age must not be negative: " + maxAgeSeconds);
        }
        this.count = count;
        this.maxAgeSeconds = maxAgeSeconds;
    }

    public static Retention keepLast(int count, Duration maxAge) {
        return new Retention(count, maxAge.getSeconds());
    }

    public static Retention keepLast(int count) {
        return new Retention(count, null);
    }

    public static Retention maxAge(Duration maxAge) {
        return new Retention(null, maxAge.getSeconds());
    }

    public Integer getCount() {
        return count;
    }

    public Long getMaxAgeSeconds() {
        return maxAgeSeconds;
    }

    JSONObject toJson() {
        JSONObject json = new JSONObject();
        if (count != null) {
            json.put("count", count);
        }
        if (maxAgeSeconds != null) {
            json.put("age", maxAgeSeconds);
        }
        return json;
    }

    static Retention fromJson(JSONObject json) {
        Integer count = json.has("count") ? json.getInt("count") : null;
        Long age = json.has("age") ? json.getLong("age") : null;
        return new Retention(count, age);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Retention)) {
            return false;
        }
        Retention other = (Retention) o;
        return Objects.equals(count, other.count) && Objects.equals(maxAgeSeconds, other.maxAgeSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, maxAgeSeconds);
    }

    @Override
    public String toString() {
        return "Retention{count=" + count + ", age=" + maxAgeSeconds + "s}";
    }
}
