package com.jobflow.broker;

import java.time.Instant;
import java.util.Objects;

import org.json.JSONObject;

/**
 * Repeat rule of a recurring job: a 5-field cron pattern plus optional bounds.
 */
public final class RepeatOptions {

    public static final String DEFAULT_TIMEZONE = "UTC";

    private final String pattern;
    private final String timezone;
    private final Instant startDate;
    private final Instant endDate;
    private final Integer limit;

    private RepeatOptions(Builder builder) {
        this.pattern = Objects.requireNonNull(builder.pattern, "pattern");
        this.timezone = builder.timezone != null ? builder.timezone : DEFAULT_TIMEZONE;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.limit = builder.limit;
    }

    public static RepeatOptions cron(String pattern) {
        return builder(pattern).build();
    }

    public static Builder builder(String pattern) {
        return new Builder(pattern);
    }

    public String getPattern() {
        return pattern;
    }

    public String getTimezone() {
        return timezone;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public Integer getLimit() {
        return limit;
    }

    JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("pattern", pattern);
        json.put("tz", timezone);
        if (startDate != null) {
            json.put("startDate", startDate.toEpochMilli());
        }
        if (endDate != null) {
            json.put("endDate", endDate.toEpochMilli());
        }
        if (limit != null) {
            json.put("limit", limit);
        }
        return json;
    }

    static RepeatOptions fromJson(JSONObject json) {
        Builder builder = builder(json.getString("pattern")).timezone(json.optString("tz", DEFAULT_TIMEZONE));
        if (json.has("startDate")) {
            builder.startDate(Instant.ofEpochMilli(json.getLong("startDate")));
        }
        if (json.has("endDate")) {
            builder.endDate(Instant.ofEpochMilli(json.getLong("endDate")));
        }
        if (json.has("limit")) {
            builder.limit(json.getInt("limit"));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RepeatOptions)) {
            return false;
        }
        RepeatOptions other = (RepeatOptions) o;
        return pattern.equals(other.pattern)
                && timezone.equals(other.timezone)
                && Objects.equals(startDate, other.startDate)
                && Objects.equals(endDate, other.endDate)
                && Objects.equals(limit, other.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, timezone, startDate, endDate, limit);
    }

    @Override
    public String toString() {
        return "RepeatOptions{pattern='" + pattern + "', tz=" + timezone + ", limit=" + limit + "}";
    }

    public static final class Builder {
        private final String pattern;
        private String timezone;
        private Instant startDate;
        private Instant endDate;
        private Integer limit;

        private Builder(String pattern) {
            this.pattern = pattern;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public RepeatOptions build() {
            return new RepeatOptions(this);
        }
    }
}
