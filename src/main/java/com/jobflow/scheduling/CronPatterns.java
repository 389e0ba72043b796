package com.jobflow.scheduling;

/**
 * Deterministic per-tenant daily cron patterns.
 *
 * <p>Spreads daily work of many accounts over the day: the minute and hour are derived from
 * {@link String#hashCode()} of the account id, so the same id always maps to the same time and
 * different ids rarely share one. Two ids landing on the same minute is harmless, both run.</p>
 *
 * <pre>{@code
 * String cron = CronPatterns.dailyCronFor(accountId);      // e.g. "37 14 * * *"
 * String early = CronPatterns.dailyCronFor(accountId, 6);  // same minute, six hours later
 * }</pre>
 */
public final class CronPatterns {

    private CronPatterns() {
    }

    public static String dailyCronFor(String id) {
        return dailyCronFor(id, 0);
    }

    /**
     * @param id account or tenant id
     * @param offsetHours hours added to the derived hour, wrapping around midnight
     * @return a 5-field pattern firing once a day
     */
    public static String dailyCronFor(String id, int offsetHours) {
        if (id == null) {
            throw new IllegalArgumentException("Id must not be null");
        }
        return dailyCronForHash(stableHash(id), offsetHours);
    }

    /**
     * Pattern for an already computed hash.
     */
    public static String dailyCronForHash(int hash, int offsetHours) {
        int minute = Math.floorMod(hash, 60);
        int hour = Math.floorMod(Math.floorMod(hash, 24) + offsetHours, 24);
        return minute + " " + hour + " * * *";
    }

    static int stableHash(String id) {
        return id.hashCode();
    }
}
