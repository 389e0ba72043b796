package com.jobflow.broker;

/**
 * States a job moves through inside the broker.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>WAITING / DELAYED → ACTIVE: job claimed by a worker (delayed jobs only once due)</li>
 *   <li>WAITING_CHILDREN → WAITING: last child of a flow parent completed</li>
 *   <li>ACTIVE → COMPLETED: handler returned</li>
 *   <li>ACTIVE → DELAYED: handler failed and attempts remain (backoff)</li>
 *   <li>ACTIVE → FAILED: handler failed on its last attempt, or the job stalled too often</li>
 *   <li>ACTIVE → WAITING: lock expired, job recovered as stalled</li>
 *   <li>FAILED → WAITING: manual retry</li>
 * </ul>
 *
 * @see BrokerQueue#getJobCounts()
 */
public enum JobState {
    WAITING("Waiting"),
    DELAYED("Delayed"),
    WAITING_CHILDREN("Waiting for children"),
    ACTIVE("Active"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String displayName;

    JobState(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this state.
     *
     * @return the display name (e.g., "Completed", "Failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Terminal states are subject to retention trimming and are never claimed again
     * (unless explicitly retried).
     *
     * @return true for COMPLETED and FAILED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a worker may claim a job in this state once its process time has passed.
     */
    public boolean isClaimable() {
        return this == WAITING || this == DELAYED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
