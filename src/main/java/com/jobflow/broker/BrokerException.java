package com.jobflow.broker;

/**
 * Thrown when the broker cannot complete an operation (connection lost, statement failed,
 * lock no longer held).
 *
 * <p>Unchecked so that trigger and scheduler call sites are not forced to handle I/O failures
 * they cannot recover from. The worker loop catches it and backs off.</p>
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
