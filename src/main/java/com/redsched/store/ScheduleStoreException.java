package com.redsched.store;

/**
 * Raised when the shared store cannot complete an operation.
 * Transient from the scheduler's point of view: the next tick retries.
 */
public class ScheduleStoreException extends RuntimeException {

    public ScheduleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
