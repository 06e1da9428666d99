package com.afttsync.domain.exception;

/**
 * The backing database cannot be reached. Fatal to the running task.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
