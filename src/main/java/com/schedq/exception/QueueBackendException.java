package com.schedq.exception;

/**
 * A call into the queue backend failed.
 */
public class QueueBackendException extends RuntimeException {

    public QueueBackendException(String message) {
        super(message);
    }

    public QueueBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
