package com.schedq.exception;

/**
 * Raised when a lifecycle operation is attempted on a job or schedule whose current status does not permit it.
 */
public class InvalidJobStateException extends IllegalStateException {

    public InvalidJobStateException(String message) {
        super(message);
    }
}
