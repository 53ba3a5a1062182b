package com.hoslog.domain.exception;

/**
 * Base class for errors raised by the duty-status core.
 * All of them are local and recoverable by the caller.
 */
public abstract class DutyStatusException extends RuntimeException {

    protected DutyStatusException(String message) {
        super(message);
    }
}
