package com.hoslog.domain.exception;

/**
 * Raised when stop is requested but no activity is open
 */
public class NotTrackingException extends DutyStatusException {

    public NotTrackingException(String driverId) {
        super("Driver " + driverId + " has no open activity to stop");
    }
}
