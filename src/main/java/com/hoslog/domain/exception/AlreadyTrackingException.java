package com.hoslog.domain.exception;

import com.hoslog.domain.model.DutyStatus;

/**
 * Raised when an activity is started while another one is still open
 */
public class AlreadyTrackingException extends DutyStatusException {

    public AlreadyTrackingException(String driverId, DutyStatus openStatus) {
        super("Driver " + driverId + " already has an open " + openStatus.getLabel() + " activity; stop it first");
    }
}
