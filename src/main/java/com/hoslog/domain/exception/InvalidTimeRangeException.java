package com.hoslog.domain.exception;

public class InvalidTimeRangeException extends DutyStatusException {

    public InvalidTimeRangeException(String message) {
        super(message);
    }
}
