package com.hoslog.domain.exception;

/**
 * Raised by the timeline builder when log records are out of order or overlap
 */
public class UnsortedOrOverlappingInputException extends DutyStatusException {

    public UnsortedOrOverlappingInputException(String message) {
        super(message);
    }
}
