package com.hoslog.application.service;

import com.hoslog.application.port.in.CommandValidationException;

import java.util.List;

/**
 * Outcome of command validation
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty()
                ? new ValidationResult(true, List.of())
                : new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * Exception carrying the errors, for failing a future
     */
    public CommandValidationException toException() {
        return new CommandValidationException(errors);
    }
}
