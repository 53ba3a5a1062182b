package com.hoslog.application.port.in;

import java.util.List;

/**
 * Rejected command, keeping each validation error for the response body
 */
public class CommandValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public CommandValidationException(List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
