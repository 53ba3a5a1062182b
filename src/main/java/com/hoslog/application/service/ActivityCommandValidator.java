package com.hoslog.application.service;

import com.hoslog.application.port.in.ActivityTrackingUseCase.StartActivityCommand;
import com.hoslog.application.port.in.ActivityTrackingUseCase.StopActivityCommand;
import com.hoslog.domain.model.DutyStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates start and stop requests before they reach the ledger
 */
public class ActivityCommandValidator {

    private static final int MAX_LOCATION_LENGTH = 200;
    private static final int MAX_NOTES_LENGTH = 500;

    public ValidationResult validate(StartActivityCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.driverId())) {
            errors.add("driverId is required");
        }
        if (isBlank(command.status())) {
            errors.add("status is required");
        } else if (!DutyStatus.isValid(command.status())) {
            errors.add("status must be one of: OFFDUTY, SLEEPER, DRIVING, ONDUTY");
        }
        if (command.location() != null && command.location().length() > MAX_LOCATION_LENGTH) {
            errors.add("location exceeds maximum length of " + MAX_LOCATION_LENGTH + " characters");
        }
        if (command.notes() != null && command.notes().length() > MAX_NOTES_LENGTH) {
            errors.add("notes exceed maximum length of " + MAX_NOTES_LENGTH + " characters");
        }

        return ValidationResult.of(errors);
    }

    public ValidationResult validate(StopActivityCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.driverId())) {
            errors.add("driverId is required");
        }
        if (command.odometer() != null && (command.odometer() < 0 || !Double.isFinite(command.odometer()))) {
            errors.add("odometer must be a non-negative number");
        }
        if (command.engineHours() != null && (command.engineHours() < 0 || !Double.isFinite(command.engineHours()))) {
            errors.add("engineHours must be a non-negative number");
        }

        return ValidationResult.of(errors);
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
