package com.hoslog.application.service;

import com.hoslog.application.port.in.TripUseCase.PlanTripCommand;
import com.hoslog.domain.model.HosPolicy;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates trip planning requests
 */
@RequiredArgsConstructor
public class TripCommandValidator {

    private final HosPolicy policy;

    public ValidationResult validate(PlanTripCommand command) {
        List<String> errors = new ArrayList<>();

        if (isBlank(command.driverId())) {
            errors.add("driverId is required");
        }
        if (isBlank(command.currentLocation())) {
            errors.add("currentLocation is required");
        }
        if (isBlank(command.pickupLocation())) {
            errors.add("pickupLocation is required");
        }
        if (isBlank(command.dropoffLocation())) {
            errors.add("dropoffLocation is required");
        }

        if (command.cycleHoursUsed() == null) {
            errors.add("cycleHoursUsed is required");
        } else if (command.cycleHoursUsed() < 0 || !Double.isFinite(command.cycleHoursUsed())) {
            errors.add("cycleHoursUsed must be a non-negative number");
        } else if (command.cycleHoursUsed() > policy.getCycleLimitHours()) {
            errors.add("cycleHoursUsed cannot exceed the cycle limit of " + policy.getCycleLimitHours() + " hours");
        }

        if (command.distanceMiles() != null && command.distanceMiles() < 0) {
            errors.add("distanceMiles must be non-negative");
        }
        if (command.durationHours() != null && command.durationHours() < 0) {
            errors.add("durationHours must be non-negative");
        }

        return ValidationResult.of(errors);
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
