package com.hoslog.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hours spent in each duty status. Every status is present, with zero when unused.
 */
public final class DutyStatusTotals {

    private final Map<DutyStatus, Double> hours;

    private DutyStatusTotals(Map<DutyStatus, Double> hours) {
        EnumMap<DutyStatus, Double> copy = new EnumMap<>(DutyStatus.class);
        for (DutyStatus status : DutyStatus.values()) {
            copy.put(status, hours.getOrDefault(status, 0.0));
        }
        this.hours = Collections.unmodifiableMap(copy);
    }

    public static DutyStatusTotals ofHours(Map<DutyStatus, Double> hours) {
        return new DutyStatusTotals(hours);
    }

    public static DutyStatusTotals empty() {
        return new DutyStatusTotals(Map.of());
    }

    public double hours(DutyStatus status) {
        return hours.get(status);
    }

    public double drivingHours() {
        return hours(DutyStatus.DRIVING);
    }

    /**
     * Driving plus on-duty-not-driving
     */
    public double onDutyHours() {
        return hours(DutyStatus.DRIVING) + hours(DutyStatus.ON_DUTY_NOT_DRIVING);
    }

    public double totalHours() {
        double total = 0.0;
        for (double value : hours.values()) {
            total += value;
        }
        return total;
    }

    public Map<DutyStatus, Double> asMap() {
        return hours;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DutyStatusTotals)) {
            return false;
        }
        return hours.equals(((DutyStatusTotals) o).hours);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hours);
    }

    @Override
    public String toString() {
        return "DutyStatusTotals" + hours;
    }
}
