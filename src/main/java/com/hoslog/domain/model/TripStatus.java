package com.hoslog.domain.model;

public enum TripStatus {
    PLANNED("planned"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed");

    private final String value;

    TripStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TripStatus fromValue(String value) {
        for (TripStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown trip status: " + value);
    }
}
