package com.arbiter.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Ordered severity scale. Declaration order is the rank used for
 * severity-proximity scoring, so new levels must be inserted in place.
 */
public enum ViolationSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    ViolationSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int rank() {
        return ordinal();
    }

    /** Number of rank steps between this severity and {@code other}. */
    public int distanceTo(ViolationSeverity other) {
        return Math.abs(rank() - other.rank());
    }

    public static int maxDistance() {
        return values().length - 1;
    }

    @JsonCreator
    public static ViolationSeverity fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown violation severity: " + raw));
    }
}
