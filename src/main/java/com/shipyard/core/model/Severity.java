package com.shipyard.core.model;

import java.util.Locale;

/**
 * Vulnerability severity, ordered from least to most severe.
 */
public enum Severity {
    UNKNOWN,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Lenient parse used for scanner output; unrecognised values map to {@link #UNKNOWN}.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
