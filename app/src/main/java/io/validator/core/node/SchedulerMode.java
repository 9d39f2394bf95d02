package io.validator.core.node;

import java.util.Locale;

public enum SchedulerMode {
    /** Re-read committed balances for every batch. */
    NAIVE,
    /** Keep balances in memory and advance them from settlements. */
    EAGER;

    public static SchedulerMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Scheduler mode required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scheduler mode: " + value);
        }
    }
}
