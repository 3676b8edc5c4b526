package com.plotline.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a phase, a batch or a single item. Ordered by severity: a status may only move
 * towards {@link #FAILED} within one run.
 */
public enum ResultStatus {
    SUCCESS(0),
    PARTIAL(1),
    FAILED(2);

    private final int severity;

    ResultStatus(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    /** True for {@link #SUCCESS} and {@link #PARTIAL}: something usable was produced. */
    public boolean isProductive() {
        return this != FAILED;
    }

    /** Returns the more severe of the two statuses; null is treated as {@link #SUCCESS}. */
    public static ResultStatus worse(ResultStatus a, ResultStatus b) {
        ResultStatus left = a != null ? a : SUCCESS;
        ResultStatus right = b != null ? b : SUCCESS;
        return left.severity >= right.severity ? left : right;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResultStatus fromValue(String value) {
        if (value == null || value.isBlank()) return FAILED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FAILED;
        }
    }
}
