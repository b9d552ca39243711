package com.tollgate.core.checker;

import com.tollgate.core.model.Severity;

import java.util.Locale;

/**
 * Formats checker recommendations as {@code [SEVERITY] Category: suggestion}.
 */
public final class Recommendations {

    private Recommendations() {}

    public static String of(Severity severity, String category, String suggestion) {
        return "[" + severity.name() + "] " + category + ": " + suggestion;
    }

    static String number(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.format(Locale.ROOT, "%.2f", value);
    }
}
