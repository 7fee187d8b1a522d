package info.isaksson.erland.mappinglint.analysis;

import java.util.Locale;

/** Diagnostic severity, most severe first. */
public enum Severity {
    ERROR,
    WARNING,
    INFO;

    /** True when this severity is {@code other} or more severe. */
    public boolean isAtLeast(Severity other) {
        return other != null && ordinal() <= other.ordinal();
    }

    public static Severity parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("severity is empty");
        try {
            return Severity.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: " + text + " (expected error, warning or info)", e);
        }
    }
}
