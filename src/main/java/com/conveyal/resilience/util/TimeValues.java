package com.conveyal.resilience.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Times in input files and configuration are either ISO dates or plain numbers. Dates become days since the epoch,
 * so a daily series has a step of one and durations come out in days.
 */
public abstract class TimeValues {

    public static boolean isDate (String text) {
        try {
            LocalDate.parse(text.trim());
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /** @throws NumberFormatException if the text is neither an ISO date nor a number. */
    public static double parse (String text) {
        String trimmed = text.trim();
        if (isDate(trimmed)) {
            return LocalDate.parse(trimmed).toEpochDay();
        }
        return Double.parseDouble(trimmed);
    }

    public static String format (double time, boolean asDate) {
        if (Double.isNaN(time)) return "";
        if (asDate && time == Math.rint(time)) {
            return LocalDate.ofEpochDay((long) time).toString();
        }
        return formatNumber(time);
    }

    /** Whole numbers without a trailing ".0", everything else as Java prints doubles. NaN is an empty string. */
    public static String formatNumber (double value) {
        if (Double.isNaN(value)) return "";
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
