package org.ansi4j.sauce;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * CCYYMMDD date helpers for the record's date field.
 */
public final class SauceDates {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd");

    private SauceDates() {
    }

    /**
     * True for exactly eight digits naming a real calendar date in years 1900..9999.
     */
    public static boolean isValid(String date) {
        if (date == null || date.length() != 8) {
            return false;
        }
        for (int i = 0; i < 8; i++) {
            char c = date.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        int y = Integer.parseInt(date.substring(0, 4));
        int m = Integer.parseInt(date.substring(4, 6));
        int d = Integer.parseInt(date.substring(6, 8));
        if (y < 1900) {
            return false;
        }
        try {
            LocalDate.of(y, m, d);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    public static String format(LocalDate date) {
        return FORMAT.format(date);
    }

    /**
     * Keep only digits, then return the result if it is a valid date, otherwise "".
     */
    static String sanitize(String date) {
        StringBuilder sb = new StringBuilder(date.length());
        for (int i = 0; i < date.length(); i++) {
            char c = date.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        String digits = sb.toString();
        return isValid(digits) ? digits : "";
    }
}
