package com.nistpubid.core.model;

import com.nistpubid.core.exception.InvalidPubIdException;

import java.util.regex.Pattern;

/**
 * A dated post-publication update of a document.
 *
 * @param number update sequence number, non-negative
 * @param date update date as {@code YYYY}, {@code YYYYMM} or {@code YYYYMMDD}; null when undated
 */
public record Update(int number, String date) {

    private static final Pattern DATE_PATTERN = Pattern.compile("\\d{4}(?:\\d{2}){0,2}");

    /**
     * Compact constructor with validation.
     */
    public Update {
        if (number < 0) {
            throw new InvalidPubIdException("update number must not be negative: " + number);
        }
        if (date != null && !DATE_PATTERN.matcher(date).matches()) {
            throw new InvalidPubIdException("update date must be YYYY, YYYYMM or YYYYMMDD: " + date);
        }
    }

    public static Update of(int number, String date) {
        return new Update(number, date);
    }

    public static Update undated(int number) {
        return new Update(number, null);
    }

    public boolean hasDate() {
        return date != null;
    }
}
