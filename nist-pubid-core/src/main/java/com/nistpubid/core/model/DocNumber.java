package com.nistpubid.core.model;

import com.nistpubid.core.exception.InvalidPubIdException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Primary document number of a publication, e.g. {@code 800-53}, {@code 800-38A} or {@code 1-1C}.
 *
 * <p>A document number starts with a digit and is made of digits, upper-case letters and
 * single dashes. Lower-case letters are reserved for qualifier markers ({@code r5}, {@code pt1}),
 * which keeps the boundary between the number and its suffixes unambiguous. A trailing run of
 * upper-case letters is the sub-series suffix ({@code A} in {@code 800-38A}).
 *
 * <p>Ordering compares digit runs numerically, so {@code 800-9} sorts before {@code 800-53}.
 *
 * @param value document number text, kept verbatim
 */
public record DocNumber(String value) implements Comparable<DocNumber> {

    /** Grammar every document number must match, independent of its series. */
    public static final Pattern PATTERN = Pattern.compile("\\d[0-9A-Z]*(?:-[0-9A-Z]+)*");

    private static final Pattern SUB_SERIES = Pattern.compile("\\d([A-Z]+)$");
    private static final Pattern SEGMENT = Pattern.compile("\\d+|[^\\d]+");

    /**
     * Compact constructor with validation.
     */
    public DocNumber {
        Objects.requireNonNull(value, "value must not be null");
        if (!PATTERN.matcher(value).matches()) {
            throw new InvalidPubIdException("Malformed document number: '" + value + "'");
        }
    }

    public static DocNumber of(String value) {
        return new DocNumber(value);
    }

    /**
     * Returns the trailing letter suffix denoting a sub-series.
     *
     * @return sub-series letters, or an empty string when the number ends in a digit
     */
    public String subSeries() {
        Matcher matcher = SUB_SERIES.matcher(value);
        return matcher.find() ? matcher.group(1) : "";
    }

    @Override
    public int compareTo(DocNumber other) {
        List<String> left = segments(value);
        List<String> right = segments(other.value);
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int result = compareSegment(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    @Override
    public String toString() {
        return value;
    }

    private static List<String> segments(String text) {
        List<String> segments = new ArrayList<>();
        Matcher matcher = SEGMENT.matcher(text);
        while (matcher.find()) {
            segments.add(matcher.group());
        }
        return segments;
    }

    private static int compareSegment(String left, String right) {
        boolean leftNumeric = Character.isDigit(left.charAt(0));
        boolean rightNumeric = Character.isDigit(right.charAt(0));
        if (leftNumeric && rightNumeric) {
            // strip leading zeros, then longer means larger
            String a = left.replaceFirst("^0+(?=\\d)", "");
            String b = right.replaceFirst("^0+(?=\\d)", "");
            if (a.length() != b.length()) {
                return Integer.compare(a.length(), b.length());
            }
            return a.compareTo(b);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }
}
