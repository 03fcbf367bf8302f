package com.nistpubid.core.grammar;

import java.util.regex.Pattern;

/**
 * Lower-case markers that attach qualifiers directly to a document number in short and
 * machine-readable identifiers, e.g. {@code r5} in {@code 800-53r5}.
 *
 * <p>Declaration order is the priority in which the parser tries the markers. Longer markers
 * come before their prefixes ({@code ver} before {@code v}), so a match is never cut short.
 * Render order is {@link #renderOrder()}.
 */
public enum CompactMarker {

    /** Version, always unambiguous */
    VERSION("ver", "\\d+"),

    /** Volume in series with volumes, version in all others */
    VOLUME("v", "\\d+"),

    /** Part label */
    PART("pt", "[0-9A-Z]+"),

    /** Revision */
    REVISION("r", "\\d+"),

    /** Edition */
    EDITION("e", "\\d+");

    private static final CompactMarker[] RENDER_ORDER = {VOLUME, PART, VERSION, REVISION, EDITION};

    private final String marker;
    private final Pattern pattern;

    CompactMarker(String marker, String valuePattern) {
        this.marker = marker;
        this.pattern = Pattern.compile("^" + marker + "(" + valuePattern + ")");
    }

    public String marker() {
        return marker;
    }

    /**
     * Returns the pattern matching this marker and its value at the start of the input.
     * Group 1 holds the value.
     *
     * @return anchored marker pattern
     */
    public Pattern pattern() {
        return pattern;
    }

    /**
     * Returns the markers in the order they are written after a document number.
     *
     * @return markers in render order
     */
    public static CompactMarker[] renderOrder() {
        return RENDER_ORDER.clone();
    }
}
