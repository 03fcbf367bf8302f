package com.nistpubid.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Organizations that issue publication identifiers.
 */
public enum Publisher {
    /** National Institute of Standards and Technology, the current organization */
    NIST("National Institute of Standards and Technology", "Natl. Inst. Stand. Technol."),

    /** National Bureau of Standards, renamed to NIST in 1988 */
    NBS("National Bureau of Standards", "Natl. Bur. Stand.");

    private final String longName;
    private final String abbrevName;

    Publisher(String longName, String abbrevName) {
        this.longName = longName;
        this.abbrevName = abbrevName;
    }

    /**
     * Returns the acronym used in short and machine-readable identifiers.
     *
     * @return publisher code, e.g. {@code NIST}
     */
    public String code() {
        return name();
    }

    public String longName() {
        return longName;
    }

    public String abbrevName() {
        return abbrevName;
    }

    /**
     * Looks up a publisher by its acronym, ignoring case.
     *
     * @param code publisher acronym
     * @return matching publisher, or empty if the code is unknown
     */
    public static Optional<Publisher> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Publisher publisher : values()) {
            if (publisher.name().equals(normalized)) {
                return Optional.of(publisher);
            }
        }
        return Optional.empty();
    }
}
