package com.nistpubid.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Draft stages a publication passes through before final release.
 */
public enum Stage {
    /** Initial public draft */
    INITIAL_PUBLIC_DRAFT("IPD", "Initial Public Draft"),

    /** Second public draft */
    SECOND_PUBLIC_DRAFT("2PD", "Second Public Draft"),

    /** Third public draft */
    THIRD_PUBLIC_DRAFT("3PD", "Third Public Draft"),

    /** Final public draft */
    FINAL_PUBLIC_DRAFT("FPD", "Final Public Draft"),

    /** Preliminary public draft */
    PRELIMINARY_PUBLIC_DRAFT("PPD", "Preliminary Public Draft"),

    /** Work-in-progress draft */
    WORK_IN_PROGRESS_DRAFT("WD", "Work-in-Progress Draft");

    private final String code;
    private final String displayName;

    Stage(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Returns the stage code used in short and machine-readable identifiers.
     *
     * @return stage code, e.g. {@code IPD}
     */
    public String code() {
        return code;
    }

    /**
     * Returns the phrase used in long and abbreviated identifiers.
     *
     * @return display name, e.g. {@code Initial Public Draft}
     */
    public String displayName() {
        return displayName;
    }

    public static Optional<Stage> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Stage stage : values()) {
            if (stage.code.equals(normalized)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the stage whose display name starts the given text, followed by a space or the end.
     *
     * @param text descriptive text positioned at a possible stage phrase
     * @return matching stage, or empty if none
     */
    public static Optional<Stage> matchDisplayName(String text) {
        for (Stage stage : values()) {
            String name = stage.displayName;
            if (text.startsWith(name)
                && (text.length() == name.length() || text.charAt(name.length()) == ' ')) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
