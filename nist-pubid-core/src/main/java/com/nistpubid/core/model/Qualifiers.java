package com.nistpubid.core.model;

import com.nistpubid.core.exception.InvalidPubIdException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The optional qualifiers of a publication identifier.
 *
 * <p>Every field is independently nullable. This is the single qualifier set all four output
 * styles project from, so a qualifier added here has to be handled by each renderer and by the
 * parser grammars.
 *
 * <p>Invariants:
 * <ul>
 *   <li>at most one of {@code revision} and {@code edition}</li>
 *   <li>at most one of {@code addendum} and {@code update}</li>
 *   <li>numeric qualifiers are non-negative, {@code addendum} is at least 1</li>
 *   <li>{@code part} is an upper-case alphanumeric label</li>
 *   <li>{@code translation} is a 2 or 3 letter language code, stored lower-case, and not a draft stage code</li>
 * </ul>
 * The {@code with*} methods replace one field and clear the field it excludes, so they never
 * produce an invalid combination.
 *
 * @param stage draft stage
 * @param volume volume number of a multi-volume report
 * @param part part label
 * @param version version number
 * @param revision revision number
 * @param edition edition number
 * @param addendum addendum sequence number
 * @param update dated update
 * @param translation language code of a translated edition
 */
public record Qualifiers(
    Stage stage,
    Integer volume,
    String part,
    Integer version,
    Integer revision,
    Integer edition,
    Integer addendum,
    Update update,
    String translation
) {

    private static final Pattern PART_PATTERN = Pattern.compile("[0-9A-Z]+");
    private static final Pattern TRANSLATION_PATTERN = Pattern.compile("[a-z]{2,3}");

    private static final Qualifiers NONE =
        new Qualifiers(null, null, null, null, null, null, null, null, null);

    /**
     * Compact constructor with validation.
     */
    public Qualifiers {
        requireNonNegative("volume", volume);
        requireNonNegative("version", version);
        requireNonNegative("revision", revision);
        requireNonNegative("edition", edition);
        if (addendum != null && addendum < 1) {
            throw new InvalidPubIdException("addendum must be at least 1: " + addendum);
        }
        if (revision != null && edition != null) {
            throw new InvalidPubIdException(
                "revision and edition are mutually exclusive (revision " + revision + ", edition " + edition + ")");
        }
        if (addendum != null && update != null) {
            throw new InvalidPubIdException("addendum and update are mutually exclusive");
        }
        if (part != null && !PART_PATTERN.matcher(part).matches()) {
            throw new InvalidPubIdException("part must be an upper-case alphanumeric label: '" + part + "'");
        }
        if (translation != null) {
            translation = translation.toLowerCase(Locale.ROOT);
            if (!TRANSLATION_PATTERN.matcher(translation).matches()) {
                throw new InvalidPubIdException("translation must be a 2 or 3 letter language code: '" + translation + "'");
            }
            if (Stage.fromCode(translation).isPresent()) {
                throw new InvalidPubIdException("translation must not be a draft stage code: '" + translation + "'");
            }
        }
    }

    /**
     * Returns the empty qualifier set.
     *
     * @return qualifiers with every field absent
     */
    public static Qualifiers none() {
        return NONE;
    }

    public boolean isEmpty() {
        return equals(NONE);
    }

    public Qualifiers withStage(Stage stage) {
        return new Qualifiers(stage, volume, part, version, revision, edition, addendum, update, translation);
    }

    public Qualifiers withVolume(Integer volume) {
        return new Qualifiers(stage, volume, part, version, revision, edition, addendum, update, translation);
    }

    public Qualifiers withPart(String part) {
        return new Qualifiers(stage, volume, part, version, revision, edition, addendum, update, translation);
    }

    public Qualifiers withVersion(Integer version) {
        return new Qualifiers(stage, volume, part, version, revision, edition, addendum, update, translation);
    }

    /**
     * Replaces the revision. A non-null revision clears the edition.
     *
     * @param revision new revision, or null to remove it
     * @return updated qualifiers
     */
    public Qualifiers withRevision(Integer revision) {
        Integer keptEdition = revision != null ? null : edition;
        return new Qualifiers(stage, volume, part, version, revision, keptEdition, addendum, update, translation);
    }

    /**
     * Replaces the edition. A non-null edition clears the revision.
     *
     * @param edition new edition, or null to remove it
     * @return updated qualifiers
     */
    public Qualifiers withEdition(Integer edition) {
        Integer keptRevision = edition != null ? null : revision;
        return new Qualifiers(stage, volume, part, version, keptRevision, edition, addendum, update, translation);
    }

    /**
     * Replaces the addendum. A non-null addendum clears the update.
     *
     * @param addendum new addendum number, or null to remove it
     * @return updated qualifiers
     */
    public Qualifiers withAddendum(Integer addendum) {
        Update keptUpdate = addendum != null ? null : update;
        return new Qualifiers(stage, volume, part, version, revision, edition, addendum, keptUpdate, translation);
    }

    /**
     * Replaces the update. A non-null update clears the addendum.
     *
     * @param update new update, or null to remove it
     * @return updated qualifiers
     */
    public Qualifiers withUpdate(Update update) {
        Integer keptAddendum = update != null ? null : addendum;
        return new Qualifiers(stage, volume, part, version, revision, edition, keptAddendum, update, translation);
    }

    public Qualifiers withTranslation(String translation) {
        return new Qualifiers(stage, volume, part, version, revision, edition, addendum, update, translation);
    }

    private static void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new InvalidPubIdException(field + " must not be negative: " + value);
        }
    }
}
