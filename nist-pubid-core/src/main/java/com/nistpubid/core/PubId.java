package com.nistpubid.core;

import com.nistpubid.core.exception.InvalidPubIdException;
import com.nistpubid.core.exception.PubIdParseException;
import com.nistpubid.core.model.DocNumber;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.model.Qualifiers;
import com.nistpubid.core.model.Stage;
import com.nistpubid.core.model.Update;
import com.nistpubid.core.parser.PubIdParser;
import com.nistpubid.core.renderer.PubIdRenderer;
import com.nistpubid.core.renderer.PubIdStyle;
import com.nistpubid.core.series.SeriesEntry;
import com.nistpubid.core.series.SeriesRegistry;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * A NIST or NBS publication identifier.
 *
 * <p>Publisher, series and document number are fixed once the identifier is built. Qualifiers
 * (revision, edition, part, ...) can be changed in place through the setters; the next call to
 * {@link #toText(PubIdStyle)} reflects the change. Setting a revision clears the edition and
 * vice versa, and setting an addendum clears the update and vice versa.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PubId pubId = PubId.parse("NIST SP 800-53r5");
 * pubId.toText(PubIdStyle.MR);      // NIST.SP.800-53r5
 * pubId.toText(PubIdStyle.LONG);    // National Institute of Standards and Technology Special Publication 800-53, Revision 5
 *
 * pubId.setRevision(6);
 * pubId.toText(PubIdStyle.MR);      // NIST.SP.800-53r6
 *
 * PubId built = PubId.builder()
 *     .publisher(Publisher.NIST)
 *     .series("SP")
 *     .docNumber("800-57")
 *     .part("1")
 *     .revision(4)
 *     .build();
 * }</pre>
 *
 * <p>Instances are not thread-safe; do not mutate one from several threads at once.
 */
public final class PubId implements Comparable<PubId> {

    private static final Comparator<PubId> ORDER = Comparator
        .comparing(PubId::getPublisher)
        .thenComparing(pubId -> pubId.getSeries().code())
        .thenComparing(PubId::getDocNumber)
        .thenComparing(pubId -> pubId.toText(PubIdStyle.MR));

    private final Publisher publisher;
    private final SeriesEntry series;
    private final DocNumber docNumber;
    private Qualifiers qualifiers;

    private PubId(Publisher publisher, SeriesEntry series, DocNumber docNumber, Qualifiers qualifiers) {
        this.publisher = publisher;
        this.series = series;
        this.docNumber = docNumber;
        this.qualifiers = qualifiers;
        requireVolumeSupported(qualifiers);
    }

    /**
     * Parses a PubID in short, machine-readable, long or abbreviated form using the bundled
     * series registry.
     *
     * @param text identifier text
     * @return parsed identifier
     * @throws com.nistpubid.core.exception.UnknownSeriesException if the series cannot be resolved
     * @throws com.nistpubid.core.exception.MalformedDocNumberException if the rest does not parse
     */
    public static PubId parse(String text) throws PubIdParseException {
        return Defaults.PARSER.parse(text);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Renders this identifier in the given style.
     *
     * @param style output style
     * @return identifier text
     */
    public String toText(PubIdStyle style) {
        return Defaults.RENDERER.render(this, style);
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public SeriesEntry getSeries() {
        return series;
    }

    public DocNumber getDocNumber() {
        return docNumber;
    }

    /**
     * Returns a snapshot of the current qualifiers.
     *
     * @return qualifiers
     */
    public Qualifiers getQualifiers() {
        return qualifiers;
    }

    public Stage getStage() {
        return qualifiers.stage();
    }

    public void setStage(Stage stage) {
        qualifiers = qualifiers.withStage(stage);
    }

    public Integer getVolume() {
        return qualifiers.volume();
    }

    /**
     * Sets the volume.
     *
     * @param volume volume number, or null to remove it
     * @throws InvalidPubIdException if the series has no volumes or the number is negative
     */
    public void setVolume(Integer volume) {
        Qualifiers updated = qualifiers.withVolume(volume);
        requireVolumeSupported(updated);
        qualifiers = updated;
    }

    public String getPart() {
        return qualifiers.part();
    }

    public void setPart(String part) {
        qualifiers = qualifiers.withPart(part);
    }

    public Integer getVersion() {
        return qualifiers.version();
    }

    public void setVersion(Integer version) {
        qualifiers = qualifiers.withVersion(version);
    }

    public Integer getRevision() {
        return qualifiers.revision();
    }

    /**
     * Sets the revision and clears any edition.
     *
     * @param revision revision number, or null to remove it
     */
    public void setRevision(Integer revision) {
        qualifiers = qualifiers.withRevision(revision);
    }

    public Integer getEdition() {
        return qualifiers.edition();
    }

    /**
     * Sets the edition and clears any revision.
     *
     * @param edition edition number, or null to remove it
     */
    public void setEdition(Integer edition) {
        qualifiers = qualifiers.withEdition(edition);
    }

    public Integer getAddendum() {
        return qualifiers.addendum();
    }

    public boolean isAddendum() {
        return qualifiers.addendum() != null;
    }

    /**
     * Sets the addendum number and clears any update.
     *
     * @param addendum addendum number starting at 1, or null to remove it
     */
    public void setAddendum(Integer addendum) {
        qualifiers = qualifiers.withAddendum(addendum);
    }

    public Update getUpdate() {
        return qualifiers.update();
    }

    /**
     * Sets the update and clears any addendum.
     *
     * @param update update, or null to remove it
     */
    public void setUpdate(Update update) {
        qualifiers = qualifiers.withUpdate(update);
    }

    public String getTranslation() {
        return qualifiers.translation();
    }

    public void setTranslation(String translation) {
        qualifiers = qualifiers.withTranslation(translation);
    }

    @Override
    public int compareTo(PubId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PubId other = (PubId) o;
        return publisher == other.publisher
            && series.code().equals(other.series.code())
            && docNumber.equals(other.docNumber)
            && qualifiers.equals(other.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(publisher, series.code(), docNumber, qualifiers);
    }

    /**
     * Returns the short form, e.g. {@code NIST SP 800-53r5}.
     */
    @Override
    public String toString() {
        return toText(PubIdStyle.SHORT);
    }

    private void requireVolumeSupported(Qualifiers candidate) {
        if (candidate.volume() != null && !series.volumes()) {
            throw new InvalidPubIdException("Series " + series.code() + " has no volumes");
        }
    }

    /**
     * Builder for {@link PubId}. The series may be given as a registry entry or as a code,
     * optionally prefixed by the publisher ({@code "NIST SP"}); codes are resolved against the
     * bundled registry unless {@link #registry(SeriesRegistry)} supplies another one.
     */
    public static final class Builder {
        private Publisher publisher;
        private SeriesEntry seriesEntry;
        private String seriesCode;
        private String docNumber;
        private SeriesRegistry registry;
        private Stage stage;
        private Integer volume;
        private String part;
        private Integer version;
        private Integer revision;
        private Integer edition;
        private Integer addendum;
        private Update update;
        private String translation;

        private Builder() {
        }

        public Builder publisher(Publisher publisher) {
            this.publisher = publisher;
            return this;
        }

        /**
         * Sets the series by code or legacy alias.
         *
         * @param seriesCode series code such as {@code SP}, {@code FIPS} or {@code NIST SP}
         * @return this builder
         */
        public Builder series(String seriesCode) {
            this.seriesCode = seriesCode;
            this.seriesEntry = null;
            return this;
        }

        public Builder series(SeriesEntry seriesEntry) {
            this.seriesEntry = seriesEntry;
            this.seriesCode = null;
            return this;
        }

        public Builder docNumber(String docNumber) {
            this.docNumber = docNumber;
            return this;
        }

        public Builder registry(SeriesRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder volume(Integer volume) {
            this.volume = volume;
            return this;
        }

        public Builder part(String part) {
            this.part = part;
            return this;
        }

        public Builder version(Integer version) {
            this.version = version;
            return this;
        }

        public Builder revision(Integer revision) {
            this.revision = revision;
            return this;
        }

        public Builder edition(Integer edition) {
            this.edition = edition;
            return this;
        }

        public Builder addendum(Integer addendum) {
            this.addendum = addendum;
            return this;
        }

        public Builder update(Update update) {
            this.update = update;
            return this;
        }

        public Builder translation(String translation) {
            this.translation = translation;
            return this;
        }

        /**
         * Validates the fields and builds the identifier.
         *
         * @return new identifier
         * @throws InvalidPubIdException if a field is missing, the series is unknown for the
         *         publisher, the document number does not fit the series, or qualifiers conflict
         */
        public PubId build() {
            if (publisher == null) {
                throw new InvalidPubIdException("publisher is required");
            }
            if (docNumber == null || docNumber.isBlank()) {
                throw new InvalidPubIdException("docNumber is required");
            }
            SeriesEntry series = resolveSeries();
            DocNumber number = DocNumber.of(docNumber);
            if (!series.acceptsDocNumber(number)) {
                throw new InvalidPubIdException(
                    "Document number '" + docNumber + "' does not match series " + series.code());
            }
            Qualifiers qualifiers = new Qualifiers(
                stage, volume, part, version, revision, edition, addendum, update, translation);
            return new PubId(publisher, series, number, qualifiers);
        }

        private SeriesEntry resolveSeries() {
            if (seriesEntry != null) {
                if (!seriesEntry.isPublishedBy(publisher)) {
                    throw new InvalidPubIdException(
                        "Series " + seriesEntry.code() + " is not published by " + publisher);
                }
                return seriesEntry;
            }
            if (seriesCode == null || seriesCode.isBlank()) {
                throw new InvalidPubIdException("series is required");
            }
            String code = stripPublisherPrefix(seriesCode.trim());
            SeriesRegistry lookup = registry != null ? registry : SeriesRegistry.defaultRegistry();
            return lookup.resolve(publisher, code)
                .orElseThrow(() -> new InvalidPubIdException(
                    "Unknown series '" + seriesCode + "' for publisher " + publisher));
        }

        private String stripPublisherPrefix(String code) {
            String prefix = publisher.code() + " ";
            if (code.toUpperCase(Locale.ROOT).startsWith(prefix)) {
                return code.substring(prefix.length()).trim();
            }
            return code;
        }
    }

    /**
     * Parser and renderer bound to the bundled registry, created on first use.
     */
    private static final class Defaults {
        private static final PubIdParser PARSER = new PubIdParser(SeriesRegistry.defaultRegistry());
        private static final PubIdRenderer RENDERER = new PubIdRenderer();
    }
}
