package com.nistpubid.core.series;

import com.nistpubid.core.model.DocNumber;
import com.nistpubid.core.model.Publisher;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Registry metadata for one document series.
 *
 * @param code canonical short code, e.g. {@code SP} or {@code FIPS PUB}
 * @param publishers publishers that issue documents in this series
 * @param longTitle full descriptive title, e.g. {@code Special Publication}
 * @param abbrevTitle abbreviated title, e.g. {@code Spec. Publ.}
 * @param aliases retired or alternative spellings of {@code code}
 * @param volumes whether documents in this series are split into volumes ({@code v} marks a volume)
 * @param embedsPublisher whether the titles already name the publisher
 * @param docNumberPattern regular expression a document number must match in this series
 */
public record SeriesEntry(
    String code,
    List<Publisher> publishers,
    String longTitle,
    String abbrevTitle,
    List<String> aliases,
    boolean volumes,
    boolean embedsPublisher,
    String docNumberPattern
) {
    /** Pattern used when a series does not narrow the document number grammar. */
    public static final String DEFAULT_DOC_NUMBER_PATTERN = DocNumber.PATTERN.pattern();

    /**
     * Compact constructor with validation.
     */
    public SeriesEntry {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(longTitle, "longTitle must not be null");
        if (publishers == null || publishers.isEmpty()) {
            throw new IllegalArgumentException("Series " + code + " must name at least one publisher");
        }
        publishers = List.copyOf(publishers);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        if (abbrevTitle == null) {
            abbrevTitle = longTitle;
        }
        if (docNumberPattern == null) {
            docNumberPattern = DEFAULT_DOC_NUMBER_PATTERN;
        }
        try {
            Pattern.compile(docNumberPattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(
                "Series " + code + " has an invalid docNumber pattern: " + e.getDescription(), e);
        }
        if (embedsPublisher && publishers.size() != 1) {
            throw new IllegalArgumentException(
                "Series " + code + " embeds its publisher in the title and must have exactly one publisher");
        }
    }

    /**
     * Returns the code as written in machine-readable identifiers, with spaces replaced by dots.
     *
     * @return machine-readable code, e.g. {@code FIPS.PUB}
     */
    public String mrCode() {
        return code.replace(' ', '.');
    }

    public boolean isPublishedBy(Publisher publisher) {
        return publishers.contains(publisher);
    }

    /**
     * Checks a document number against this series' grammar.
     *
     * @param docNumber document number to check
     * @return true if the number is valid in this series
     */
    public boolean acceptsDocNumber(DocNumber docNumber) {
        if (DEFAULT_DOC_NUMBER_PATTERN.equals(docNumberPattern)) {
            return true;
        }
        return docNumber.value().matches(docNumberPattern);
    }
}
