package com.nistpubid.core.parser;

import com.nistpubid.core.PubId;
import com.nistpubid.core.exception.MalformedDocNumberException;
import com.nistpubid.core.exception.UnknownSeriesException;
import com.nistpubid.core.grammar.Vocabulary;
import com.nistpubid.core.model.DocNumber;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.model.Stage;
import com.nistpubid.core.model.Update;
import com.nistpubid.core.series.SeriesEntry;
import com.nistpubid.core.series.SeriesMatch;
import com.nistpubid.core.series.SeriesRegistry;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar of the long and abbreviated forms, e.g.
 * {@code Addendum to National Institute of Standards and Technology Special Publication 800-38A}
 * or {@code Natl. Inst. Stand. Technol. Spec. Publ. Initial Public Draft 800-53 Ed. 5}.
 *
 * <p>The wording (long or abbreviated) is taken from the publisher name, or from the series
 * title when the title names the publisher itself. Qualifier clauses must then appear in
 * canonical order using that wording.
 */
final class DescriptiveGrammar {

    private static final Map<Vocabulary, Pattern> ADDENDUM_PREFIXES = new EnumMap<>(Vocabulary.class);
    private static final Map<Vocabulary, Pattern> TAILS = new EnumMap<>(Vocabulary.class);

    static {
        for (Vocabulary vocabulary : Vocabulary.values()) {
            ADDENDUM_PREFIXES.put(vocabulary,
                Pattern.compile("^" + Pattern.quote(vocabulary.addendum()) + "(?: (\\d+))? to (.+)$"));
            TAILS.put(vocabulary, Pattern.compile(
                "(?<doc>" + DocNumber.PATTERN.pattern() + ")"
                    + "(?:" + Pattern.quote(vocabulary.volumeClause()) + "(?<volume>\\d+))?"
                    + "(?:" + Pattern.quote(vocabulary.partClause()) + "(?<part>[0-9A-Z]+))?"
                    + "(?:" + Pattern.quote(vocabulary.versionClause()) + "(?<version>\\d+))?"
                    + "(?:" + Pattern.quote(vocabulary.revisionClause()) + "(?<revision>\\d+)"
                    + "|" + Pattern.quote(vocabulary.editionClause()) + "(?<edition>\\d+))?"
                    + "(?:" + Pattern.quote(vocabulary.updateClause()) + "(?<update>\\d+)"
                    + "(?::(?<date>\\d{4}(?:\\d{2}){0,2}))?)?"
                    + "(?: \\((?<lang>[A-Z]{2,3})\\))?"));
        }
    }

    private final SeriesRegistry registry;

    DescriptiveGrammar(SeriesRegistry registry) {
        this.registry = registry;
    }

    /**
     * Checks whether the text opens with a series title that names its own publisher, such as
     * {@code NIST Cybersecurity White Paper}. Such text starts with a publisher code but is not
     * in short form.
     *
     * @param text trimmed input
     * @return true if an embedded series title starts the text
     */
    boolean startsWithEmbeddedTitle(String text) {
        return matchEmbeddedTitle(text).isPresent();
    }

    /**
     * Parses a long or abbreviated identifier into a builder.
     *
     * @param input original text, for error messages
     * @return builder with every parsed field set
     */
    PubId.Builder parse(String input) {
        PubId.Builder builder = PubId.builder().registry(registry);
        String text = input.trim();

        Vocabulary addendumWording = null;
        for (Vocabulary vocabulary : Vocabulary.values()) {
            Matcher addendum = ADDENDUM_PREFIXES.get(vocabulary).matcher(text);
            if (addendum.matches()) {
                builder.addendum(addendum.group(1) != null ? CompactGrammar.parseNumber(input, addendum.group(1)) : 1);
                text = addendum.group(2);
                addendumWording = vocabulary;
                break;
            }
        }

        TitleMatch title = matchPublisherAndSeries(input, text);
        builder.publisher(title.match().publisher()).series(title.match().series());
        List<Vocabulary> vocabularies = title.vocabularies();
        if (addendumWording != null) {
            if (!vocabularies.contains(addendumWording)) {
                throw new MalformedDocNumberException(input,
                    "Addendum prefix '" + addendumWording.addendum() + "' does not match the wording of '" + input + "'");
            }
            vocabularies = List.of(addendumWording);
        }
        String rest = text.substring(title.length());

        Optional<Stage> stage = Stage.matchDisplayName(rest);
        if (stage.isPresent()) {
            builder.stage(stage.get());
            rest = rest.substring(Math.min(rest.length(), stage.get().displayName().length() + 1));
        }
        if (rest.isEmpty()) {
            throw new MalformedDocNumberException(input, "Missing document number in '" + input + "'");
        }

        for (Vocabulary vocabulary : vocabularies) {
            Matcher tail = TAILS.get(vocabulary).matcher(rest);
            if (tail.matches()) {
                applyTail(input, tail, builder);
                return builder;
            }
        }
        throw new MalformedDocNumberException(input,
            "Malformed document number or qualifiers '" + rest + "' in '" + input + "'");
    }

    /**
     * Matches the publisher name and series title at the start of the text.
     *
     * @return the match, with the length consumed including any space after the title
     */
    private TitleMatch matchPublisherAndSeries(String input, String text) {
        for (Publisher publisher : Publisher.values()) {
            if (text.startsWith(publisher.longName() + " ")) {
                return matchSeriesTitle(input, text, publisher, Vocabulary.LONG, publisher.longName().length() + 1);
            }
            if (text.startsWith(publisher.abbrevName() + " ")) {
                return matchSeriesTitle(input, text, publisher, Vocabulary.ABBREV, publisher.abbrevName().length() + 1);
            }
        }
        return matchEmbeddedTitle(text)
            .orElseThrow(() -> new UnknownSeriesException(input, "Unrecognized publisher or series in '" + input + "'"));
    }

    private TitleMatch matchSeriesTitle(String input, String text, Publisher publisher, Vocabulary vocabulary, int offset) {
        String rest = text.substring(offset);
        for (int end = rest.length(); end > 0; end = rest.lastIndexOf(' ', end - 1)) {
            String candidate = rest.substring(0, end);
            Optional<SeriesEntry> series = vocabulary == Vocabulary.LONG
                ? registry.findByLongTitle(publisher, candidate)
                : registry.findByAbbrevTitle(publisher, candidate);
            if (series.isPresent()) {
                return new TitleMatch(new SeriesMatch(publisher, series.get()),
                    offset + consumed(rest, end), List.of(vocabulary));
            }
        }
        throw new UnknownSeriesException(input, "Unknown series title for " + publisher + " in '" + input + "'");
    }

    private Optional<TitleMatch> matchEmbeddedTitle(String text) {
        for (int end = text.length(); end > 0; end = text.lastIndexOf(' ', end - 1)) {
            String candidate = text.substring(0, end);
            Optional<SeriesMatch> match = registry.findEmbeddedTitle(candidate);
            if (match.isPresent()) {
                SeriesEntry series = match.get().series();
                List<Vocabulary> vocabularies;
                if (series.longTitle().equals(series.abbrevTitle())) {
                    vocabularies = List.of(Vocabulary.LONG, Vocabulary.ABBREV);
                } else if (candidate.equals(series.longTitle())) {
                    vocabularies = List.of(Vocabulary.LONG);
                } else {
                    vocabularies = List.of(Vocabulary.ABBREV);
                }
                return Optional.of(new TitleMatch(match.get(), consumed(text, end), vocabularies));
            }
        }
        return Optional.empty();
    }

    /**
     * Length of a title ending at {@code end}, plus the space that follows it unless the title
     * runs to the end of the text.
     */
    private static int consumed(String text, int end) {
        return end < text.length() ? end + 1 : end;
    }

    private static void applyTail(String input, Matcher tail, PubId.Builder builder) {
        builder.docNumber(tail.group("doc"));
        if (tail.group("volume") != null) {
            builder.volume(CompactGrammar.parseNumber(input, tail.group("volume")));
        }
        if (tail.group("part") != null) {
            builder.part(tail.group("part"));
        }
        if (tail.group("version") != null) {
            builder.version(CompactGrammar.parseNumber(input, tail.group("version")));
        }
        if (tail.group("revision") != null) {
            builder.revision(CompactGrammar.parseNumber(input, tail.group("revision")));
        }
        if (tail.group("edition") != null) {
            builder.edition(CompactGrammar.parseNumber(input, tail.group("edition")));
        }
        if (tail.group("update") != null) {
            builder.update(Update.of(CompactGrammar.parseNumber(input, tail.group("update")), tail.group("date")));
        }
        String lang = tail.group("lang");
        if (lang != null) {
            if (Stage.fromCode(lang).isPresent()) {
                throw new MalformedDocNumberException(input,
                    "Draft stage '" + lang + "' must be spelled out before the document number in '" + input + "'");
            }
            builder.translation(lang);
        }
    }

    /**
     * Publisher and series found at the start of descriptive text.
     *
     * @param match resolved publisher and series
     * @param length characters consumed, including any space after the series title
     * @param vocabularies wordings to try for the qualifier clauses, in order
     */
    private record TitleMatch(SeriesMatch match, int length, List<Vocabulary> vocabularies) {}
}
