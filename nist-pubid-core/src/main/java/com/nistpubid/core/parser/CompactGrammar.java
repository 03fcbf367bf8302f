package com.nistpubid.core.parser;

import com.nistpubid.core.PubId;
import com.nistpubid.core.exception.MalformedDocNumberException;
import com.nistpubid.core.exception.UnknownSeriesException;
import com.nistpubid.core.grammar.CompactMarker;
import com.nistpubid.core.model.DocNumber;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.model.Stage;
import com.nistpubid.core.model.Update;
import com.nistpubid.core.series.SeriesEntry;
import com.nistpubid.core.series.SeriesMatch;
import com.nistpubid.core.series.SeriesRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar of the short and machine-readable forms. The two differ only in delimiters and in
 * the spelling of the update and addendum suffixes:
 *
 * <pre>
 * SHORT  NIST SP(IPD) 800-53r4/Upd 3:2015(esp)     NIST SP 800-38A Addendum
 * MR     NIST.SP.IPD.800-53r4.u3-2015(esp)         NIST.SP.800-38A.add-1
 * </pre>
 */
final class CompactGrammar {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DOT = Pattern.compile("\\.");
    private static final Pattern DOC_NUMBER = DocNumber.PATTERN;

    private static final Pattern STAGE_SUFFIX = Pattern.compile("^(.+)\\(([0-9A-Za-z]+)\\)$");
    private static final Pattern GLUED_NUMBER = Pattern.compile("^([A-Za-z][A-Za-z-]*[A-Za-z])(\\d\\S*)$");
    private static final Pattern TRAILING_CODE = Pattern.compile("^(.*)\\(([0-9A-Za-z]+)\\)$");
    private static final Pattern TRANSLATION = Pattern.compile("[a-z]{2,3}");

    private static final String DATE = "\\d{4}(?:\\d{2}){0,2}";
    private static final Pattern SHORT_ADDENDUM = Pattern.compile("^(.*?)\\s+Addendum(?:\\s+(\\d+))?$");
    private static final Pattern SHORT_UPDATE = Pattern.compile("^(.*?)/Upd\\s*(\\d+)(?::(" + DATE + "))?$");
    private static final Pattern MR_ADDENDUM = Pattern.compile("^add-(\\d+)$");
    private static final Pattern MR_UPDATE = Pattern.compile("^u(\\d+)(?:-(" + DATE + "))?$");

    private final SeriesRegistry registry;

    CompactGrammar(SeriesRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parses a short or machine-readable identifier into a builder.
     *
     * @param input original text, for error messages
     * @param style {@link InputStyle#SHORT} or {@link InputStyle#MR}
     * @return builder with every parsed field set
     */
    PubId.Builder parse(String input, InputStyle style) {
        Pattern delimiter = style == InputStyle.MR ? DOT : WHITESPACE;
        List<String> tokens = new ArrayList<>(Arrays.asList(delimiter.split(input.trim(), -1)));

        PubId.Builder builder = PubId.builder().registry(registry);
        SeriesMatch match = resolveSeries(input, tokens, style, builder);
        builder.publisher(match.publisher()).series(match.series());

        if (style == InputStyle.MR && tokens.size() > 1) {
            Optional<Stage> stage = Stage.fromCode(tokens.get(0));
            if (stage.isPresent()) {
                builder.stage(stage.get());
                tokens.remove(0);
            }
        }
        if (tokens.isEmpty()) {
            throw new MalformedDocNumberException(input, "Missing document number in '" + input + "'");
        }

        String remainder = String.join(style == InputStyle.MR ? "." : " ", tokens);
        Matcher trailing = TRAILING_CODE.matcher(remainder);
        if (trailing.matches()) {
            builder.translation(parseTranslation(input, trailing.group(2)));
            remainder = trailing.group(1);
        }

        String main = style == InputStyle.MR
            ? parseMrSuffixes(input, remainder, builder)
            : parseShortSuffixes(input, remainder, builder);
        parseDocNumberAndMarkers(input, main, match.series(), builder);
        return builder;
    }

    /**
     * Consumes the publisher and series tokens from the front of {@code tokens}.
     *
     * <p>Tokens up to the first one starting with a digit are series candidates; the longest
     * run of candidates the registry resolves wins. A series token with a number glued to it
     * ({@code CRPL-F-B150}) is split, and a short-form token ending in {@code (CODE)} carries
     * the draft stage.
     */
    private SeriesMatch resolveSeries(String input, List<String> tokens, InputStyle style, PubId.Builder builder) {
        String head = tokens.remove(0);
        Optional<Publisher> publisher = Publisher.fromCode(head);
        if (publisher.isEmpty()) {
            return registry.resolveCompound(head)
                .orElseThrow(() -> new UnknownSeriesException(input,
                    "Unknown publisher or series '" + head + "' in '" + input + "'"));
        }

        List<String> candidates = new ArrayList<>();
        while (!tokens.isEmpty() && startsWithLetterOrSymbol(tokens.get(0))) {
            String token = tokens.remove(0);
            Matcher glued = GLUED_NUMBER.matcher(token);
            if (glued.matches()) {
                candidates.add(glued.group(1));
                tokens.add(0, glued.group(2));
                break;
            }
            candidates.add(token);
            if (style == InputStyle.SHORT && STAGE_SUFFIX.matcher(token).matches()) {
                break;
            }
        }

        for (int n = candidates.size(); n > 0; n--) {
            List<String> seriesTokens = new ArrayList<>(candidates.subList(0, n));
            String stageCode = null;
            Matcher stageSuffix = STAGE_SUFFIX.matcher(seriesTokens.get(n - 1));
            if (style == InputStyle.SHORT && stageSuffix.matches()) {
                seriesTokens.set(n - 1, stageSuffix.group(1));
                stageCode = stageSuffix.group(2);
            }
            Optional<SeriesEntry> series = registry.resolve(publisher.get(), String.join(" ", seriesTokens));
            if (series.isPresent()) {
                if (stageCode != null) {
                    builder.stage(parseStage(input, stageCode));
                }
                tokens.addAll(0, candidates.subList(n, candidates.size()));
                return new SeriesMatch(publisher.get(), series.get());
            }
        }
        throw new UnknownSeriesException(input, candidates.isEmpty()
            ? "Missing series in '" + input + "'"
            : "Unknown series '" + String.join(" ", candidates) + "' for " + publisher.get() + " in '" + input + "'");
    }

    private static boolean startsWithLetterOrSymbol(String token) {
        return !token.isEmpty() && !Character.isDigit(token.charAt(0));
    }

    private static boolean startsWithDigit(String token) {
        return !token.isEmpty() && Character.isDigit(token.charAt(0));
    }

    private static Stage parseStage(String input, String code) {
        return Stage.fromCode(code)
            .orElseThrow(() -> new MalformedDocNumberException(input, "Unknown draft stage '" + code + "' in '" + input + "'"));
    }

    /**
     * Checks a parenthesized code after the document number. Only a lower-case language code
     * is a translation; a draft stage belongs after the series code.
     */
    private static String parseTranslation(String input, String code) {
        if (Stage.fromCode(code).isPresent()) {
            throw new MalformedDocNumberException(input,
                "Draft stage '" + code + "' must follow the series code, not the document number, in '" + input + "'");
        }
        if (TRANSLATION.matcher(code).matches()) {
            return code;
        }
        throw new MalformedDocNumberException(input,
            "Unrecognized translation code '" + code + "' in '" + input + "'");
    }

    /**
     * Strips {@code  Addendum[ N]} and {@code /Upd N[:DATE]} from the end of a short-form remainder.
     *
     * @return document number with its compact markers
     */
    private static String parseShortSuffixes(String input, String remainder, PubId.Builder builder) {
        String rest = remainder;
        Matcher addendum = SHORT_ADDENDUM.matcher(rest);
        if (addendum.matches()) {
            builder.addendum(addendum.group(2) != null ? parseNumber(input, addendum.group(2)) : 1);
            rest = addendum.group(1);
        }
        Matcher update = SHORT_UPDATE.matcher(rest);
        if (update.matches()) {
            builder.update(Update.of(parseNumber(input, update.group(2)), update.group(3)));
            rest = update.group(1);
        }
        if (WHITESPACE.matcher(rest).find()) {
            throw new MalformedDocNumberException(input,
                "Unexpected text after document number: '" + rest + "' in '" + input + "'");
        }
        return rest;
    }

    /**
     * Reads the dot-separated {@code add-N} and {@code uN[-DATE]} tokens following the first token.
     *
     * @return document number with its compact markers
     */
    private static String parseMrSuffixes(String input, String remainder, PubId.Builder builder) {
        String[] parts = DOT.split(remainder, -1);
        if (!startsWithDigit(parts[0])) {
            throw new MalformedDocNumberException(input,
                "Unexpected token '" + parts[0] + "' before document number in '" + input + "'");
        }
        boolean addendumSeen = false;
        boolean updateSeen = false;
        for (int i = 1; i < parts.length; i++) {
            Matcher addendum = MR_ADDENDUM.matcher(parts[i]);
            Matcher update = MR_UPDATE.matcher(parts[i]);
            if (addendum.matches() && !addendumSeen) {
                builder.addendum(parseNumber(input, addendum.group(1)));
                addendumSeen = true;
            } else if (update.matches() && !updateSeen) {
                builder.update(Update.of(parseNumber(input, update.group(1)), update.group(2)));
                updateSeen = true;
            } else {
                throw new MalformedDocNumberException(input,
                    "Unrecognized suffix '" + parts[i] + "' in '" + input + "'");
            }
        }
        return parts[0];
    }

    /**
     * Splits the greedy document number from the compact markers that follow it and applies
     * the markers in {@link CompactMarker} priority order.
     */
    private static void parseDocNumberAndMarkers(String input, String text, SeriesEntry series, PubId.Builder builder) {
        Matcher docNumber = DOC_NUMBER.matcher(text);
        if (!docNumber.lookingAt()) {
            throw new MalformedDocNumberException(input, "Malformed document number '" + text + "' in '" + input + "'");
        }
        builder.docNumber(docNumber.group());

        String rest = text.substring(docNumber.end());
        Set<CompactMarker> seen = EnumSet.noneOf(CompactMarker.class);
        while (!rest.isEmpty()) {
            boolean matched = false;
            for (CompactMarker marker : CompactMarker.values()) {
                Matcher m = marker.pattern().matcher(rest);
                if (!m.lookingAt()) {
                    continue;
                }
                CompactMarker effective = marker == CompactMarker.VOLUME && !series.volumes()
                    ? CompactMarker.VERSION
                    : marker;
                if (!seen.add(effective)) {
                    throw new MalformedDocNumberException(input,
                        "Repeated '" + marker.marker() + "' qualifier in '" + input + "'");
                }
                applyMarker(input, effective, m.group(1), builder);
                rest = rest.substring(m.end());
                matched = true;
                break;
            }
            if (!matched) {
                throw new MalformedDocNumberException(input,
                    "Unrecognized suffix '" + rest + "' after document number in '" + input + "'");
            }
        }
    }

    private static void applyMarker(String input, CompactMarker marker, String value, PubId.Builder builder) {
        switch (marker) {
            case VERSION -> builder.version(parseNumber(input, value));
            case VOLUME -> builder.volume(parseNumber(input, value));
            case PART -> builder.part(value);
            case REVISION -> builder.revision(parseNumber(input, value));
            case EDITION -> builder.edition(parseNumber(input, value));
        }
    }

    static int parseNumber(String input, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedDocNumberException(input, "Number out of range: '" + digits + "' in '" + input + "'", e);
        }
    }
}
