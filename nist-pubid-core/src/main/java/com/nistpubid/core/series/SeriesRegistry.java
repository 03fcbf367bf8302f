package com.nistpubid.core.series;

import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.series.SeriesDefinitions.CompoundDefinition;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read-only lookup table of known document series.
 *
 * <p>Series codes are matched case-insensitively and without regard to punctuation, so
 * {@code FIPS PUB}, {@code FIPS.PUB} and {@code fips-pub} all resolve to the same entry.
 * Three kinds of spelling are indexed for each publisher:
 * <ol>
 *   <li>canonical codes of the series the publisher issues</li>
 *   <li>series carried over from NBS to NIST, indexed under both publishers</li>
 *   <li>legacy aliases pointing at a canonical entry ({@code FIPS} to {@code FIPS PUB})</li>
 * </ol>
 * Legacy tokens that fuse publisher and series ({@code NISTIR}) are held in a separate
 * compound index.
 *
 * <p>Construction fails with {@link IllegalStateException} when two spellings normalize to the
 * same key for one publisher, so every lookup has at most one answer. Instances are immutable
 * and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SeriesRegistry registry = SeriesRegistry.defaultRegistry();
 * SeriesEntry sp = registry.resolve(Publisher.NIST, "SP").orElseThrow();
 * }</pre>
 *
 * @see SeriesRegistryLoader
 */
public final class SeriesRegistry {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private final List<SeriesEntry> entries;
    private final Map<Publisher, Map<String, SeriesEntry>> codeIndex = new EnumMap<>(Publisher.class);
    private final Map<Publisher, Map<String, SeriesEntry>> longTitleIndex = new EnumMap<>(Publisher.class);
    private final Map<Publisher, Map<String, SeriesEntry>> abbrevTitleIndex = new EnumMap<>(Publisher.class);
    private final Map<String, SeriesMatch> compoundIndex = new HashMap<>();
    private final Map<String, SeriesEntry> embeddedTitleIndex = new HashMap<>();

    /**
     * Builds a registry and its lookup indices.
     *
     * @param entries series entries
     * @param compounds legacy publisher-and-series tokens
     * @throws IllegalStateException if spellings collide or a compound names an unknown series
     */
    public SeriesRegistry(List<SeriesEntry> entries, List<CompoundDefinition> compounds) {
        Objects.requireNonNull(entries, "entries must not be null");
        Objects.requireNonNull(compounds, "compounds must not be null");
        this.entries = List.copyOf(entries);

        for (Publisher publisher : Publisher.values()) {
            codeIndex.put(publisher, new LinkedHashMap<>());
            longTitleIndex.put(publisher, new HashMap<>());
            abbrevTitleIndex.put(publisher, new HashMap<>());
        }
        for (SeriesEntry entry : this.entries) {
            index(entry);
        }
        for (CompoundDefinition compound : compounds) {
            indexCompound(compound);
        }
    }

    /**
     * Returns the registry backed by the bundled {@code series.yaml}, loaded on first use.
     *
     * @return shared default registry
     */
    public static SeriesRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Resolves a series token for a publisher.
     *
     * @param publisher publisher the series must belong to
     * @param token series code or legacy alias, in any case and punctuation
     * @return canonical entry, or empty if the publisher has no such series
     */
    public Optional<SeriesEntry> resolve(Publisher publisher, String token) {
        Objects.requireNonNull(publisher, "publisher must not be null");
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(codeIndex.get(publisher).get(normalize(token)));
    }

    /**
     * Resolves a legacy token that stands for both publisher and series, e.g. {@code NISTIR}.
     *
     * @param token fused token
     * @return publisher and canonical series, or empty if the token is not a known compound
     */
    public Optional<SeriesMatch> resolveCompound(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(compoundIndex.get(normalize(token)));
    }

    /**
     * Finds the series whose full title is exactly {@code title} for the publisher.
     *
     * @param publisher publisher the series must belong to
     * @param title full series title
     * @return matching entry, or empty
     */
    public Optional<SeriesEntry> findByLongTitle(Publisher publisher, String title) {
        return Optional.ofNullable(longTitleIndex.get(publisher).get(title));
    }

    /**
     * Finds the series whose abbreviated title is exactly {@code title} for the publisher.
     *
     * @param publisher publisher the series must belong to
     * @param title abbreviated series title
     * @return matching entry, or empty
     */
    public Optional<SeriesEntry> findByAbbrevTitle(Publisher publisher, String title) {
        return Optional.ofNullable(abbrevTitleIndex.get(publisher).get(title));
    }

    /**
     * Finds a series whose full or abbreviated title already names its publisher.
     *
     * @param title series title as it appears at the start of a descriptive identifier
     * @return publisher and series, or empty
     */
    public Optional<SeriesMatch> findEmbeddedTitle(String title) {
        SeriesEntry entry = embeddedTitleIndex.get(title);
        return entry == null ? Optional.empty() : Optional.of(new SeriesMatch(entry.publishers().get(0), entry));
    }

    public List<SeriesEntry> entries() {
        return entries;
    }

    /**
     * Returns the canonical entries a publisher issues, in registry order.
     *
     * @param publisher publisher
     * @return entries of that publisher
     */
    public List<SeriesEntry> entries(Publisher publisher) {
        return entries.stream()
            .filter(entry -> entry.isPublishedBy(publisher))
            .toList();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Normalizes a series spelling into its lookup key.
     *
     * @param token series spelling
     * @return upper-case key without whitespace or punctuation
     */
    static String normalize(String token) {
        return NON_ALPHANUMERIC.matcher(token.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    private void index(SeriesEntry entry) {
        for (Publisher publisher : entry.publishers()) {
            Map<String, SeriesEntry> codes = codeIndex.get(publisher);
            put(codes, normalize(entry.code()), entry, publisher + " series code");
            for (String alias : entry.aliases()) {
                put(codes, normalize(alias), entry, publisher + " series alias");
            }
            put(longTitleIndex.get(publisher), entry.longTitle(), entry, publisher + " series title");
            put(abbrevTitleIndex.get(publisher), entry.abbrevTitle(), entry, publisher + " abbreviated title");
        }
        if (entry.embedsPublisher()) {
            put(embeddedTitleIndex, entry.longTitle(), entry, "embedded series title");
            put(embeddedTitleIndex, entry.abbrevTitle(), entry, "embedded series title");
        }
    }

    private void indexCompound(CompoundDefinition compound) {
        if (compound.code() == null || compound.publisher() == null || compound.series() == null) {
            throw new IllegalStateException("Incomplete compound definition: " + compound);
        }
        SeriesEntry series = codeIndex.get(compound.publisher()).get(normalize(compound.series()));
        if (series == null) {
            throw new IllegalStateException(
                "Compound " + compound.code() + " refers to unknown series " + compound.publisher() + " " + compound.series());
        }
        SeriesMatch previous = compoundIndex.putIfAbsent(
            normalize(compound.code()), new SeriesMatch(compound.publisher(), series));
        if (previous != null) {
            throw new IllegalStateException("Duplicate compound series token: " + compound.code());
        }
    }

    private static void put(Map<String, SeriesEntry> index, String key, SeriesEntry entry, String what) {
        SeriesEntry previous = index.putIfAbsent(key, entry);
        if (previous != null && previous != entry) {
            throw new IllegalStateException(
                "Ambiguous " + what + " '" + key + "': claimed by " + previous.code() + " and " + entry.code());
        }
    }

    @Override
    public String toString() {
        return "SeriesRegistry[entries=" + entries.size() + "]";
    }

    /**
     * Lazily loads the bundled registry on first access.
     */
    private static final class DefaultHolder {
        private static final SeriesRegistry INSTANCE = SeriesRegistryLoader.loadDefault();
    }
}
