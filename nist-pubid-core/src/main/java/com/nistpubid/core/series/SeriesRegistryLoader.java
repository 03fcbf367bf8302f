package com.nistpubid.core.series;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@link SeriesRegistry} instances from YAML series data.
 *
 * <p>Uses Jackson to deserialize the data file into {@link SeriesDefinitions} records. Unlike
 * configuration files there is no sensible fallback for missing series data, so every failure
 * is reported as an {@link IllegalStateException} carrying the cause.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SeriesRegistry registry = SeriesRegistryLoader.load(Paths.get("series.yaml"));
 * PubIdParser parser = new PubIdParser(registry);
 * }</pre>
 */
public final class SeriesRegistryLoader {

    /** Classpath location of the bundled NIST and NBS series data. */
    public static final String DEFAULT_RESOURCE = "/com/nistpubid/core/series.yaml";

    private static final Logger log = LoggerFactory.getLogger(SeriesRegistryLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SeriesRegistryLoader() {
        // Utility class
    }

    /**
     * Loads the bundled series data from the classpath.
     *
     * @return registry of the bundled series
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static SeriesRegistry loadDefault() {
        try (InputStream in = SeriesRegistryLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled series data not found on classpath: " + DEFAULT_RESOURCE);
            }
            return load(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled series data: " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads series data from a YAML file.
     *
     * @param path path to the series data file
     * @return registry of the series defined in the file
     * @throws IllegalStateException if the file is missing, unreadable or invalid
     */
    public static SeriesRegistry load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new IllegalStateException("Series data file is not readable: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read series data file: " + path, e);
        }
    }

    /**
     * Loads series data from a YAML stream. The stream is not closed.
     *
     * @param in YAML content
     * @param source description of the source, used in log and error messages
     * @return registry of the series defined in the stream
     * @throws IllegalStateException if the content is invalid
     */
    public static SeriesRegistry load(InputStream in, String source) {
        Objects.requireNonNull(in, "in must not be null");
        SeriesDefinitions definitions;
        try {
            log.debug("Loading series data from: {}", source);
            definitions = YAML_MAPPER.readValue(in, SeriesDefinitions.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse series data from " + source + ": " + e.getMessage(), e);
        }
        if (definitions == null) {
            throw new IllegalStateException("Series data from " + source + " is empty");
        }

        List<SeriesEntry> entries;
        try {
            entries = definitions.series().stream()
                .map(SeriesDefinitions.SeriesDefinition::toEntry)
                .toList();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalStateException("Invalid series definition in " + source + ": " + e.getMessage(), e);
        }

        SeriesRegistry registry = new SeriesRegistry(entries, definitions.compounds());
        log.info("Loaded {} series and {} compound codes from: {}",
            entries.size(), definitions.compounds().size(), source);
        return registry;
    }
}
