package com.nistpubid.core.series;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nistpubid.core.model.Publisher;

import java.util.List;

/**
 * YAML binding for the series registry data file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * series:
 *   - code: "FIPS PUB"
 *     publishers: [NIST, NBS]
 *     long: "Federal Information Processing Standards Publication"
 *     abbrev: "Federal Inf. Process. Stds."
 *     aliases: [FIPS]
 *
 * compounds:
 *   - code: NISTIR
 *     publisher: NIST
 *     series: IR
 * }</pre>
 *
 * @param series series definitions
 * @param compounds legacy spellings that fuse publisher and series into one token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeriesDefinitions(
    @JsonProperty("series") List<SeriesDefinition> series,
    @JsonProperty("compounds") List<CompoundDefinition> compounds
) {
    /**
     * Compact constructor defaulting absent lists.
     */
    public SeriesDefinitions {
        if (series == null) {
            series = List.of();
        }
        if (compounds == null) {
            compounds = List.of();
        }
    }

    /**
     * One series.
     *
     * @param code canonical short code
     * @param publishers issuing publishers
     * @param longTitle full title
     * @param abbrevTitle abbreviated title, defaults to the full title
     * @param aliases legacy spellings
     * @param volumes whether the series is split into volumes
     * @param embedsPublisher whether the titles already name the publisher
     * @param docNumber document number pattern, defaults to the generic grammar
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeriesDefinition(
        @JsonProperty("code") String code,
        @JsonProperty("publishers") List<Publisher> publishers,
        @JsonProperty("long") String longTitle,
        @JsonProperty("abbrev") String abbrevTitle,
        @JsonProperty("aliases") List<String> aliases,
        @JsonProperty("volumes") boolean volumes,
        @JsonProperty("embedsPublisher") boolean embedsPublisher,
        @JsonProperty("docNumber") String docNumber
    ) {
        SeriesEntry toEntry() {
            return new SeriesEntry(code, publishers, longTitle, abbrevTitle, aliases,
                volumes, embedsPublisher, docNumber);
        }
    }

    /**
     * A legacy token such as {@code NISTIR} that stands for a publisher and a series.
     *
     * @param code the fused token
     * @param publisher publisher it stands for
     * @param series canonical code of the series it stands for
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompoundDefinition(
        @JsonProperty("code") String code,
        @JsonProperty("publisher") Publisher publisher,
        @JsonProperty("series") String series
    ) {}
}
