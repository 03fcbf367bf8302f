package com.nistpubid.core.series;

import com.nistpubid.core.model.Publisher;

import java.util.Objects;

/**
 * A series resolved together with the publisher it was resolved for.
 *
 * @param publisher resolved publisher
 * @param series resolved series
 */
public record SeriesMatch(Publisher publisher, SeriesEntry series) {

    /**
     * Compact constructor with validation.
     */
    public SeriesMatch {
        Objects.requireNonNull(publisher, "publisher must not be null");
        Objects.requireNonNull(series, "series must not be null");
    }
}
