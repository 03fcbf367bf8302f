package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.PubId;
import com.nistpubid.core.grammar.CompactMarker;
import com.nistpubid.core.model.Qualifiers;
import com.nistpubid.core.renderer.StyleRenderer;

/**
 * Base class for the short and machine-readable styles, which share the compact qualifier
 * markers attached to the document number ({@code 800-57pt1r4}, {@code 1-1Cv1}).
 */
public abstract class AbstractCompactRenderer implements StyleRenderer {

    /**
     * Renders the document number followed by its compact qualifier markers.
     *
     * <p>A version is written {@code v} unless the series uses {@code v} for volumes, in which
     * case it is written {@code ver}.
     *
     * @param pubId identifier
     * @return document number with markers
     */
    protected String docNumberWithMarkers(PubId pubId) {
        Qualifiers qualifiers = pubId.getQualifiers();
        boolean volumes = pubId.getSeries().volumes();
        StringBuilder sb = new StringBuilder(pubId.getDocNumber().value());

        for (CompactMarker marker : CompactMarker.renderOrder()) {
            switch (marker) {
                case VOLUME -> append(sb, marker.marker(), qualifiers.volume());
                case PART -> append(sb, marker.marker(), qualifiers.part());
                case VERSION -> append(sb,
                    volumes ? CompactMarker.VERSION.marker() : CompactMarker.VOLUME.marker(),
                    qualifiers.version());
                case REVISION -> append(sb, marker.marker(), qualifiers.revision());
                case EDITION -> append(sb, marker.marker(), qualifiers.edition());
            }
        }
        return sb.toString();
    }

    /**
     * Renders the translation suffix shared by both compact styles.
     *
     * @param qualifiers qualifiers
     * @return {@code (lang)} or an empty string
     */
    protected String translationSuffix(Qualifiers qualifiers) {
        return qualifiers.translation() == null ? "" : "(" + qualifiers.translation() + ")";
    }

    private static void append(StringBuilder sb, String marker, Object value) {
        if (value != null) {
            sb.append(marker).append(value);
        }
    }
}
