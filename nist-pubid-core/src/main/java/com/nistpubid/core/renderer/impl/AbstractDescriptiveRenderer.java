package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.PubId;
import com.nistpubid.core.grammar.Vocabulary;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.model.Qualifiers;
import com.nistpubid.core.model.Update;
import com.nistpubid.core.renderer.StyleRenderer;
import com.nistpubid.core.series.SeriesEntry;

import java.util.Locale;

/**
 * Base class for the styles that spell out publisher and series names.
 *
 * <p>Layout, with optional parts in brackets:
 * <pre>
 * [Addendum[ N] to ]&lt;publisher&gt; &lt;series&gt;[ &lt;stage&gt;] &lt;number&gt;[volume][part][version][revision|edition][update][ (LANG)]
 * </pre>
 * The publisher name is left out when the series title already contains it. Subclasses choose
 * the names; the clause wording comes from the {@link Vocabulary}.
 */
public abstract class AbstractDescriptiveRenderer implements StyleRenderer {

    private final Vocabulary vocabulary;

    protected AbstractDescriptiveRenderer(Vocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Returns the publisher name written in this style.
     *
     * @param publisher publisher
     * @return publisher name
     */
    protected abstract String publisherName(Publisher publisher);

    /**
     * Returns the series title written in this style.
     *
     * @param series series
     * @return series title
     */
    protected abstract String seriesTitle(SeriesEntry series);

    @Override
    public String render(PubId pubId) {
        Qualifiers qualifiers = pubId.getQualifiers();
        SeriesEntry series = pubId.getSeries();
        StringBuilder sb = new StringBuilder();

        if (qualifiers.addendum() != null) {
            sb.append(vocabulary.addendumPrefix(qualifiers.addendum()));
        }
        if (!series.embedsPublisher()) {
            sb.append(publisherName(pubId.getPublisher())).append(' ');
        }
        sb.append(seriesTitle(series));
        if (qualifiers.stage() != null) {
            sb.append(' ').append(qualifiers.stage().displayName());
        }
        sb.append(' ').append(pubId.getDocNumber().value());

        appendClause(sb, vocabulary.volumeClause(), qualifiers.volume());
        appendClause(sb, vocabulary.partClause(), qualifiers.part());
        appendClause(sb, vocabulary.versionClause(), qualifiers.version());
        appendClause(sb, vocabulary.revisionClause(), qualifiers.revision());
        appendClause(sb, vocabulary.editionClause(), qualifiers.edition());
        appendUpdate(sb, qualifiers.update());

        if (qualifiers.translation() != null) {
            sb.append(" (").append(qualifiers.translation().toUpperCase(Locale.ROOT)).append(')');
        }
        return sb.toString();
    }

    private static void appendClause(StringBuilder sb, String clause, Object value) {
        if (value != null) {
            sb.append(clause).append(value);
        }
    }

    private void appendUpdate(StringBuilder sb, Update update) {
        if (update == null) {
            return;
        }
        sb.append(vocabulary.updateClause()).append(update.number());
        if (update.hasDate()) {
            sb.append(':').append(update.date());
        }
    }
}
