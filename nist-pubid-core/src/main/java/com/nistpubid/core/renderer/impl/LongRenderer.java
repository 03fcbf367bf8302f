package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.grammar.Vocabulary;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.renderer.PubIdStyle;
import com.nistpubid.core.series.SeriesEntry;

/**
 * Renders the long form, e.g.
 * {@code National Institute of Standards and Technology Special Publication 800-57 Part 1, Revision 4}.
 */
public class LongRenderer extends AbstractDescriptiveRenderer {

    public LongRenderer() {
        super(Vocabulary.LONG);
    }

    @Override
    public PubIdStyle getStyle() {
        return PubIdStyle.LONG;
    }

    @Override
    protected String publisherName(Publisher publisher) {
        return publisher.longName();
    }

    @Override
    protected String seriesTitle(SeriesEntry series) {
        return series.longTitle();
    }
}
