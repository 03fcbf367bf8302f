package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.grammar.Vocabulary;
import com.nistpubid.core.model.Publisher;
import com.nistpubid.core.renderer.PubIdStyle;
import com.nistpubid.core.series.SeriesEntry;

/**
 * Renders the abbreviated form, e.g. {@code Natl. Inst. Stand. Technol. Spec. Publ. 800-57 Pt. 1, Rev. 4}.
 */
public class AbbrevRenderer extends AbstractDescriptiveRenderer {

    public AbbrevRenderer() {
        super(Vocabulary.ABBREV);
    }

    @Override
    public PubIdStyle getStyle() {
        return PubIdStyle.ABBREV;
    }

    @Override
    protected String publisherName(Publisher publisher) {
        return publisher.abbrevName();
    }

    @Override
    protected String seriesTitle(SeriesEntry series) {
        return series.abbrevTitle();
    }
}
