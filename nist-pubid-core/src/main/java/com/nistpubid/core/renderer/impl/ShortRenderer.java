package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.PubId;
import com.nistpubid.core.model.Qualifiers;
import com.nistpubid.core.model.Update;
import com.nistpubid.core.renderer.PubIdStyle;

/**
 * Renders the short form, e.g. {@code NIST SP(IPD) 800-53r4/Upd 3:2015} or
 * {@code NIST SP 800-38A Addendum}.
 */
public class ShortRenderer extends AbstractCompactRenderer {

    @Override
    public PubIdStyle getStyle() {
        return PubIdStyle.SHORT;
    }

    @Override
    public String render(PubId pubId) {
        Qualifiers qualifiers = pubId.getQualifiers();
        StringBuilder sb = new StringBuilder()
            .append(pubId.getPublisher().code())
            .append(' ')
            .append(pubId.getSeries().code());
        if (qualifiers.stage() != null) {
            sb.append('(').append(qualifiers.stage().code()).append(')');
        }
        sb.append(' ').append(docNumberWithMarkers(pubId));

        Update update = qualifiers.update();
        if (update != null) {
            sb.append("/Upd ").append(update.number());
            if (update.hasDate()) {
                sb.append(':').append(update.date());
            }
        }
        if (qualifiers.addendum() != null) {
            sb.append(" Addendum");
            if (qualifiers.addendum() != 1) {
                sb.append(' ').append(qualifiers.addendum());
            }
        }
        return sb.append(translationSuffix(qualifiers)).toString();
    }
}
