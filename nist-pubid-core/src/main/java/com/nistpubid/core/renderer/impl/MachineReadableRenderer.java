package com.nistpubid.core.renderer.impl;

import com.nistpubid.core.PubId;
import com.nistpubid.core.model.Qualifiers;
import com.nistpubid.core.model.Update;
import com.nistpubid.core.renderer.PubIdStyle;

/**
 * Renders the machine-readable form: dot-delimited, no spaces, e.g.
 * {@code NIST.SP.IPD.800-53r4.u3-2015} or {@code NIST.SP.800-38A.add-1}.
 */
public class MachineReadableRenderer extends AbstractCompactRenderer {

    @Override
    public PubIdStyle getStyle() {
        return PubIdStyle.MR;
    }

    @Override
    public String render(PubId pubId) {
        Qualifiers qualifiers = pubId.getQualifiers();
        StringBuilder sb = new StringBuilder()
            .append(pubId.getPublisher().code())
            .append('.')
            .append(pubId.getSeries().mrCode());
        if (qualifiers.stage() != null) {
            sb.append('.').append(qualifiers.stage().code());
        }
        sb.append('.').append(docNumberWithMarkers(pubId));

        Update update = qualifiers.update();
        if (update != null) {
            sb.append(".u").append(update.number());
            if (update.hasDate()) {
                sb.append('-').append(update.date());
            }
        }
        if (qualifiers.addendum() != null) {
            sb.append(".add-").append(qualifiers.addendum());
        }
        return sb.append(translationSuffix(qualifiers)).toString();
    }
}
