package com.nistpubid.core.renderer;

import java.util.Locale;

/**
 * Textual representations of a publication identifier.
 */
public enum PubIdStyle {
    /** Full names, e.g. {@code National Institute of Standards and Technology Special Publication 800-53, Revision 5} */
    LONG,

    /** Abbreviated names, e.g. {@code Natl. Inst. Stand. Technol. Spec. Publ. 800-53, Rev. 5} */
    ABBREV,

    /** Acronyms and compact markers, e.g. {@code NIST SP 800-53r5} */
    SHORT,

    /** Machine-readable, dot-delimited without spaces, e.g. {@code NIST.SP.800-53r5} */
    MR;

    /**
     * Looks up a style by its lower-case name ({@code long}, {@code abbrev}, {@code short}, {@code mr}).
     *
     * @param name style name, any case
     * @return matching style
     * @throws IllegalArgumentException if no style has that name
     */
    public static PubIdStyle fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Unknown PubID style: null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown PubID style: " + name, e);
        }
    }
}
