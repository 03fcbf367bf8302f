package com.nistpubid.core.parser;

/**
 * Input grammars recognized by {@link PubIdParser}.
 */
public enum InputStyle {
    /** Space-delimited acronyms, e.g. {@code NIST SP 800-53r5} */
    SHORT,

    /** Dot-delimited without whitespace, e.g. {@code NIST.SP.800-53r5} */
    MR,

    /** Spelled-out names in long or abbreviated wording */
    DESCRIPTIVE
}
