package com.nistpubid.core.exception;

/**
 * Thrown when the series token of a PubID has no registry entry for its publisher,
 * after legacy alias normalization.
 */
public class UnknownSeriesException extends PubIdParseException {

    public UnknownSeriesException(String input, String message) {
        super(input, message);
    }
}
