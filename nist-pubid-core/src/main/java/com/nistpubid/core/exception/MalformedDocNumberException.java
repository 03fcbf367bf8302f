package com.nistpubid.core.exception;

/**
 * Thrown when the text following a resolved series does not match the document number and
 * qualifier grammar, or when the parsed fields violate a model invariant.
 */
public class MalformedDocNumberException extends PubIdParseException {

    public MalformedDocNumberException(String input, String message) {
        super(input, message);
    }

    public MalformedDocNumberException(String input, String message, Throwable cause) {
        super(input, message, cause);
    }
}
