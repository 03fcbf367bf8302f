package com.nistpubid.core.exception;

/**
 * Thrown when a PubID string cannot be parsed. Never carries a partial result.
 */
public abstract class PubIdParseException extends PubIdException {

    private final String input;

    protected PubIdParseException(String input, String message) {
        super(message);
        this.input = input;
    }

    protected PubIdParseException(String input, String message, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    /**
     * Returns the text that failed to parse.
     *
     * @return original input, possibly null
     */
    public String input() {
        return input;
    }
}
