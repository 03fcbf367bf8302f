package com.nistpubid.core.exception;

/**
 * Base type for every failure raised while building or parsing a publication identifier.
 *
 * <p>All failures are unchecked. Callers that only care about "was this a valid PubID"
 * can catch this type; callers that need the reason catch one of the subclasses:
 * <ul>
 *   <li>{@link InvalidPubIdException} - programmatic construction broke a model invariant</li>
 *   <li>{@link UnknownSeriesException} - the series token has no registry entry</li>
 *   <li>{@link MalformedDocNumberException} - the document number or a qualifier suffix is malformed</li>
 * </ul>
 */
public class PubIdException extends RuntimeException {

    public PubIdException(String message) {
        super(message);
    }

    public PubIdException(String message, Throwable cause) {
        super(message, cause);
    }
}
