package com.nistpubid.core.exception;

/**
 * Thrown when an identifier is built from a combination of fields that violates a model invariant,
 * e.g. both revision and edition set, or a volume on a series that has no volumes.
 */
public class InvalidPubIdException extends PubIdException {

    public InvalidPubIdException(String message) {
        super(message);
    }
}
