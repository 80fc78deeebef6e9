package com.quarry.exception;

/**
 * Thrown when an entity references another entity that already failed.
 *
 * <p>The referenced entity has reported its own diagnostic, so this exception
 * carries none: the referencing entity becomes invalid without a cascaded error.
 */
public class SuppressedReferenceException extends RuntimeException {

    private final String reference;

    public SuppressedReferenceException(String reference) {
        super("reference to invalid entity '" + reference + "'");
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
