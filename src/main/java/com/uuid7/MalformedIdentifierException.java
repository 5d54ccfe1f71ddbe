package com.uuid7;

/**
 * Thrown when an identifier representation has the wrong length, characters
 * outside its alphabet, or a value that does not fit in 128 bits.
 */
public class MalformedIdentifierException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedIdentifierException(String message) {
        super(message);
    }
}
