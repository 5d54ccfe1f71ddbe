package com.uuid7;

/**
 * Thrown when a timestamp cannot be converted: on generation, a negative value
 * other than the max sentinel or an instant outside the nanosecond range; on
 * extraction, an embedded millisecond too large for a {@code long} nanosecond count.
 */
public class InvalidTimestampException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidTimestampException(String message) {
        super(message);
    }

    public InvalidTimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}
