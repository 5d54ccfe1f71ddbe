package com.uuid7;

/**
 * Thrown by a strict {@link TimestampExtractor} when the identifier parsed
 * correctly but carries a version other than 7.
 */
public class NotVersion7Exception extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int version;

    public NotVersion7Exception(Uuid7 id) {
        super(id + " is a version " + id.version() + " UUID, not v7 so the timestamp cannot be extracted");
        this.version = id.version();
    }

    /** The version nibble actually found. */
    public int getVersion() {
        return version;
    }
}
