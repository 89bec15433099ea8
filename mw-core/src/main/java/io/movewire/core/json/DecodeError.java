package io.movewire.core.json;

/** Why a wire value could not be decoded. */
public enum DecodeError {
    /** Not a non-negative base-10 integer, or above {@code 2^64 - 1}. */
    MALFORMED_NUMBER,
    /** Neither hex (with or without {@code 0x}) nor standard base64. */
    MALFORMED_BYTES,
    /** A compound value is missing a field, or something has the wrong JSON shape. */
    MALFORMED_OBJECT
}
