package io.movewire.codec;

import io.movewire.core.json.DecodeError;

import java.util.Objects;

/**
 * A wire value that could not be decoded.
 *
 * {@link #path()} names the failing field ({@code "guid.creation_number"}); it is empty when
 * the top-level value itself is bad. {@link #value()} is the offending text when there is one.
 */
public class DecodeException extends RuntimeException {
    private static final long serialVersionUID = 6637264096182046935L;

    private final DecodeError error;
    private final String path;
    private final String value;

    public DecodeException(DecodeError error, String path, String value, String message, Throwable cause) {
        super(format(error, path, message), cause);
        this.error = Objects.requireNonNull(error, "error");
        this.path = path == null ? "" : path;
        this.value = value;
    }

    private static String format(DecodeError error, String path, String message) {
        return (path == null || path.isEmpty())
                ? error + ": " + message
                : error + " at '" + path + "': " + message;
    }

    public DecodeError error() { return error; }

    public String path() { return path; }

    /** May be null. */
    public String value() { return value; }
}
