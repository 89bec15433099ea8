package io.movewire.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

// TODO: decide whether this should hold the 32 bytes instead of the text
/**
 * A 32-byte hash in hex, e.g.
 * {@code 0xf4d07fdb8b5151971886a910e516d418a790dd5f6e068b0588066518a395a600}.
 *
 * Expected to be 64 lowercase hex digits, possibly {@code 0x}-prefixed. Nothing checks
 * that: the text is carried as received and written back unchanged.
 */
public record Hash(String value) {

    public Hash {
        Objects.requireNonNull(value, "value");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Hash of(String value) { return new Hash(value); }

    @JsonValue public String json() { return value; }

    @Override public String toString() { return value; }
}
