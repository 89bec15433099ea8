package io.movewire.codec;

import java.nio.charset.StandardCharsets;

/**
 * Decode/encode pair for one wire value type.
 *
 * Decoding accepts every form the node API is known to send; encoding always produces the
 * single canonical form. {@code decode(encode(v))} equals {@code v} for every value.
 */
public interface WireCodec<T> {

    /** @throws DecodeException if the JSON is not a well-formed {@code T} */
    T decode(byte[] json);

    /** Total over the value domain. */
    byte[] encode(T value);

    default T decode(String json) {
        return decode(json.getBytes(StandardCharsets.UTF_8));
    }

    default String encodeToString(T value) {
        return new String(encode(value), StandardCharsets.UTF_8);
    }
}
