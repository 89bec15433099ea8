package io.movewire.core;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.movewire.core.json.HexBytesDeserializer;
import io.movewire.core.json.HexBytesSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Arbitrary-length byte string.
 *
 * Accepted on the wire as {@code 0x}-prefixed hex, bare hex, or padded standard base64.
 * Always written as {@code 0x}-prefixed lowercase hex, whatever form it was read from.
 */
@JsonSerialize(using = HexBytesSerializer.class)
@JsonDeserialize(using = HexBytesDeserializer.class)
public final class HexBytes {
    private static final Logger log = LoggerFactory.getLogger(HexBytes.class);

    public static final HexBytes EMPTY = new HexBytes(new byte[0]);

    private static final String BASE64_PAD = "=";

    private final byte[] bytes;

    private HexBytes(byte[] bytes) {
        this.bytes = bytes;
    }

    public static HexBytes of(byte... bytes) {
        return new HexBytes(Objects.requireNonNull(bytes, "bytes").clone());
    }

    /**
     * Sniff the encoding and decode. The order matters for strings that are valid in both
     * alphabets ({@code "abcd"} is hex, not base64):
     * <ol>
     *   <li>{@code 0x} prefix: hex</li>
     *   <li>{@code =} suffix: base64</li>
     *   <li>otherwise hex, then base64 if that fails</li>
     * </ol>
     *
     * @throws IllegalArgumentException when no applicable decoding succeeds
     */
    public static HexBytes parse(String text) {
        Objects.requireNonNull(text, "text");
        try {
            if (Hex.hasPrefix(text)) {
                return new HexBytes(Hex.decode(text));
            }
            if (text.endsWith(BASE64_PAD)) {
                return new HexBytes(decodeBase64(text));
            }
        } catch (IllegalArgumentException e) {
            throw notHexOrBase64(text, e);
        }
        if (text.isEmpty()) {
            throw notHexOrBase64(text, null);
        }
        try {
            return new HexBytes(Hex.decode(text));
        } catch (IllegalArgumentException notHex) {
            log.trace("'{}' is not hex, trying base64", text);
            try {
                return new HexBytes(decodeBase64(text));
            } catch (IllegalArgumentException notBase64) {
                var e = notHexOrBase64(text, notBase64);
                e.addSuppressed(notHex);
                throw e;
            }
        }
    }

    /** Standard alphabet, padding required. */
    private static byte[] decodeBase64(String text) {
        if (text.length() % 4 != 0) {
            throw new IllegalArgumentException("Unpadded base64: " + text);
        }
        return Base64.getDecoder().decode(text);
    }

    private static IllegalArgumentException notHexOrBase64(String text, Throwable cause) {
        return new IllegalArgumentException("Neither valid hex nor valid base64: \"" + text + "\"", cause);
    }

    public byte[] toByteArray() { return bytes.clone(); }

    public boolean isEmpty() { return bytes.length == 0; }

    /** Canonical wire form. */
    public String toHex() { return Hex.encode(bytes); }

    @Override
    public boolean equals(Object o) {
        return o instanceof HexBytes other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(bytes); }

    @Override
    public String toString() { return toHex(); }
}
