package io.movewire.core;

import java.util.HexFormat;
import java.util.Objects;

/** {@code 0x}-prefixed lowercase hex, the canonical text form for bytes on the wire. */
public final class Hex {

    public static final String PREFIX = "0x";

    private static final HexFormat HEX = HexFormat.of();

    private Hex() {}

    /** {@code 0x} followed by two lowercase digits per byte; empty input gives {@code "0x"}. */
    public static String encode(byte[] bytes) {
        return PREFIX + HEX.formatHex(Objects.requireNonNull(bytes, "bytes"));
    }

    /**
     * Decode hex digits, with or without a leading {@code 0x}. Either case is accepted.
     *
     * @throws IllegalArgumentException on an odd digit count or a non-hex character
     */
    public static byte[] decode(String text) {
        Objects.requireNonNull(text, "text");
        var digits = hasPrefix(text) ? text.substring(PREFIX.length()) : text;
        if ((digits.length() & 1) != 0) {
            throw new IllegalArgumentException("Odd number of hex digits: " + text);
        }
        return HEX.parseHex(digits);
    }

    public static boolean hasPrefix(String text) {
        return text.startsWith(PREFIX);
    }
}
