package io.movewire.core;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.movewire.core.json.AccountAddressDeserializer;
import io.movewire.core.json.AccountAddressSerializer;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 32-byte account address.
 *
 * Parsing is relaxed: the {@code 0x} prefix is optional and leading zeros may be dropped,
 * so {@code "0x1"}, {@code "1"} and the 64-digit form name the same account.
 * Special addresses ({@code 0x0} to {@code 0xf}) print in short form, all others in full.
 */
@JsonSerialize(using = AccountAddressSerializer.class)
@JsonDeserialize(using = AccountAddressDeserializer.class)
public final class AccountAddress {

    public static final int LENGTH = 32;

    private static final int MAX_DIGITS = LENGTH * 2;
    private static final HexFormat HEX = HexFormat.of();

    public static final AccountAddress ZERO = fromLastByte(0x0);
    /** Framework account. */
    public static final AccountAddress ONE = fromLastByte(0x1);
    public static final AccountAddress THREE = fromLastByte(0x3);
    public static final AccountAddress FOUR = fromLastByte(0x4);

    private final byte[] bytes;

    private AccountAddress(byte[] bytes) {
        this.bytes = bytes;
    }

    private static AccountAddress fromLastByte(int b) {
        var bytes = new byte[LENGTH];
        bytes[LENGTH - 1] = (byte) b;
        return new AccountAddress(bytes);
    }

    public static AccountAddress fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Account address must be exactly " + LENGTH + " bytes, got " + bytes.length);
        }
        return new AccountAddress(bytes.clone());
    }

    /**
     * @throws IllegalArgumentException unless the text is 1 to 64 hex digits, optionally {@code 0x}-prefixed
     */
    public static AccountAddress parse(String text) {
        Objects.requireNonNull(text, "text");
        var digits = Hex.hasPrefix(text) ? text.substring(Hex.PREFIX.length()) : text;
        if (digits.isEmpty() || digits.length() > MAX_DIGITS) {
            throw new IllegalArgumentException("Invalid account address length: \"" + text + "\"");
        }
        var padded = "0".repeat(MAX_DIGITS - digits.length()) + digits;
        try {
            return new AccountAddress(HEX.parseHex(padded));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid account address: \"" + text + "\"", e);
        }
    }

    /** All bytes zero except the last, which is below 16. */
    public boolean isSpecial() {
        for (int i = 0; i < LENGTH - 1; i++) {
            if (bytes[i] != 0) return false;
        }
        return (bytes[LENGTH - 1] & 0xff) < 0x10;
    }

    public byte[] toBytes() { return bytes.clone(); }

    @Override
    public boolean equals(Object o) {
        return o instanceof AccountAddress other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(bytes); }

    @Override
    public String toString() {
        if (isSpecial()) {
            return Hex.PREFIX + Integer.toHexString(bytes[LENGTH - 1] & 0xff);
        }
        return Hex.encode(bytes);
    }
}
