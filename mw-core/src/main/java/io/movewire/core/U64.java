package io.movewire.core;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.movewire.core.json.U64Deserializer;
import io.movewire.core.json.U64Serializer;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Unsigned 64-bit integer as carried by the node API.
 *
 * On the wire it arrives either as a JSON string holding a decimal literal or as a bare
 * JSON number; it is always written back as a quoted decimal string so that clients whose
 * native number type is a double keep full precision.
 */
@JsonSerialize(using = U64Serializer.class)
@JsonDeserialize(using = U64Deserializer.class)
public final class U64 implements Comparable<U64> {

    public static final U64 ZERO = new U64(0L);
    public static final U64 MAX = new U64(-1L);

    private static final BigInteger MAX_VALUE = new BigInteger("18446744073709551615");

    /** Raw bits, read as unsigned. Every bit pattern is a valid u64. */
    private final long bits;

    private U64(long bits) {
        this.bits = bits;
    }

    /** Wrap the bits of {@code unsignedBits}; {@code -1L} is {@code 2^64 - 1}. */
    public static U64 valueOf(long unsignedBits) {
        return new U64(unsignedBits);
    }

    /** @throws IllegalArgumentException if {@code value} is negative or above {@code 2^64 - 1} */
    public static U64 valueOf(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
            throw new IllegalArgumentException("Out of unsigned 64-bit range: " + value);
        }
        return new U64(value.longValue());
    }

    /**
     * Parse a base-10 literal made only of ASCII digits.
     * Signs, whitespace, separators and the empty string are rejected.
     *
     * @throws NumberFormatException naming the literal when it is not a valid u64
     */
    public static U64 parse(String literal) {
        Objects.requireNonNull(literal, "literal");
        if (literal.isEmpty()) {
            throw new NumberFormatException("Empty unsigned 64-bit literal");
        }
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c < '0' || c > '9') {
                throw new NumberFormatException("Not an unsigned decimal literal: \"" + literal + "\"");
            }
        }
        try {
            // digits only from here on, so the only remaining failure is overflow
            return new U64(Long.parseUnsignedLong(literal));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Exceeds unsigned 64-bit range: \"" + literal + "\"");
        }
    }

    /** The raw bits; values above {@link Long#MAX_VALUE} come back negative. */
    public long longValue() { return bits; }

    public BigInteger toBigInteger() { return new BigInteger(Long.toUnsignedString(bits)); }

    @Override
    public int compareTo(U64 other) { return Long.compareUnsigned(bits, other.bits); }

    @Override
    public boolean equals(Object o) {
        return o instanceof U64 other && other.bits == bits;
    }

    @Override
    public int hashCode() { return Long.hashCode(bits); }

    /** Unsigned decimal. */
    @Override
    public String toString() { return Long.toUnsignedString(bits); }
}
