package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import io.movewire.core.HexBytes;
import io.movewire.core.U64;

/**
 * Thrown by the MoveWire deserializers. Carries the {@link DecodeError} so that callers
 * can tell the failure kinds apart after Jackson has added the field path.
 */
public class MalformedValueException extends InvalidFormatException {
    private static final long serialVersionUID = -3217049541337218552L;

    private final DecodeError error;

    public MalformedValueException(JsonParser p, DecodeError error, String msg, Object value, Class<?> targetType) {
        super(p, msg, value, targetType);
        this.error = error;
    }

    public DecodeError error() { return error; }

    static MalformedValueException number(JsonParser p, String literal, String reason) {
        return new MalformedValueException(p, DecodeError.MALFORMED_NUMBER, reason, literal, U64.class);
    }

    static MalformedValueException bytes(JsonParser p, String text, String reason) {
        return new MalformedValueException(p, DecodeError.MALFORMED_BYTES, reason, text, HexBytes.class);
    }

    static MalformedValueException object(JsonParser p, Class<?> targetType, Object value, String reason) {
        return new MalformedValueException(p, DecodeError.MALFORMED_OBJECT, reason, value, targetType);
    }
}
