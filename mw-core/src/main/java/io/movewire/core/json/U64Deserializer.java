package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.util.AccessPattern;
import io.movewire.core.U64;

import java.io.IOException;

/**
 * Reads a {@link U64} from a JSON string or a bare JSON number.
 *
 * For a string the literal is its content; for a number it is the token text exactly as
 * it appeared, so {@code -0}, {@code 1.0} and {@code 1e3} are all rejected.
 */
public class U64Deserializer extends StdDeserializer<U64> {
    private static final long serialVersionUID = -6020835520174512493L;

    public U64Deserializer() {
        super(U64.class);
    }

    @Override
    public U64 deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken t = p.currentToken();
        if (t != JsonToken.VALUE_STRING && t != JsonToken.VALUE_NUMBER_INT && t != JsonToken.VALUE_NUMBER_FLOAT) {
            throw MalformedValueException.number(p, p.getText(),
                    "Expecting unsigned 64-bit integer as string or number, got " + t);
        }
        String literal = p.getText();
        try {
            return U64.parse(literal);
        } catch (NumberFormatException e) {
            throw MalformedValueException.number(p, literal, e.getMessage());
        }
    }

    @Override
    public U64 getNullValue(DeserializationContext ctxt) throws JsonMappingException {
        throw MalformedValueException.number(ctxt.getParser(), null, "null is not an unsigned 64-bit integer");
    }

    /** Absent is not null: the owning object reports the missing field itself. */
    @Override
    public Object getAbsentValue(DeserializationContext ctxt) {
        return null;
    }

    @Override
    public AccessPattern getNullAccessPattern() {
        return AccessPattern.DYNAMIC;
    }
}
