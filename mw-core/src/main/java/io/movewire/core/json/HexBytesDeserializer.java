package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.util.AccessPattern;
import io.movewire.core.HexBytes;

import java.io.IOException;

/** Reads {@link HexBytes} from a JSON string holding hex or base64, see {@link HexBytes#parse(String)}. */
public class HexBytesDeserializer extends StdDeserializer<HexBytes> {
    private static final long serialVersionUID = 5473170834902619051L;

    public HexBytesDeserializer() {
        super(HexBytes.class);
    }

    @Override
    public HexBytes deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            throw MalformedValueException.bytes(p, p.getText(), "Expecting hex or base64 string, got " + p.currentToken());
        }
        String text = p.getText();
        try {
            return HexBytes.parse(text);
        } catch (IllegalArgumentException e) {
            throw MalformedValueException.bytes(p, text, e.getMessage());
        }
    }

    @Override
    public HexBytes getNullValue(DeserializationContext ctxt) throws JsonMappingException {
        throw MalformedValueException.bytes(ctxt.getParser(), null, "null is not a byte string");
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
