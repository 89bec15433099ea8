package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.util.AccessPattern;
import io.movewire.core.AccountAddress;
import io.movewire.core.Guid;
import io.movewire.core.U64;

import java.io.IOException;

/**
 * Reads a {@link Guid}. Both fields are required and non-null; other fields are skipped.
 * Field failures keep their own {@link DecodeError} and gain the field name in their path.
 */
public class GuidDeserializer extends StdDeserializer<Guid> {
    private static final long serialVersionUID = -4426081395260113977L;

    public GuidDeserializer() {
        super(Guid.class);
    }

    @Override
    public Guid deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String name;
        if (p.isExpectedStartObjectToken()) {
            name = p.nextFieldName();
        } else if (p.hasToken(JsonToken.FIELD_NAME)) {
            name = p.currentName();
        } else if (p.hasToken(JsonToken.END_OBJECT)) {
            name = null;
        } else {
            throw MalformedValueException.object(p, Guid.class, p.getText(), "Expecting GUID object, got " + p.currentToken());
        }

        U64 creationNumber = null;
        AccountAddress accountAddress = null;
        for (; name != null; name = p.nextFieldName()) {
            p.nextToken();
            switch (name) {
                case Guid.CREATION_NUMBER -> creationNumber = readField(p, ctxt, name, U64.class);
                case Guid.ACCOUNT_ADDRESS -> accountAddress = readField(p, ctxt, name, AccountAddress.class);
                default -> p.skipChildren();
            }
        }

        if (creationNumber == null) throw missing(p, Guid.CREATION_NUMBER);
        if (accountAddress == null) throw missing(p, Guid.ACCOUNT_ADDRESS);
        return new Guid(creationNumber, accountAddress);
    }

    private static <T> T readField(JsonParser p, DeserializationContext ctxt, String name, Class<T> type) throws IOException {
        if (p.hasToken(JsonToken.VALUE_NULL)) {
            throw missing(p, name);
        }
        try {
            return ctxt.readValue(p, type);
        } catch (JsonMappingException e) {
            throw JsonMappingException.wrapWithPath(e, Guid.class, name);
        }
    }

    private static JsonMappingException missing(JsonParser p, String name) {
        var e = MalformedValueException.object(p, Guid.class, null, "Missing required GUID field '" + name + "'");
        return JsonMappingException.wrapWithPath(e, Guid.class, name);
    }

    @Override
    public Guid getNullValue(DeserializationContext ctxt) throws JsonMappingException {
        throw MalformedValueException.object(ctxt.getParser(), Guid.class, null, "null is not a GUID");
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
