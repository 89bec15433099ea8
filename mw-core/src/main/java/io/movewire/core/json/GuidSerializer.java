package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.movewire.core.Guid;

import java.io.IOException;

/** Writes {@code creation_number} then {@code account_address}, each in its own canonical form. */
public class GuidSerializer extends StdSerializer<Guid> {
    private static final long serialVersionUID = 1093552068217750641L;

    public GuidSerializer() {
        super(Guid.class);
    }

    @Override
    public void serialize(Guid value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject(value);
        gen.writeFieldName(Guid.CREATION_NUMBER);
        provider.defaultSerializeValue(value.creationNumber(), gen);
        gen.writeFieldName(Guid.ACCOUNT_ADDRESS);
        provider.defaultSerializeValue(value.accountAddress(), gen);
        gen.writeEndObject();
    }
}
