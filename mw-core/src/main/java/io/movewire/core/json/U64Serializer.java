package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.movewire.core.U64;

import java.io.IOException;

/** Always a quoted decimal string, never a bare number. */
public class U64Serializer extends StdSerializer<U64> {
    private static final long serialVersionUID = 4718305561927302218L;

    public U64Serializer() {
        super(U64.class);
    }

    @Override
    public void serialize(U64 value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.toString());
    }
}
