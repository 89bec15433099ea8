package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.movewire.core.HexBytes;

import java.io.IOException;

public class HexBytesSerializer extends StdSerializer<HexBytes> {
    private static final long serialVersionUID = 2291640775101383726L;

    public HexBytesSerializer() {
        super(HexBytes.class);
    }

    @Override
    public void serialize(HexBytes value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.toHex());
    }
}
