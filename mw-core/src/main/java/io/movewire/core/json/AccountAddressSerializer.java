package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.movewire.core.AccountAddress;

import java.io.IOException;

public class AccountAddressSerializer extends StdSerializer<AccountAddress> {
    private static final long serialVersionUID = -1598726045377612384L;

    public AccountAddressSerializer() {
        super(AccountAddress.class);
    }

    @Override
    public void serialize(AccountAddress value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.toString());
    }
}
