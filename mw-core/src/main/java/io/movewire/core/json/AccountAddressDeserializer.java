package io.movewire.core.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.movewire.core.AccountAddress;

import java.io.IOException;

public class AccountAddressDeserializer extends StdDeserializer<AccountAddress> {
    private static final long serialVersionUID = 7702963215816690324L;

    public AccountAddressDeserializer() {
        super(AccountAddress.class);
    }

    @Override
    public AccountAddress deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            throw MalformedValueException.object(p, AccountAddress.class, p.getText(),
                    "Expecting account address string, got " + p.currentToken());
        }
        String text = p.getText();
        try {
            return AccountAddress.parse(text);
        } catch (IllegalArgumentException e) {
            throw MalformedValueException.object(p, AccountAddress.class, text, e.getMessage());
        }
    }
}
