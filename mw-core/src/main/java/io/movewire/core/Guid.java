package io.movewire.core;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.movewire.core.json.GuidDeserializer;
import io.movewire.core.json.GuidSerializer;

import java.util.Objects;

/**
 * Identifier of a V1 event stream: the creating account plus a per-account creation number.
 *
 * <pre>{"creation_number": "5", "account_address": "0x1"}</pre>
 *
 * Only for the {@code guid} of entries in a transaction's {@code events} array. The
 * {@code GUID} resource that shows up in write-set changes has a different shape and must
 * not be read with this type.
 */
@JsonSerialize(using = GuidSerializer.class)
@JsonDeserialize(using = GuidDeserializer.class)
public record Guid(U64 creationNumber, AccountAddress accountAddress) {

    public static final String CREATION_NUMBER = "creation_number";
    public static final String ACCOUNT_ADDRESS = "account_address";

    public Guid {
        Objects.requireNonNull(creationNumber, "creationNumber");
        Objects.requireNonNull(accountAddress, "accountAddress");
    }
}
