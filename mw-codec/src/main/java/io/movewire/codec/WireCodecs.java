package io.movewire.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.movewire.core.AccountAddress;
import io.movewire.core.Event;
import io.movewire.core.Guid;
import io.movewire.core.Hash;
import io.movewire.core.HexBytes;
import io.movewire.core.U64;
import io.movewire.core.json.DecodeError;
import io.movewire.core.json.MoveWireJson;

import java.util.Objects;

/** One {@link WireCodec} per wire value type, all sharing one mapper. Thread-safe. */
public final class WireCodecs {
    private final ObjectMapper json;
    private final WireCodec<U64> u64;
    private final WireCodec<HexBytes> bytes;
    private final WireCodec<Guid> guid;
    private final WireCodec<Hash> hash;
    private final WireCodec<AccountAddress> address;
    private final WireCodec<Event> event;

    public WireCodecs() {
        this(MoveWireJson.newObjectMapper());
    }

    /** The mapper must not be reconfigured afterwards. */
    public WireCodecs(ObjectMapper json) {
        this.json = Objects.requireNonNull(json);
        this.u64 = new JsonWireCodec<>(json, U64.class, DecodeError.MALFORMED_NUMBER);
        this.bytes = new JsonWireCodec<>(json, HexBytes.class, DecodeError.MALFORMED_BYTES);
        this.guid = new JsonWireCodec<>(json, Guid.class, DecodeError.MALFORMED_OBJECT);
        this.hash = new JsonWireCodec<>(json, Hash.class, DecodeError.MALFORMED_OBJECT);
        this.address = new JsonWireCodec<>(json, AccountAddress.class, DecodeError.MALFORMED_OBJECT);
        this.event = new JsonWireCodec<>(json, Event.class, DecodeError.MALFORMED_OBJECT);
    }

    public WireCodec<U64> u64() { return u64; }

    public WireCodec<HexBytes> bytes() { return bytes; }

    /** Event-stream GUIDs only, see {@link Guid}. */
    public WireCodec<Guid> guid() { return guid; }

    public WireCodec<Hash> hash() { return hash; }

    public WireCodec<AccountAddress> address() { return address; }

    public WireCodec<Event> event() { return event; }

    /**
     * The mapper shared by every codec here. Use it to read or write, never to reconfigure:
     * changing its features or modules changes the behavior of all codecs. Take
     * {@link ObjectMapper#copy()} for a variant.
     */
    public ObjectMapper objectMapper() { return json; }
}
