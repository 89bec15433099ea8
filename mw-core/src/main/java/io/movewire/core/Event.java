package io.movewire.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One entry of a transaction's {@code events} array. {@code data} is optional, the rest are required. */
@JsonPropertyOrder({"guid", "sequence_number", "type", "data"})
public record Event(
        @JsonProperty(value = "guid", required = true) Guid guid,
        @JsonProperty(value = "sequence_number", required = true) U64 sequenceNumber,
        @JsonProperty(value = "type", required = true) String type,
        @JsonProperty("data") Map<String, Object> data
) {
    public Event {
        Objects.requireNonNull(guid, "guid");
        Objects.requireNonNull(sequenceNumber, "sequence_number");
        Objects.requireNonNull(type, "type");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
