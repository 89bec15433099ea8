/**
 * Jackson bindings for the MoveWire value types.
 *
 * <p>The types in {@code io.movewire.core} point at these classes through
 * {@code @JsonSerialize}/{@code @JsonDeserialize}, so any {@code ObjectMapper} maps them.
 * {@link io.movewire.core.json.MoveWireJson#newObjectMapper()} adds the stricter defaults
 * the codecs rely on.</p>
 *
 * <p>Every deserializer fails with a {@link io.movewire.core.json.MalformedValueException}
 * tagged with a {@link io.movewire.core.json.DecodeError}. Nothing is partially decoded.</p>
 */
package io.movewire.core.json;
