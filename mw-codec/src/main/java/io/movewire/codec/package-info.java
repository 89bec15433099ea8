/**
 * Codec layer between raw node API JSON and the MoveWire value types.
 *
 * <pre>
 *   byte[] json
 *        → WireCodec.decode   (format sniffing, range checks)
 *            → U64 / HexBytes / Guid / Hash / Event
 *                → WireCodec.encode   (canonical form only)
 * </pre>
 *
 * <p>Codecs are stateless and may be shared across threads. Decoding is all-or-nothing and
 * every failure is a {@link io.movewire.codec.DecodeException}. Encoding never fails for a
 * constructed value.</p>
 */
package io.movewire.codec;
