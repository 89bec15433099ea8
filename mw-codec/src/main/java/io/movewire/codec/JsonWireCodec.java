package io.movewire.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.movewire.core.json.DecodeError;
import io.movewire.core.json.MalformedValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link WireCodec} backed by a shared {@link ObjectMapper}.
 *
 * Failures raised by the MoveWire deserializers keep their own {@link DecodeError}. Anything
 * else (broken JSON, a {@code null} document, a failed record constructor) is reported with
 * this codec's {@code shapeError}.
 */
final class JsonWireCodec<T> implements WireCodec<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonWireCodec.class);

    private final ObjectMapper json;
    private final Class<T> type;
    private final DecodeError shapeError;

    JsonWireCodec(ObjectMapper json, Class<T> type, DecodeError shapeError) {
        this.json = Objects.requireNonNull(json);
        this.type = Objects.requireNonNull(type);
        this.shapeError = Objects.requireNonNull(shapeError);
    }

    @Override
    public T decode(byte[] raw) {
        Objects.requireNonNull(raw, "raw");
        T value;
        try {
            value = json.readValue(raw, type);
        } catch (MalformedValueException e) {
            throw failed(e.error(), pathOf(e), e.getValue(), e);
        } catch (JsonMappingException e) {
            throw failed(shapeError, pathOf(e), null, e);
        } catch (IOException e) {
            throw failed(shapeError, "", null, e);
        }
        if (value == null) {
            throw failed(shapeError, "", null, new IllegalArgumentException("null is not a " + type.getSimpleName()));
        }
        return value;
    }

    @Override
    public byte[] encode(T value) {
        Objects.requireNonNull(value, "value");
        try {
            return json.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + type.getSimpleName(), e);
        }
    }

    private DecodeException failed(DecodeError error, String path, Object value, Exception cause) {
        var message = cause instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : cause.getMessage();
        log.debug("Decoding {} failed: {} at '{}'", type.getSimpleName(), error, path);
        return new DecodeException(error, path, value == null ? null : String.valueOf(value), message, cause);
    }

    static String pathOf(JsonMappingException e) {
        var sb = new StringBuilder();
        for (var ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }
}
