package io.detabase.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.detabase.json.spi.JsonCodec;
import io.detabase.json.spi.JsonException;

import java.util.Objects;

/**
 * Jackson implementation of {@link JsonCodec}.
 *
 * <p>Objects decode to insertion-ordered maps, arrays to lists. Integers decode to the
 * smallest of {@code Integer}, {@code Long} or {@code BigInteger} that holds them.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper settings for this client.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to encode " + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public Object decode(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(data, Object.class);
        } catch (Exception e) {
            throw new JsonException("Failed to decode " + data.length + " bytes of JSON", e);
        }
    }
}
