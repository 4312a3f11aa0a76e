package io.rulegate.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonException;

import java.io.InputStream;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Provides JSON serialization/deserialization using Jackson.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     *
     * <p>Unknown request properties are ignored; null properties of response POJOs are omitted.
     * Nulls inside record maps are kept.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setDefaultPropertyInclusion(JsonInclude.Value.construct(JsonInclude.Include.NON_NULL, JsonInclude.Include.ALWAYS)));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(InputStream input, Class<T> type) throws JsonException {
        if (input == null) {
            throw new JsonException("Cannot deserialize empty body to " + type.getName());
        }
        try {
            return mapper.readValue(input, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize input stream to " + type.getName(), e);
        }
    }
}
