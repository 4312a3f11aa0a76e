package io.rulegate.json.spi;

import java.io.InputStream;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Records travel as {@code Map<String, Object>} trees of strings, numbers, booleans,
 * lists, maps and nulls; request and response payloads as strongly-typed POJOs.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON input stream to an object of the specified type.
     * @param input JSON input stream
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;
}
