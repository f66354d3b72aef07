package capi.util;

import java.util.Map;

/**
 * JSON codec for payload maps, stored JSON columns and destination responses.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to Jackson.
 * Applications that already configure an {@code ObjectMapper} can pass it to
 * {@link JacksonJsonCodec#JacksonJsonCodec(com.fasterxml.jackson.databind.ObjectMapper)}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value (typically a map or list) as JSON. Returns {@code null} for {@code null} input.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    String toJson(Object value);

    /**
     * Parses a JSON object into a map of nested values. Returns an empty map for {@code null},
     * empty, or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);

    /**
     * Parses a flat JSON object of string values. Non-string values are rendered with
     * {@code String.valueOf}.
     *
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, String> parseStringMap(String json);
}
