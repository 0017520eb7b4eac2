package io.incentedge.webhooks.util;

import java.util.Map;

/**
 * JSON encoding used for envelopes, event data, filter criteria and header maps.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) uses a shared Jackson
 * {@code ObjectMapper} configured for ISO-8601 timestamps. Implement this interface to
 * supply an application's own mapper.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Serializes a value to a JSON string.
   *
   * @param value the value to encode
   * @return JSON text
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Parses JSON text into the given type.
   *
   * @param json the JSON text
   * @param type target type
   * @param <T>  target type
   * @return the decoded value
   * @throws IllegalArgumentException if the text is not valid for the type
   */
  <T> T fromJson(String json, Class<T> type);

  /**
   * Converts an arbitrary value (POJO, record or map) into a fresh map of JSON-compatible
   * values. Returns an empty map for {@code null}.
   *
   * @param value the value to convert
   * @return a new mutable map
   * @throws IllegalArgumentException if the value does not convert to a JSON object
   */
  Map<String, Object> toMap(Object value);

  /**
   * Encodes a string map as a JSON object. Returns {@code null} if the map is null or empty.
   *
   * @param values the map to encode
   * @return JSON string, or {@code null}
   */
  String toJsonObject(Map<String, String> values);

  /**
   * Parses a JSON object of string values. Returns an empty map for {@code null},
   * empty, or {@code "null"} input.
   *
   * @param json the JSON text
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a valid JSON object
   */
  Map<String, String> parseStringMap(String json);
}
