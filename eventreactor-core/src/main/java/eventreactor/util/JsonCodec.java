package eventreactor.util;

import java.util.Map;

/**
 * Codec for event bodies to and from JSON text.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) is backed by Jackson with
 * {@code java.time} support. Stores accept a custom codec where a different mapping is needed.
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
   * Encodes a body as a JSON object. An empty or {@code null} body encodes as {@code "{}"}.
   *
   * @param body the body to encode
   * @return JSON object text
   * @throws IllegalArgumentException if a value cannot be encoded
   */
  String toJson(Map<String, Object> body);

  /**
   * Parses a JSON object into a body. Returns an empty map for {@code null}, empty, or
   * {@code "null"} input.
   *
   * @param json the JSON text
   * @return the parsed body (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, Object> parseObject(String json);
}
