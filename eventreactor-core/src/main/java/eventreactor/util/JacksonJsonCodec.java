package eventreactor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Dates are written as ISO-8601 strings, so a body holding an {@code Instant} reads
 * back as its string form.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(createDefaultMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper mapper;

  /**
   * Creates a codec using the given mapper.
   *
   * @param mapper configured object mapper
   */
  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String toJson(Map<String, Object> body) {
    if (body == null || body.isEmpty()) {
      return "{}";
    }
    try {
      return mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode event body", e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    if (trimmed.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    try {
      return mapper.readValue(trimmed, BODY_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON object", e);
    }
  }

  private static ObjectMapper createDefaultMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return mapper;
  }
}
