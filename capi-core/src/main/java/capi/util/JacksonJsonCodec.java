package capi.util;

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
 * Jackson-backed {@link JsonCodec}. Key order of parsed objects is preserved.
 */
public final class JacksonJsonCodec implements JsonCodec {

  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP =
      new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Mapper used by the default instance: ISO-8601 dates, unknown properties ignored,
   * decimals read as {@code BigDecimal} so stored amounts keep their scale.
   */
  public static ObjectMapper defaultMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    return mapper;
  }

  @Override
  public String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize value of type " + value.getClass().getName(), e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (isEmptyJson(json)) {
      return Collections.emptyMap();
    }
    try {
      Map<String, Object> parsed = mapper.readValue(json, OBJECT_MAP);
      return parsed == null ? Collections.emptyMap() : parsed;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object", e);
    }
  }

  @Override
  public Map<String, String> parseStringMap(String json) {
    Map<String, Object> raw = parseObject(json);
    Map<String, String> result = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (value != null) {
        result.put(key, String.valueOf(value));
      }
    });
    return result;
  }

  private static boolean isEmptyJson(String json) {
    if (json == null) {
      return true;
    }
    String trimmed = json.trim();
    return trimmed.isEmpty() || "null".equals(trimmed);
  }
}
