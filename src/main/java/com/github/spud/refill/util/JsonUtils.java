package com.github.spud.refill.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Shared mapper for persisted session and escalation payloads
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .registerModule(new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, clazz), Exception.class);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
    }), Exception.class);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<List<Object>>() {
    }), Exception.class);
  }
}
