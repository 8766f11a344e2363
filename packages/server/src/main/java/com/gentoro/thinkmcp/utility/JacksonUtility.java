package com.gentoro.thinkmcp.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.thinkmcp.exception.SerializationException;

public class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Ignore extra fields in JSON that aren't in the target type
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          // Optional fields are omitted rather than written as null
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static final ObjectMapper COMPACT_JSON_MAPPER =
      JSON_MAPPER.copy().disable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static String toCompactJson(Object object) {
    try {
      return COMPACT_JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to parse JSON into " + type.getSimpleName(), e);
    }
  }
}
