package io.mixforge.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mixforge.exception.MixForgeErrorCode;
import io.mixforge.exception.MixForgeException;

/** Shared Jackson mapper: ISO-8601 timestamps, nulls omitted, unknown properties ignored. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return JSON_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new MixForgeException(
          MixForgeErrorCode.UNKNOWN, "Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }
}
