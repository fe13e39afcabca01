package com.consullo.cup.format;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson mapper for envelope output and fixture input.
 */
public final class JsonSupport {

  static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
      .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private JsonSupport() {
  }

  /**
   * Returns the shared mapper. It is configured once and must not be reconfigured by callers.
   *
   * @return JSON mapper
   */
  public static ObjectMapper getJsonMapper() {
    return MAPPER;
  }
}
