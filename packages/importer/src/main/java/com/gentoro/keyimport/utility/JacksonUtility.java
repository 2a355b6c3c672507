package com.gentoro.keyimport.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Shared, pre-configured {@link ObjectMapper}. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.INDENT_OUTPUT, true);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }
}
