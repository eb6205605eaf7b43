package com.codeheadsystems.sessionkey.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson setup for persisted and exported session keys: ISO-8601 instants and dates,
 * tolerant of fields added by newer versions.
 */
public class ObjectMappers {

  private ObjectMappers() {
  }

  /**
   * Creates a mapper for session key documents.
   *
   * @return the object mapper
   */
  public static ObjectMapper sessionKeyMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();
  }
}
