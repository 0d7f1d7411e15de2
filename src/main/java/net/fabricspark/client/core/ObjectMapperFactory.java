package net.fabricspark.client.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/** Builds the Jackson mappers used for Livy, Fabric API and profile JSON. */
public final class ObjectMapperFactory {
  private ObjectMapperFactory() {}

  public static ObjectMapper getObjectMapper() {
    // Livy replies grow fields across versions; decimals in result rows must keep their scale
    return JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
        .build();
  }
}
