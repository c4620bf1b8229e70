package com.aimanager.rbac.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Holder for the shared {@link ObjectMapper} used to render RBAC payloads. Instants are
 * written as ISO-8601 strings.
 */
public class JsonUtils {
   private static final JsonUtils instance = new JsonUtils();
   protected final ObjectMapper mapper;

   private JsonUtils() {
      mapper = new ObjectMapper();
      mapper.registerModule(new JavaTimeModule());
      mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
      mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
   }

   public static JsonUtils instance() {
      return instance;
   }

   public ObjectMapper getMapper() {
      return mapper;
   }

   public String toJson(Object value) throws JsonProcessingException {
      return mapper.writeValueAsString(value);
   }

   public JsonNode toTree(Object value) {
      return mapper.valueToTree(value);
   }
}
