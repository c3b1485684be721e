package com.flamingo.ai.slunk.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists an emoji-to-count reaction map as a JSON object.
 *
 * <p>{@code null} stays {@code null}: it means reactions were not captured, which is different
 * from an empty map. Keys are written sorted so equal maps produce equal column values.
 */
@Converter
@Slf4j
public class ReactionMapConverter implements AttributeConverter<Map<String, Integer>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<TreeMap<String, Integer>> MAP_TYPE =
      new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Map<String, Integer> attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(new TreeMap<>(attribute));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize reactions", e);
    }
  }

  @Override
  public Map<String, Integer> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(dbData, MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize reactions column: {}", e.getMessage());
      return null;
    }
  }
}
