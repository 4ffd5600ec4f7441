package com.flamingo.ai.chainsearch.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;

/**
 * JPA converter for persisting an embedding vector as a JSON array in a TEXT column.
 *
 * <p>Null and empty vectors both map to SQL NULL so "no embedding" has a single representation.
 */
@Converter
public class FloatListConverter implements AttributeConverter<List<Float>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<Float>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<Float> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize embedding vector", e);
    }
  }

  @Override
  public List<Float> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(dbData, LIST_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored embedding vector is not valid JSON", e);
    }
  }
}
