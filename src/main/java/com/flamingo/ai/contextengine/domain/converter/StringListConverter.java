package com.flamingo.ai.contextengine.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores interest tags, topics and participant ids as a JSON array in a TEXT column.
 *
 * <p>Entries are trimmed, blanks dropped and duplicates collapsed in first-seen order, both on the
 * way in and on the way out, so rows written before normalization read back clean.
 */
@Converter
@Slf4j
public class StringListConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> attribute) {
    List<String> entries = normalize(attribute);
    if (entries.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(entries);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot store list of " + entries.size() + " entries", e);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return normalize(MAPPER.readValue(dbData, LIST_TYPE));
    } catch (JsonProcessingException e) {
      // Unreadable legacy rows load as empty so the owning entity still loads.
      log.warn("Ignoring unreadable list column ({} chars): {}", dbData.length(), e.getMessage());
      return new ArrayList<>();
    }
  }

  static List<String> normalize(List<String> values) {
    if (values == null) {
      return new ArrayList<>();
    }
    Set<String> seen = new LinkedHashSet<>();
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        seen.add(value.strip());
      }
    }
    return new ArrayList<>(seen);
  }
}
