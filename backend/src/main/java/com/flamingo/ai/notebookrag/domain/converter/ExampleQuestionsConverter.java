package com.flamingo.ai.notebookrag.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores the example questions written by notebook content generation as a JSON array in a TEXT
 * column.
 *
 * <p>Blank questions are dropped and an empty list is stored as NULL, so a notebook that never
 * finished generation and one whose generation produced nothing read back alike. A column that
 * is not a JSON string array reads as no questions; the notebook itself must stay loadable.
 */
@Converter
@Slf4j
public class ExampleQuestionsConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> questions) {
    if (questions == null) {
      return null;
    }
    List<String> kept = questions.stream().filter(q -> q != null && !q.isBlank()).toList();
    if (kept.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(kept);
    } catch (JsonProcessingException e) {
      log.error("Failed to store {} example questions: {}", kept.size(), e.getMessage());
      return null;
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(column, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable example questions column: {}", e.getMessage());
      return Collections.emptyList();
    }
  }
}
