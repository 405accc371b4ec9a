package dev.pinakes.latest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pinakes.version.Retraction;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Stores a list of retractions as a JSON array of {@code {low, high, rationale}} objects. */
@Converter
public class RetractionListConverter implements AttributeConverter<List<Retraction>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<Retraction>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<Retraction> retractions) {
    if (retractions == null) {
      return "[]";
    }
    try {
      return MAPPER.writeValueAsString(retractions);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize retractions", e);
    }
  }

  @Override
  public List<Retraction> convertToEntityAttribute(String json) {
    if (json == null || json.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return new ArrayList<>(MAPPER.readValue(json, LIST_TYPE));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot parse retractions: " + json, e);
    }
  }
}
