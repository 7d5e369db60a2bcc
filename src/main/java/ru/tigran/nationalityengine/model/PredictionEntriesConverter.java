package ru.tigran.nationalityengine.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.nationalityengine.dto.PredictionEntry;

import java.util.List;

/**
 * JPA конвертер для списка кандидатов с метаданными стран.
 * Запись кэша хранится одной строкой, поэтому она всегда перезаписывается целиком.
 */
@Slf4j
@Converter
public class PredictionEntriesConverter implements AttributeConverter<List<PredictionEntry>, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(List<PredictionEntry> attribute) {
        try {
            return objectMapper.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            log.error("Error converting prediction entries to JSON", e);
            throw new IllegalStateException("Failed to convert prediction entries to JSON", e);
        }
    }

    @Override
    public List<PredictionEntry> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(dbData, new TypeReference<List<PredictionEntry>>() {});
        } catch (JsonProcessingException e) {
            log.error("Error converting JSON to prediction entries", e);
            throw new IllegalStateException("Failed to convert JSON to prediction entries", e);
        }
    }
}
