package ru.tigran.employeeinsights.config;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import ru.tigran.employeeinsights.dto.Sentiment;

/**
 * JPA converter for Sentiment enum to/from database.
 * Keeps the source system's codes (positif/negatif/netral) in the sentiment column.
 */
@Converter(autoApply = true)
public class SentimentConverter implements AttributeConverter<Sentiment, String> {

    @Override
    public String convertToDatabaseColumn(Sentiment attribute) {
        if (attribute == null) {
            return null;
        }
        return attribute.getValue();
    }

    @Override
    public Sentiment convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return null;
        }
        // rows written by other tools may carry anything, they count as neutral
        return Sentiment.parse(dbData).orElse(Sentiment.NEUTRAL);
    }
}
