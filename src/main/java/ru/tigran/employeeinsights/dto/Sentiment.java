package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Sentiment label of a single feedback record.
 * Stored and rendered with the source system's codes: positif, negatif, netral.
 */
public enum Sentiment {
    POSITIVE("positif", "positive"),
    NEGATIVE("negatif", "negative"),
    NEUTRAL("netral", "neutral");

    private final String value;
    private final String englishName;

    Sentiment(String value, String englishName) {
        this.value = value;
        this.englishName = englishName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getEnglishName() {
        return englishName;
    }

    /**
     * Matches a stored code or an English name, ignoring case and surrounding blanks.
     *
     * @return the sentiment, or empty when the input is null or matches nothing
     */
    public static Optional<Sentiment> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Sentiment sentiment : values()) {
            if (sentiment.value.equals(normalized) || sentiment.englishName.equals(normalized)) {
                return Optional.of(sentiment);
            }
        }
        return Optional.empty();
    }

    public static Sentiment fromValue(String value) {
        return parse(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown sentiment: " + value));
    }
}
