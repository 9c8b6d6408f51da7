package ru.tigran.employeeinsights.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.exception.MalformedRecordException;
import ru.tigran.employeeinsights.model.FeedbackRecord;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Turns one raw inbound element into a fully populated {@link FeedbackRecord}.
 * Missing or blank fields get sentinel defaults; only an element that is not a JSON object,
 * or whose date is present but unreadable, is rejected.
 */
@Slf4j
@Component
public class RecordNormalizer {

    public static final String UNKNOWN = "Unknown";

    // yyyy-MM-dd, optionally followed by " HH:mm:ss" or "THH:mm:ss" and an offset
    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral(' ').append(DateTimeFormatter.ISO_LOCAL_TIME).optionalEnd()
            .optionalStart().appendLiteral('T').append(DateTimeFormatter.ISO_LOCAL_TIME).optionalEnd()
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    public RecordNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param raw one element of the bulk payload
     * @return a new, unsaved record
     * @throws MalformedRecordException if the element cannot be read as a record at all
     */
    public FeedbackRecord normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new MalformedRecordException("Record must be a JSON object, got: "
                    + (raw == null ? "null" : raw.getNodeType()));
        }

        FeedbackRecord record = new FeedbackRecord();
        record.setSourceData(text(raw, "sourceData", UNKNOWN));
        record.setEmployeeName(text(raw, "employeeName", UNKNOWN));
        record.setEventDate(date(raw.get("date")));
        record.setRegion(text(raw, "witel", UNKNOWN));
        record.setCity(text(raw, "kota", UNKNOWN));
        record.setOriginalInsight(text(raw, "originalInsight", ""));
        record.setSentenceInsight(text(raw, "sentenceInsight", ""));
        record.setKeyword(text(raw, "wordInsight", UNKNOWN));
        record.setSentiment(sentiment(raw.get("sentimen")));
        return record;
    }

    private static String text(JsonNode raw, String field, String fallback) {
        JsonNode node = raw.get(field);
        if (node == null || !node.isValueNode() || node.isNull()) {
            return fallback;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? fallback : value;
    }

    private LocalDate date(JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && node.asText().isBlank())) {
            return LocalDate.now(clock);
        }
        String value = node.asText().trim();
        try {
            return DATE_FORMAT.parse(value, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("Unreadable date: " + value, e);
        }
    }

    private static Sentiment sentiment(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Sentiment.NEUTRAL;
        }
        return Sentiment.parse(node.asText()).orElseGet(() -> {
            log.debug("Unknown sentiment '{}', stored as neutral", node.asText());
            return Sentiment.NEUTRAL;
        });
    }
}
