package ru.tigran.employeeinsights.dto;

import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ValidationException;

import java.time.LocalDate;

/**
 * Conjunction of optional restrictions over the fact table. A null component does not restrict.
 *
 * @param search   case-insensitive substring of the sentence, the original text or the keyword
 * @param dateFrom inclusive lower bound on the event date
 * @param dateTo   inclusive upper bound on the event date
 * @param city     exact city, used by the paginated record listing
 * @param source   exact source label, used by the paginated record listing
 */
public record InsightFilter(
        String search,
        Sentiment sentiment,
        LocalDate dateFrom,
        LocalDate dateTo,
        String city,
        String source
) {
    private static final String ALL = "all";

    public InsightFilter {
        search = blankToNull(search);
        city = blankToNull(city);
        source = blankToNull(source);
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new ValidationException(ErrorCode.INVALID_DATE_RANGE);
        }
    }

    public static InsightFilter none() {
        return new InsightFilter(null, null, null, null, null, null);
    }

    /**
     * Builds a filter from request parameters. The sentiment accepts positive/negative/neutral,
     * the stored codes, "all" or blank.
     *
     * @throws ValidationException for any other sentiment value or a reversed date range
     */
    public static InsightFilter of(String search, String sentiment, LocalDate dateFrom, LocalDate dateTo) {
        return new InsightFilter(search, parseSentiment(sentiment), dateFrom, dateTo, null, null);
    }

    public InsightFilter withLocation(String city, String source) {
        return new InsightFilter(search, sentiment, dateFrom, dateTo, city, source);
    }

    public boolean isEmpty() {
        return search == null && sentiment == null && dateFrom == null && dateTo == null
                && city == null && source == null;
    }

    private static Sentiment parseSentiment(String raw) {
        if (raw == null || raw.isBlank() || ALL.equalsIgnoreCase(raw.trim())) {
            return null;
        }
        return Sentiment.parse(raw)
                .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_SENTIMENT_FILTER));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
