package ru.tigran.employeeinsights.service;

import ru.tigran.employeeinsights.dto.Sentiment;

/**
 * Picks the single label shown for a group of feedback records.
 * Ties resolve positive first, then negative; a group with no positive or negative share is neutral.
 */
public final class DominantSentiment {

    private DominantSentiment() {
    }

    public static Sentiment of(double positivePercentage, double negativePercentage, double neutralPercentage) {
        if (positivePercentage > 0
                && positivePercentage >= negativePercentage
                && positivePercentage >= neutralPercentage) {
            return Sentiment.POSITIVE;
        }
        if (negativePercentage > 0
                && negativePercentage >= positivePercentage
                && negativePercentage >= neutralPercentage) {
            return Sentiment.NEGATIVE;
        }
        return Sentiment.NEUTRAL;
    }
}
