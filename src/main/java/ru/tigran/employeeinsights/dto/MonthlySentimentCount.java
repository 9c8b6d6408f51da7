package ru.tigran.employeeinsights.dto;

/**
 * Number of records with one sentiment in one calendar month.
 */
public record MonthlySentimentCount(Integer year, Integer month, Sentiment sentiment, Long count) {
}
