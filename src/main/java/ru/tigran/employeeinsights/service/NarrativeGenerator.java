package ru.tigran.employeeinsights.service;

import ru.tigran.employeeinsights.dto.InsightContext;

/**
 * Writes a natural-language conclusion about the figures of a dashboard page.
 */
public interface NarrativeGenerator {

    /**
     * @throws ru.tigran.employeeinsights.exception.AIGatewayException if no conclusion could be produced
     */
    String generate(InsightContext context);
}
