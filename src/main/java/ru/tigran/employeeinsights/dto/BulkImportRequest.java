package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Bulk payload for both import modes. Elements stay untyped so that one malformed
 * element is counted as an error instead of failing the whole request.
 */
public record BulkImportRequest(
        @NotNull(message = "data must be an array of records")
        @Schema(description = "Raw records with the keys sourceData, employeeName, date, witel, kota, "
                + "originalInsight, sentenceInsight, wordInsight, sentimen")
        List<JsonNode> data
) {
}
