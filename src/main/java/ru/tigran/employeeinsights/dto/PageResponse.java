package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of results. {@code page} is 1-based.
 */
public record PageResponse<T>(List<T> items, Pagination pagination) {

    public record Pagination(
            int page,
            int limit,
            long total,
            @JsonProperty("total_pages") int totalPages
    ) {
    }
}
