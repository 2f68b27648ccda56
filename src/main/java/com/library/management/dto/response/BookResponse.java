package com.library.management.dto.response;

import java.time.Instant;

public record BookResponse(
    Long id,
    String title,
    String isbn,
    String description,
    Integer publishedYear,
    AuthorSummary author,
    Instant createdAt,
    Instant updatedAt
) {
    public record AuthorSummary(Long id, String name) {}
}
