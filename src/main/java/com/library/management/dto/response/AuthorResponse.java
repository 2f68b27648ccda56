package com.library.management.dto.response;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record AuthorResponse(
    Long id,
    String name,
    String email,
    String bio,
    LocalDate birthDate,
    String nationality,
    String website,
    List<BookSummary> books,
    Instant createdAt,
    Instant updatedAt
) {
    public record BookSummary(Long id, String title, String isbn, Integer publishedYear) {}
}
