package com.library.management.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Copy counts of an ISBN group. {@code bookId} and {@code title} are present only when the
 * group was looked up through one of its copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailabilityResponse(
    Long bookId,
    String title,
    String isbn,
    long totalCopies,
    long borrowedCopies,
    long availableCopies,
    boolean available
) {}
