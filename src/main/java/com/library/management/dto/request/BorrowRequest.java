package com.library.management.dto.request;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record BorrowRequest(

    @NotNull(message = "User ID is required")
    Long userId,

    @NotNull(message = "Book ID is required")
    Long bookId,

    /** Defaults to the time of the request when omitted. */
    Instant borrowDate
) {}
