package com.library.management.dto.response;

import java.time.Instant;

public record TransactionResponse(
    Long id,
    Long userId,
    Long bookId,
    String bookTitle,
    String isbn,
    Instant borrowDate,
    Instant returnDate,
    boolean returned,
    Instant createdAt,
    Instant updatedAt
) {}
