package com.library.management.dto.request;

import java.time.Instant;

/** Admin correction of a ledger entry. {@code null} components are left unchanged. */
public record CorrectTransactionRequest(
    Instant borrowDate,
    Instant returnDate,
    Boolean returned
) {}
