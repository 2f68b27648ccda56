package com.library.management.service;

/**
 * Copy counts of one ISBN group as of a single read of the ledger.
 *
 * <p>{@code borrowedCopies} never exceeds {@code totalCopies}: every open transaction
 * points at a distinct copy of the group ({@code ux_transactions_open_book}).
 */
public record CopyAvailability(String isbn, long totalCopies, long borrowedCopies) {

    public static CopyAvailability empty(String isbn) {
        return new CopyAvailability(isbn, 0, 0);
    }

    public long availableCopies() {
        return totalCopies - borrowedCopies;
    }

    public boolean hasAvailableCopies() {
        return availableCopies() > 0;
    }
}
