package com.library.management.mapper;

import com.library.management.dto.response.AvailabilityResponse;
import com.library.management.entity.Book;
import com.library.management.service.CopyAvailability;

public final class AvailabilityMapper {

    private AvailabilityMapper() {}

    public static AvailabilityResponse toResponse(CopyAvailability availability) {
        return toResponse(null, null, availability);
    }

    public static AvailabilityResponse toResponse(Book book, CopyAvailability availability) {
        return toResponse(book.getId(), book.getTitle(), availability);
    }

    private static AvailabilityResponse toResponse(Long bookId, String title,
                                                   CopyAvailability availability) {
        return new AvailabilityResponse(
            bookId,
            title,
            availability.isbn(),
            availability.totalCopies(),
            availability.borrowedCopies(),
            availability.availableCopies(),
            availability.hasAvailableCopies()
        );
    }
}
