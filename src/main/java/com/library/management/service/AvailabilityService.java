package com.library.management.service;

import com.library.management.dto.response.AvailabilityResponse;
import com.library.management.entity.Book;
import com.library.management.exception.ResourceNotFoundException;
import com.library.management.mapper.AvailabilityMapper;
import com.library.management.repository.BookRepository;
import com.library.management.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Derives copy counts from the {@code books} and {@code transactions} tables on every call.
 * There is no stored counter to keep in sync: closing a transaction is enough to make its
 * copy available again.
 */
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final BookRepository bookRepository;
    private final TransactionRepository transactionRepository;

    /** An ISBN without any copies is reported as 0/0, not as an error. */
    @Transactional(readOnly = true)
    public CopyAvailability forIsbn(String isbn) {
        long total = bookRepository.countByIsbn(isbn);
        if (total == 0) {
            return CopyAvailability.empty(isbn);
        }
        long borrowed = transactionRepository.countOpenByIsbn(isbn);
        return new CopyAvailability(isbn, total, borrowed);
    }

    @Transactional(readOnly = true)
    public AvailabilityResponse checkBook(Long bookId) {
        Book book = bookRepository.findById(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book", bookId));
        return AvailabilityMapper.toResponse(book, forIsbn(book.getIsbn()));
    }

    @Transactional(readOnly = true)
    public AvailabilityResponse checkIsbn(String isbn) {
        return AvailabilityMapper.toResponse(forIsbn(isbn.trim()));
    }
}
