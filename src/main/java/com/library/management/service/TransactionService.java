package com.library.management.service;

import com.library.management.dto.request.BorrowRequest;
import com.library.management.dto.request.CorrectTransactionRequest;
import com.library.management.dto.response.TransactionResponse;
import com.library.management.entity.Book;
import com.library.management.entity.BorrowTransaction;
import com.library.management.entity.User;
import com.library.management.exception.BookUnavailableException;
import com.library.management.exception.InvalidTransactionStateException;
import com.library.management.exception.ResourceNotFoundException;
import com.library.management.exception.TransactionAlreadyReturnedException;
import com.library.management.mapper.TransactionMapper;
import com.library.management.repository.BookRepository;
import com.library.management.repository.TransactionRepository;
import com.library.management.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class TransactionService {

    static final String OPEN_BOOK_CONSTRAINT = "ux_transactions_open_book";

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;
    private final BookRepository bookRepository;
    private final UserRepository userRepository;
    private final AvailabilityService availabilityService;

    /**
     * Lends a copy from the ISBN group of the requested book.
     *
     * <p>All copies of the group are row-locked before availability is counted, so two
     * concurrent borrows of the same title cannot both see the last free copy. The requested
     * copy is used when it is free; otherwise the lowest-id free copy of the group is lent.
     * If the partial unique index on open transactions still rejects the insert, the caller
     * gets the same {@link BookUnavailableException} as for a failed availability check.
     */
    @Transactional
    public TransactionResponse borrow(BorrowRequest request) {
        User user = userRepository.findById(request.userId())
            .orElseThrow(() -> new ResourceNotFoundException("User", request.userId()));
        Book requested = bookRepository.findById(request.bookId())
            .orElseThrow(() -> new ResourceNotFoundException("Book", request.bookId()));
        String isbn = requested.getIsbn();

        List<Book> copies = bookRepository.findAllByIsbnForUpdate(isbn);
        CopyAvailability availability = availabilityService.forIsbn(isbn);
        if (!availability.hasAvailableCopies()) {
            log.debug("Borrow of book {} refused: {} of {} copies of isbn {} are out",
                request.bookId(), availability.borrowedCopies(), availability.totalCopies(), isbn);
            throw new BookUnavailableException();
        }

        Book copy = selectCopy(requested, copies, transactionRepository.findOpenBookIdsByIsbn(isbn));

        BorrowTransaction transaction = new BorrowTransaction();
        transaction.setUser(user);
        transaction.setBook(copy);
        transaction.setBorrowDate(request.borrowDate() != null ? request.borrowDate() : Instant.now());
        transaction.setReturned(false);

        BorrowTransaction saved;
        try {
            saved = transactionRepository.saveAndFlush(transaction);
        } catch (DataIntegrityViolationException ex) {
            if (!isOpenBookConflict(ex)) {
                throw ex;
            }
            log.warn("Borrow of book {} lost a race on copy {}", request.bookId(), copy.getId());
            throw new BookUnavailableException(ex);
        }

        log.info("User {} borrowed copy {} (isbn {}) in transaction {}",
            user.getId(), copy.getId(), isbn, saved.getId());
        return TransactionMapper.toResponse(saved);
    }

    @Transactional
    public TransactionResponse returnBook(Long transactionId) {
        BorrowTransaction transaction = loadWithDetails(transactionId);

        if (transaction.isReturned()) {
            throw new TransactionAlreadyReturnedException(transactionId);
        }

        transaction.setReturned(true);
        transaction.setReturnDate(Instant.now());
        BorrowTransaction saved = transactionRepository.saveAndFlush(transaction);

        log.info("Transaction {} closed, copy {} is available again",
            transactionId, saved.getBook().getId());
        return TransactionMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public TransactionResponse findById(Long transactionId) {
        return TransactionMapper.toResponse(loadWithDetails(transactionId));
    }

    @Transactional(readOnly = true)
    public Page<TransactionResponse> findByUser(Long userId, Boolean returned, Pageable pageable) {
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId);
        }
        Specification<BorrowTransaction> spec = Specification
            .where(TransactionService.<BorrowTransaction>byReference("user", userId))
            .and(hasReturned(returned));
        return transactionRepository.findAll(spec, pageable)
            .map(TransactionMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<TransactionResponse> findByBook(Long bookId, Boolean returned, Pageable pageable) {
        if (!bookRepository.existsById(bookId)) {
            throw new ResourceNotFoundException("Book", bookId);
        }
        Specification<BorrowTransaction> spec = Specification
            .where(TransactionService.<BorrowTransaction>byReference("book", bookId))
            .and(hasReturned(returned));
        return transactionRepository.findAll(spec, pageable)
            .map(TransactionMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public Page<TransactionResponse> findAll(Boolean returned, Pageable pageable) {
        return transactionRepository.findAll(Specification.where(hasReturned(returned)), pageable)
            .map(TransactionMapper::toResponse);
    }

    /**
     * Admin correction of dates or closing state. A returned transaction is never reopened:
     * reopening would put a copy back on loan without the availability check.
     */
    @Transactional
    public TransactionResponse correct(Long transactionId, CorrectTransactionRequest request) {
        BorrowTransaction transaction = loadWithDetails(transactionId);

        if (Boolean.FALSE.equals(request.returned()) && transaction.isReturned()) {
            throw new InvalidTransactionStateException(transactionId,
                "a returned transaction cannot be reopened");
        }

        if (request.borrowDate() != null) {
            transaction.setBorrowDate(request.borrowDate());
        }

        if (Boolean.TRUE.equals(request.returned()) && transaction.isOpen()) {
            transaction.setReturned(true);
            transaction.setReturnDate(request.returnDate() != null ? request.returnDate() : Instant.now());
        } else if (request.returnDate() != null) {
            if (transaction.isOpen()) {
                throw new InvalidTransactionStateException(transactionId,
                    "an open transaction has no return date");
            }
            transaction.setReturnDate(request.returnDate());
        }

        if (transaction.getReturnDate() != null
                && transaction.getReturnDate().isBefore(transaction.getBorrowDate())) {
            throw new InvalidTransactionStateException(transactionId,
                "return date precedes borrow date");
        }

        BorrowTransaction saved = transactionRepository.saveAndFlush(transaction);
        log.info("Transaction {} corrected (returned={})", transactionId, saved.isReturned());
        return TransactionMapper.toResponse(saved);
    }

    @Transactional
    public void delete(Long transactionId) {
        BorrowTransaction transaction = transactionRepository.findById(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
        transactionRepository.delete(transaction);
        log.info("Transaction {} deleted", transactionId);
    }

    private BorrowTransaction loadWithDetails(Long transactionId) {
        return transactionRepository.findByIdWithDetails(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
    }

    private static Book selectCopy(Book requested, List<Book> copies, List<Long> openBookIds) {
        Set<Long> onLoan = new HashSet<>(openBookIds);
        if (!onLoan.contains(requested.getId())) {
            return requested;
        }
        return copies.stream()
            .filter(copy -> !onLoan.contains(copy.getId()))
            .findFirst()
            .orElseThrow(BookUnavailableException::new);
    }

    private static boolean isOpenBookConflict(DataIntegrityViolationException ex) {
        return ex.getCause() instanceof ConstraintViolationException cve
            && OPEN_BOOK_CONSTRAINT.equalsIgnoreCase(cve.getConstraintName());
    }

    private static <T> Specification<T> byReference(String association, Long id) {
        return (root, query, cb) -> cb.equal(root.get(association).get("id"), id);
    }

    private static Specification<BorrowTransaction> hasReturned(Boolean returned) {
        if (returned == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("returned"), returned);
    }
}
