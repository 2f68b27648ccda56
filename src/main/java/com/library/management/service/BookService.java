package com.library.management.service;

import com.library.management.dto.request.CreateBookRequest;
import com.library.management.dto.request.UpdateBookRequest;
import com.library.management.dto.response.BookResponse;
import com.library.management.entity.Author;
import com.library.management.entity.Book;
import com.library.management.entity.BorrowTransaction;
import com.library.management.exception.ResourceInUseException;
import com.library.management.exception.ResourceNotFoundException;
import com.library.management.mapper.BookMapper;
import com.library.management.repository.AuthorRepository;
import com.library.management.repository.BookRepository;
import com.library.management.repository.TransactionRepository;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class BookService {

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final TransactionRepository transactionRepository;

    /**
     * @param availableOnly when {@code true}, only copies without an open transaction are listed
     */
    @Transactional(readOnly = true)
    public Page<BookResponse> findAll(String search, Long authorId, boolean availableOnly,
                                      Pageable pageable) {
        Specification<Book> spec = Specification.where(null);

        if (search != null && !search.isBlank()) {
            String pattern = SearchPatterns.containing(search);
            spec = spec.and((root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("title")), pattern, SearchPatterns.ESCAPE),
                cb.like(cb.lower(root.get("isbn")), pattern, SearchPatterns.ESCAPE)));
        }
        if (authorId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("author").get("id"), authorId));
        }
        if (availableOnly) {
            spec = spec.and((root, query, cb) -> {
                Subquery<Long> open = query.subquery(Long.class);
                Root<BorrowTransaction> transaction = open.from(BorrowTransaction.class);
                open.select(transaction.get("id"))
                    .where(cb.equal(transaction.get("book"), root),
                           cb.isFalse(transaction.get("returned")));
                return cb.not(cb.exists(open));
            });
        }

        return bookRepository.findAll(spec, pageable)
            .map(BookMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public BookResponse findById(Long id) {
        Book book = bookRepository.findByIdWithAuthor(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        return BookMapper.toResponse(book);
    }

    @Transactional
    public BookResponse create(CreateBookRequest request) {
        Book book = BookMapper.toEntity(request);
        if (request.authorId() != null) {
            book.setAuthor(resolveAuthor(request.authorId()));
        }
        Book saved = bookRepository.save(book);
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public BookResponse update(Long id, UpdateBookRequest request) {
        Book book = bookRepository.findByIdWithAuthor(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        BookMapper.updateEntity(book, request);
        if (request.authorId() != null) {
            book.setAuthor(resolveAuthor(request.authorId()));
        }

        Book saved = bookRepository.saveAndFlush(book);
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public void delete(Long id) {
        Book book = bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        if (transactionRepository.existsByBookId(id)) {
            throw new ResourceInUseException("Cannot delete a book with borrowing history");
        }

        bookRepository.delete(book);
    }

    private Author resolveAuthor(Long authorId) {
        return authorRepository.findById(authorId)
            .orElseThrow(() -> new ResourceNotFoundException("Author", authorId));
    }
}
