package com.library.management.unit.service;

import com.library.management.dto.request.CreateBookRequest;
import com.library.management.dto.request.UpdateBookRequest;
import com.library.management.dto.response.BookResponse;
import com.library.management.entity.Author;
import com.library.management.entity.Book;
import com.library.management.exception.ResourceInUseException;
import com.library.management.exception.ResourceNotFoundException;
import com.library.management.repository.AuthorRepository;
import com.library.management.repository.BookRepository;
import com.library.management.repository.TransactionRepository;
import com.library.management.service.BookService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookServiceTest {

    @Mock
    private BookRepository bookRepository;

    @Mock
    private AuthorRepository authorRepository;

    @Mock
    private TransactionRepository transactionRepository;

    @InjectMocks
    private BookService bookService;

    @Test
    void findById_whenExists_returnsBookWithAuthor() {
        Book book = createTestBook(1L, "Effective Java", "9780134685991");
        book.setAuthor(createTestAuthor(10L, "Joshua Bloch"));
        when(bookRepository.findByIdWithAuthor(1L)).thenReturn(Optional.of(book));

        BookResponse response = bookService.findById(1L);

        assertThat(response.title()).isEqualTo("Effective Java");
        assertThat(response.author().id()).isEqualTo(10L);
        assertThat(response.author().name()).isEqualTo("Joshua Bloch");
    }

    @Test
    void findById_whenNotFound_throwsResourceNotFoundException() {
        when(bookRepository.findByIdWithAuthor(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookService.findById(99L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Book")
            .hasMessageContaining("99");
    }

    @Test
    @SuppressWarnings("unchecked")
    void findAll_returnsMappedPage() {
        Pageable pageable = PageRequest.of(0, 10);
        Page<Book> page = new PageImpl<>(List.of(createTestBook(1L, "Effective Java", "9780134685991")),
            pageable, 1);
        when(bookRepository.findAll(any(Specification.class), eq(pageable))).thenReturn(page);

        Page<BookResponse> result = bookService.findAll("java", null, true, pageable);

        assertThat(result.getTotalElements()).isEqualTo(1);
        assertThat(result.getContent().get(0).isbn()).isEqualTo("9780134685991");
    }

    @Test
    void create_withAuthor_resolvesAuthorAndTrimsIsbn() {
        Author author = createTestAuthor(10L, "Joshua Bloch");
        when(authorRepository.findById(10L)).thenReturn(Optional.of(author));
        when(bookRepository.save(any(Book.class))).thenAnswer(invocation -> {
            Book saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 1L);
            return saved;
        });

        BookResponse response = bookService.create(
            new CreateBookRequest("Effective Java", " 9780134685991 ", null, 2018, 10L));

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.isbn()).isEqualTo("9780134685991");
        assertThat(response.author().name()).isEqualTo("Joshua Bloch");
    }

    @Test
    void create_withUnknownAuthor_throwsAndDoesNotSave() {
        when(authorRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookService.create(
                new CreateBookRequest("Effective Java", "9780134685991", null, 2018, 99L)))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Author");

        verify(bookRepository, never()).save(any());
    }

    @Test
    void update_appliesOnlyProvidedFields() {
        Book book = createTestBook(1L, "Effective Java", "9780134685991");
        book.setPublishedYear(2008);
        when(bookRepository.findByIdWithAuthor(1L)).thenReturn(Optional.of(book));
        when(bookRepository.saveAndFlush(book)).thenReturn(book);

        BookResponse response = bookService.update(1L,
            new UpdateBookRequest(null, null, "Third edition", 2018, null));

        assertThat(response.title()).isEqualTo("Effective Java");
        assertThat(response.description()).isEqualTo("Third edition");
        assertThat(response.publishedYear()).isEqualTo(2018);
    }

    @Test
    void delete_withBorrowingHistory_throwsResourceInUseException() {
        Book book = createTestBook(1L, "Effective Java", "9780134685991");
        when(bookRepository.findById(1L)).thenReturn(Optional.of(book));
        when(transactionRepository.existsByBookId(1L)).thenReturn(true);

        assertThatThrownBy(() -> bookService.delete(1L))
            .isInstanceOf(ResourceInUseException.class)
            .hasMessageContaining("borrowing history");

        verify(bookRepository, never()).delete(any(Book.class));
    }

    @Test
    void delete_withoutHistory_deletesBook() {
        Book book = createTestBook(1L, "Effective Java", "9780134685991");
        when(bookRepository.findById(1L)).thenReturn(Optional.of(book));
        when(transactionRepository.existsByBookId(1L)).thenReturn(false);

        bookService.delete(1L);

        verify(bookRepository).delete(book);
    }

    private Book createTestBook(Long id, String title, String isbn) {
        Book book = new Book();
        ReflectionTestUtils.setField(book, "id", id);
        book.setTitle(title);
        book.setIsbn(isbn);
        return book;
    }

    private Author createTestAuthor(Long id, String name) {
        Author author = new Author();
        ReflectionTestUtils.setField(author, "id", id);
        author.setName(name);
        return author;
    }
}
