package com.library.management.mapper;

import com.library.management.dto.request.CreateBookRequest;
import com.library.management.dto.request.UpdateBookRequest;
import com.library.management.dto.response.BookResponse;
import com.library.management.entity.Author;
import com.library.management.entity.Book;

public final class BookMapper {

    private BookMapper() {}

    /** The author association is resolved by the service, not here. */
    public static Book toEntity(CreateBookRequest request) {
        Book book = new Book();
        book.setTitle(request.title());
        book.setIsbn(request.isbn().trim());
        book.setDescription(request.description());
        book.setPublishedYear(request.publishedYear());
        return book;
    }

    public static BookResponse toResponse(Book book) {
        Author author = book.getAuthor();
        BookResponse.AuthorSummary authorSummary = author != null
            ? new BookResponse.AuthorSummary(author.getId(), author.getName())
            : null;

        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getIsbn(),
            book.getDescription(),
            book.getPublishedYear(),
            authorSummary,
            book.getCreatedAt(),
            book.getUpdatedAt()
        );
    }

    public static void updateEntity(Book book, UpdateBookRequest request) {
        if (request.title() != null) {
            book.setTitle(request.title());
        }
        if (request.isbn() != null) {
            book.setIsbn(request.isbn().trim());
        }
        if (request.description() != null) {
            book.setDescription(request.description());
        }
        if (request.publishedYear() != null) {
            book.setPublishedYear(request.publishedYear());
        }
    }
}
