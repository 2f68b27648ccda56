package com.library.management.mapper;

import com.library.management.dto.request.CreateAuthorRequest;
import com.library.management.dto.request.UpdateAuthorRequest;
import com.library.management.dto.response.AuthorResponse;
import com.library.management.entity.Author;

import java.util.Collections;
import java.util.List;

public final class AuthorMapper {

    private AuthorMapper() {}

    public static Author toEntity(CreateAuthorRequest request) {
        Author author = new Author();
        author.setName(request.name());
        author.setEmail(request.email());
        author.setBio(request.bio());
        author.setBirthDate(request.birthDate());
        author.setNationality(request.nationality());
        author.setWebsite(request.website());
        return author;
    }

    public static AuthorResponse toResponse(Author author) {
        List<AuthorResponse.BookSummary> books = author.getBooks() != null
            ? author.getBooks().stream()
                .map(book -> new AuthorResponse.BookSummary(
                    book.getId(), book.getTitle(), book.getIsbn(), book.getPublishedYear()))
                .toList()
            : Collections.emptyList();

        return new AuthorResponse(
            author.getId(),
            author.getName(),
            author.getEmail(),
            author.getBio(),
            author.getBirthDate(),
            author.getNationality(),
            author.getWebsite(),
            books,
            author.getCreatedAt(),
            author.getUpdatedAt()
        );
    }

    public static void updateEntity(Author author, UpdateAuthorRequest request) {
        if (request.name() != null) {
            author.setName(request.name());
        }
        if (request.email() != null) {
            author.setEmail(request.email());
        }
        if (request.bio() != null) {
            author.setBio(request.bio());
        }
        if (request.birthDate() != null) {
            author.setBirthDate(request.birthDate());
        }
        if (request.nationality() != null) {
            author.setNationality(request.nationality());
        }
        if (request.website() != null) {
            author.setWebsite(request.website());
        }
    }
}
