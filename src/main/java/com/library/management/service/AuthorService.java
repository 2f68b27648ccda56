package com.library.management.service;

import com.library.management.dto.request.CreateAuthorRequest;
import com.library.management.dto.request.UpdateAuthorRequest;
import com.library.management.dto.response.AuthorResponse;
import com.library.management.entity.Author;
import com.library.management.exception.DuplicateValueException;
import com.library.management.exception.ResourceInUseException;
import com.library.management.exception.ResourceNotFoundException;
import com.library.management.mapper.AuthorMapper;
import com.library.management.repository.AuthorRepository;
import com.library.management.repository.BookRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuthorService {

    private final AuthorRepository authorRepository;
    private final BookRepository bookRepository;

    @Transactional(readOnly = true)
    public Page<AuthorResponse> findAll(String search, String nationality, Pageable pageable) {
        Specification<Author> spec = Specification.where(null);

        if (search != null && !search.isBlank()) {
            String pattern = SearchPatterns.containing(search);
            spec = spec.and((root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("name")), pattern, SearchPatterns.ESCAPE),
                cb.like(cb.lower(root.get("email")), pattern, SearchPatterns.ESCAPE)));
        }
        if (nationality != null && !nationality.isBlank()) {
            String pattern = SearchPatterns.containing(nationality);
            spec = spec.and((root, query, cb) ->
                cb.like(cb.lower(root.get("nationality")), pattern, SearchPatterns.ESCAPE));
        }

        return authorRepository.findAll(spec, pageable)
            .map(AuthorMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public AuthorResponse findById(Long id) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));
        return AuthorMapper.toResponse(author);
    }

    @Transactional
    public AuthorResponse create(CreateAuthorRequest request) {
        if (request.email() != null && authorRepository.existsByEmail(request.email())) {
            throw new DuplicateValueException("Author email", request.email());
        }
        Author saved = authorRepository.save(AuthorMapper.toEntity(request));
        return AuthorMapper.toResponse(saved);
    }

    @Transactional
    public AuthorResponse update(Long id, UpdateAuthorRequest request) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));

        if (request.email() != null && !request.email().equals(author.getEmail())
                && authorRepository.existsByEmailAndIdNot(request.email(), id)) {
            throw new DuplicateValueException("Author email", request.email());
        }

        AuthorMapper.updateEntity(author, request);
        return AuthorMapper.toResponse(authorRepository.saveAndFlush(author));
    }

    @Transactional
    public void delete(Long id) {
        Author author = authorRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));

        if (bookRepository.existsByAuthorId(id)) {
            throw new ResourceInUseException(
                "Cannot delete an author who still has books. Delete or reassign the books first.");
        }

        authorRepository.delete(author);
    }
}
