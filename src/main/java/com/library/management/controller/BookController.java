package com.library.management.controller;

import com.library.management.dto.request.CreateBookRequest;
import com.library.management.dto.request.UpdateBookRequest;
import com.library.management.dto.response.AvailabilityResponse;
import com.library.management.dto.response.BookResponse;
import com.library.management.dto.response.PagedResponse;
import com.library.management.service.AvailabilityService;
import com.library.management.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Physical book copies and their availability")
public class BookController {

    private final BookService bookService;
    private final AvailabilityService availabilityService;

    @GetMapping
    @Operation(summary = "List book copies",
               description = "Filters: title/ISBN substring, author, and only copies that are not currently borrowed.")
    public ResponseEntity<PagedResponse<BookResponse>> findAll(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Long authorId,
            @RequestParam(defaultValue = "false") boolean availableOnly,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            bookService.findAll(search, authorId, availableOnly, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book copy by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @GetMapping("/{id}/availability")
    @Operation(summary = "Availability of the copy's ISBN group",
               description = "Counts every copy sharing this book's ISBN and how many of them are out.")
    @ApiResponse(responseCode = "200", description = "Availability computed")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<AvailabilityResponse> availability(@PathVariable Long id) {
        return ResponseEntity.ok(availabilityService.checkBook(id));
    }

    @GetMapping("/availability")
    @Operation(summary = "Availability by ISBN", description = "An unknown ISBN reports zero copies.")
    public ResponseEntity<AvailabilityResponse> availabilityByIsbn(@RequestParam String isbn) {
        return ResponseEntity.ok(availabilityService.checkIsbn(isbn));
    }

    @PostMapping
    @Operation(summary = "Add a book copy", description = "Several copies may share one ISBN. Admin only.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Author not found")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.create(request));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a book copy", description = "Partial update, null fields are ignored. Admin only.")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "404", description = "Book or author not found")
    public ResponseEntity<BookResponse> update(@PathVariable Long id,
                                               @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(bookService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a book copy", description = "Returns 409 if the copy has any borrowing history.")
    @ApiResponse(responseCode = "204", description = "Book deleted")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "Book has borrowing history")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        bookService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
