package com.library.management.controller;

import com.library.management.dto.request.BorrowRequest;
import com.library.management.dto.request.CorrectTransactionRequest;
import com.library.management.dto.response.PagedResponse;
import com.library.management.dto.response.TransactionResponse;
import com.library.management.security.AccessGuard;
import com.library.management.security.LibraryUserDetails;
import com.library.management.service.TransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
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
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
@Tag(name = "Transactions", description = "Borrow and return book copies")
public class TransactionController {

    private final TransactionService transactionService;
    private final AccessGuard accessGuard;

    @PostMapping
    @Operation(summary = "Borrow a book",
               description = "Lends the requested copy, or another free copy with the same ISBN. "
                   + "Regular users may only borrow for themselves.")
    @ApiResponse(responseCode = "201", description = "Transaction opened")
    @ApiResponse(responseCode = "400", description = "No available copies of this book to borrow")
    @ApiResponse(responseCode = "403", description = "Borrowing on behalf of another user")
    @ApiResponse(responseCode = "404", description = "User or book not found")
    public ResponseEntity<TransactionResponse> borrow(@AuthenticationPrincipal LibraryUserDetails actor,
                                                      @Valid @RequestBody BorrowRequest request) {
        accessGuard.requireSelfOrAdmin(actor, request.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(transactionService.borrow(request));
    }

    @PostMapping("/{id}/return")
    @Operation(summary = "Return a borrowed book")
    @ApiResponse(responseCode = "200", description = "Transaction closed")
    @ApiResponse(responseCode = "404", description = "Transaction not found")
    @ApiResponse(responseCode = "409", description = "Transaction already returned")
    public ResponseEntity<TransactionResponse> returnBook(@AuthenticationPrincipal LibraryUserDetails actor,
                                                          @PathVariable Long id) {
        TransactionResponse existing = transactionService.findById(id);
        accessGuard.requireSelfOrAdmin(actor, existing.userId());
        return ResponseEntity.ok(transactionService.returnBook(id));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get transaction by ID")
    @ApiResponse(responseCode = "200", description = "Transaction found")
    @ApiResponse(responseCode = "404", description = "Transaction not found")
    public ResponseEntity<TransactionResponse> findById(@AuthenticationPrincipal LibraryUserDetails actor,
                                                        @PathVariable Long id) {
        TransactionResponse transaction = transactionService.findById(id);
        accessGuard.requireSelfOrAdmin(actor, transaction.userId());
        return ResponseEntity.ok(transaction);
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "List a user's transactions")
    public ResponseEntity<PagedResponse<TransactionResponse>> findByUser(
            @AuthenticationPrincipal LibraryUserDetails actor,
            @PathVariable Long userId,
            @Parameter(description = "true: closed only, false: open only, omitted: all")
            @RequestParam(required = false) Boolean isReturned,
            Pageable pageable) {
        accessGuard.requireSelfOrAdmin(actor, userId);
        return ResponseEntity.ok(PagedResponse.from(
            transactionService.findByUser(userId, isReturned, pageable)));
    }

    @GetMapping("/book/{bookId}")
    @Operation(summary = "List a copy's transactions", description = "Admin only.")
    public ResponseEntity<PagedResponse<TransactionResponse>> findByBook(
            @PathVariable Long bookId,
            @RequestParam(required = false) Boolean isReturned,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(
            transactionService.findByBook(bookId, isReturned, pageable)));
    }

    @GetMapping
    @Operation(summary = "List all transactions", description = "Admin only.")
    public ResponseEntity<PagedResponse<TransactionResponse>> findAll(
            @RequestParam(required = false) Boolean isReturned,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(transactionService.findAll(isReturned, pageable)));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Correct a transaction",
               description = "Admin only. Can close an open transaction but never reopen a closed one.")
    @ApiResponse(responseCode = "200", description = "Transaction corrected")
    @ApiResponse(responseCode = "404", description = "Transaction not found")
    @ApiResponse(responseCode = "409", description = "Invalid state change")
    public ResponseEntity<TransactionResponse> correct(@PathVariable Long id,
                                                       @RequestBody CorrectTransactionRequest request) {
        return ResponseEntity.ok(transactionService.correct(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a transaction", description = "Admin only.")
    @ApiResponse(responseCode = "204", description = "Transaction deleted")
    @ApiResponse(responseCode = "404", description = "Transaction not found")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        transactionService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
