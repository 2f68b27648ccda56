package com.library.management.mapper;

import com.library.management.dto.response.TransactionResponse;
import com.library.management.entity.Book;
import com.library.management.entity.BorrowTransaction;

public final class TransactionMapper {

    private TransactionMapper() {}

    public static TransactionResponse toResponse(BorrowTransaction transaction) {
        Book book = transaction.getBook();
        return new TransactionResponse(
            transaction.getId(),
            transaction.getUser().getId(),
            book.getId(),
            book.getTitle(),
            book.getIsbn(),
            transaction.getBorrowDate(),
            transaction.getReturnDate(),
            transaction.isReturned(),
            transaction.getCreatedAt(),
            transaction.getUpdatedAt()
        );
    }
}
