package com.library.management.exception;

public class BookUnavailableException extends RuntimeException {

    public static final String MESSAGE = "No available copies of this book to borrow";

    public BookUnavailableException() {
        super(MESSAGE);
    }

    public BookUnavailableException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
