package com.library.management.exception;

public class DuplicateValueException extends RuntimeException {

    public DuplicateValueException(String field, String value) {
        super(field + " already exists: " + value);
    }
}
