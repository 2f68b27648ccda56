package com.library.management.exception;

public class InvalidTransactionStateException extends RuntimeException {

    public InvalidTransactionStateException(Long transactionId, String reason) {
        super("Transaction " + transactionId + " cannot be changed: " + reason);
    }
}
