package com.library.management.exception;

public class TransactionAlreadyReturnedException extends RuntimeException {

    public TransactionAlreadyReturnedException(Long transactionId) {
        super("Transaction " + transactionId + " has already been returned");
    }
}
