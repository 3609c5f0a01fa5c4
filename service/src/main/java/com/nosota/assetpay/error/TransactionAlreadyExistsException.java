package com.nosota.assetpay.error;

/**
 * Thrown when a transaction is created with an identifier that is already recorded.
 * Another process owns that transaction; the caller must not proceed with it.
 */
public class TransactionAlreadyExistsException extends Exception {
    public TransactionAlreadyExistsException(String message) {
        super(message);
    }
}
