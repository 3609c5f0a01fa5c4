package com.nosota.assetpay.error;

/**
 * A phase request for the transaction is in flight; the caller may retry.
 */
public class TransactionBusyException extends Exception {
    public TransactionBusyException(String message) {
        super(message);
    }
}
