package com.nosota.assetpay.error;

import java.util.UUID;

/**
 * More than one stored row carries the same transaction identifier.
 *
 * <p>Creation checks make this impossible, so seeing it means the store is corrupt.
 * It is never handled by the phase processing path.
 */
public class DuplicateTransactionRecordException extends RuntimeException {

    private final UUID transactionId;
    private final int rowCount;

    public DuplicateTransactionRecordException(UUID transactionId, int rowCount) {
        super(String.format("Failed to find exactly one transaction for %s: %d rows stored", transactionId, rowCount));
        this.transactionId = transactionId;
        this.rowCount = rowCount;
    }

    public UUID getTransactionId() {
        return transactionId;
    }

    public int getRowCount() {
        return rowCount;
    }
}
