package com.nosota.assetpay.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * Synchronous answer of the remote ledger to a submitted transaction.
 *
 * @param success            whether the ledger accepted the transaction
 * @param status             ledger status string
 * @param reason             ledger reason string, may be empty
 * @param payerEndingBalance payer balance after the transfer, null when the ledger did not report one
 */
public record LedgerResponseRequest(
        @NotNull(message = "Success flag is required")
        Boolean success,

        String status,

        String reason,

        Integer payerEndingBalance
) {
}
