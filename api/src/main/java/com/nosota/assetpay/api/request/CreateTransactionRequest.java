package com.nosota.assetpay.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Request DTO for recording a new asset transaction before it is submitted to the ledger.
 *
 * <p>All fields are fixed at creation time. The amount is not checked for positivity here,
 * that decision belongs to the module initiating the transfer.
 *
 * @param transactionId       globally unique identifier chosen by the initiator
 * @param payerId             account paying for the asset
 * @param payerName           display name of the payer (max 255 characters)
 * @param payeeId             account receiving the funds
 * @param payeeName           display name of the payee (max 255 characters)
 * @param amount              amount in the ledger's smallest unit
 * @param transactionType     numeric transaction type code
 * @param transactionTypeName human readable label for the type code
 * @param subscriptionDebit   true when the transfer debits a recurring subscription
 * @param subscriptionId      subscription being debited, null otherwise
 * @param partId              object the asset belongs to
 * @param partName            object name
 * @param partDescription     object description
 * @param categoryId          delivery folder used for copy sales
 * @param localId             region-local object id, optional
 * @param saleType            sale type code (original, copy, contents)
 */
public record CreateTransactionRequest(
        @NotNull(message = "Transaction ID is required")
        UUID transactionId,

        @NotNull(message = "Payer ID is required")
        UUID payerId,

        @Size(max = 255, message = "Payer name must be at most 255 characters")
        String payerName,

        @NotNull(message = "Payee ID is required")
        UUID payeeId,

        @Size(max = 255, message = "Payee name must be at most 255 characters")
        String payeeName,

        @NotNull(message = "Amount is required")
        Integer amount,

        @NotNull(message = "Transaction type is required")
        Integer transactionType,

        String transactionTypeName,

        boolean subscriptionDebit,

        UUID subscriptionId,

        UUID partId,

        String partName,

        String partDescription,

        UUID categoryId,

        Long localId,

        Integer saleType
) {
}
