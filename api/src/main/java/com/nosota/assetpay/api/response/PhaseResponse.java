package com.nosota.assetpay.api.response;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Body returned to the remote ledger for a phase callback.
 *
 * <p>{@code success=false} with {@code reason="pending"} is the only retryable failure.
 */
public record PhaseResponse(
        String transactionId,
        String state,
        boolean success,
        String reason
) {
    public static final String PENDING = "pending";

    @JsonIgnore
    public boolean isRetryable() {
        return !success && PENDING.equals(reason);
    }
}
