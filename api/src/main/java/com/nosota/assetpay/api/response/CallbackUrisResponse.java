package com.nosota.assetpay.api.response;

import java.net.URI;
import java.util.UUID;

/**
 * Callback URIs the remote ledger should POST to for each phase of a transaction.
 */
public record CallbackUrisResponse(
        UUID transactionId,
        URI enact,
        URI consume,
        URI cancel
) {}
