package com.nosota.assetpay.api.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Phase requested by the remote ledger through the transaction callback.
 *
 * <p>The wire name is what travels in the {@code state} query parameter of the callback URI.
 * Lookup by wire name is exact and case-sensitive.
 */
public enum TransactionPhase {
    /**
     * ENACT: place the hold on the local asset once the ledger has reserved the funds.
     */
    ENACT("enact"),

    /**
     * CONSUME: finalize the hold, the ledger has committed the transfer.
     */
    CONSUME("consume"),

    /**
     * CANCEL: release the hold, the ledger has abandoned the transfer.
     */
    CANCEL("cancel");

    private final String wireName;

    TransactionPhase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TransactionPhase> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(phase -> phase.wireName.equals(wireName))
                .findFirst();
    }
}
