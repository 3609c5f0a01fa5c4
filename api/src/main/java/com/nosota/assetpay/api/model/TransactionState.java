package com.nosota.assetpay.api.model;

/**
 * Lifecycle state of an asset transaction.
 *
 * <pre>
 *   CREATED ──► ENACTED ──► CONSUMED
 *      │           │
 *      └───────────┴──────► CANCELED
 * </pre>
 */
public enum TransactionState {
    /**
     * CREATED: recorded and persisted, no phase callback handled yet.
     */
    CREATED,

    /**
     * ENACTED: the asset hold is in place, waiting for the ledger to commit or abandon.
     */
    ENACTED,

    /**
     * CONSUMED: the transfer is committed and the asset delivered.
     * This is a final state.
     */
    CONSUMED,

    /**
     * CANCELED: the transfer was abandoned and any hold released.
     * This is a final state.
     */
    CANCELED
}
