package com.nosota.assetpay.model;

/**
 * Status of the local hold placed on an asset while its payment is in flight.
 */
public enum AssetHoldStatus {
    /**
     * Asset reserved for the payer, not yet delivered.
     */
    HELD,

    /**
     * Asset delivered to the payer. Final.
     */
    DELIVERED,

    /**
     * Hold released without delivery. Final.
     */
    RELEASED
}
