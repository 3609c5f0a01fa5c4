package com.nosota.assetpay.callback;

/**
 * Outcome of a phase: whether it was handled, and the message reported back to the ledger.
 */
public record PhaseOutcome(boolean success, String message) {

    public static PhaseOutcome success(String message) {
        return new PhaseOutcome(true, message);
    }

    public static PhaseOutcome failure(String message) {
        return new PhaseOutcome(false, message);
    }
}
