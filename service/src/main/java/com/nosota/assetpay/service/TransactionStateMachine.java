package com.nosota.assetpay.service;

import com.nosota.assetpay.api.model.TransactionPhase;
import com.nosota.assetpay.api.model.TransactionState;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating TransactionState transitions.
 *
 * <p>State diagram:
 * <pre>
 *   CREATED ──► ENACTED ──► CONSUMED
 *      │           │
 *      └───────────┴──────► CANCELED
 * </pre>
 *
 * <p>CONSUMED and CANCELED are final. A transaction can never be both, and never leaves either.
 */
@Component
public class TransactionStateMachine {

    /**
     * Map of allowed transitions: fromState → Set of valid toState values.
     */
    private static final Map<TransactionState, Set<TransactionState>> ALLOWED_TRANSITIONS = Map.of(
            TransactionState.CREATED, EnumSet.of(TransactionState.ENACTED, TransactionState.CANCELED),
            TransactionState.ENACTED, EnumSet.of(TransactionState.CONSUMED, TransactionState.CANCELED)
    );

    /**
     * Validates if a state transition is allowed.
     *
     * @param fromState Current state
     * @param toState   Target state
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(TransactionState fromState, TransactionState toState) {
        if (fromState == null || toState == null) {
            return false;
        }
        Set<TransactionState> allowedTargets = ALLOWED_TRANSITIONS.get(fromState);
        return allowedTargets != null && allowedTargets.contains(toState);
    }

    /**
     * Validates if a state transition is allowed, throwing exception if not.
     *
     * @param fromState Current state
     * @param toState   Target state
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(TransactionState fromState, TransactionState toState) {
        if (!isTransitionAllowed(fromState, toState)) {
            throw new IllegalStateException(
                    String.format("Invalid transaction state transition: %s → %s. Allowed transitions from %s: %s",
                            fromState, toState, fromState, getAllowedTransitions(fromState)));
        }
    }

    /**
     * Checks if a state is final (no further transitions allowed).
     */
    public boolean isFinalState(TransactionState state) {
        return switch (state) {
            case CONSUMED, CANCELED -> true;
            case CREATED, ENACTED -> false;
        };
    }

    /**
     * State a transaction reaches when the given phase succeeds.
     */
    public TransactionState targetStateOf(TransactionPhase phase) {
        return switch (phase) {
            case ENACT -> TransactionState.ENACTED;
            case CONSUME -> TransactionState.CONSUMED;
            case CANCEL -> TransactionState.CANCELED;
        };
    }

    public Set<TransactionState> getAllowedTransitions(TransactionState fromState) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromState, Set.of());
    }
}
