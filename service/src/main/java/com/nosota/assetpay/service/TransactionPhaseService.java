package com.nosota.assetpay.service;

import com.nosota.assetpay.api.model.TransactionPhase;
import com.nosota.assetpay.api.model.TransactionState;
import com.nosota.assetpay.api.response.PhaseResponse;
import com.nosota.assetpay.callback.AssetCallback;
import com.nosota.assetpay.callback.PhaseOutcome;
import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.registry.TransactionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives asset transactions through the enact, consume and cancel phases requested by the ledger.
 *
 * <p>Per request:
 * <ol>
 *   <li>Resolve the transaction through the registry; unknown ids fail without fencing.</li>
 *   <li>Claim the processing fence; if another request for the same id is in flight answer {@code pending}.</li>
 *   <li>Dispatch to the phase handler.</li>
 *   <li>Evict the transaction from the registry cache once it is final and stored.</li>
 *   <li>Release the fence, whatever happened.</li>
 * </ol>
 *
 * <p>The fence serializes requests per transaction but does not order them. Ordering comes from the
 * handler preconditions, which either reject an out-of-order phase or acknowledge a repeated one
 * without calling the asset callback again.
 *
 * <p>Outcomes are returned, never thrown. The only exception that escapes is a data-integrity fault
 * raised by the registry, or whatever the asset callback itself throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionPhaseService {

    /**
     * Retryable failure. The ledger matches this text exactly, do not change it.
     */
    public static final String PENDING = PhaseResponse.PENDING;
    public static final String NO_MATCHING_TRANSACTION = "no matching transaction found";
    public static final String UNRECOGNIZED_STATE_REQUEST = "Unrecognized state request";

    public static final String ENACT_ALREADY_CANCELED = "Enact: already canceled";
    public static final String ENACT_ALREADY_CONSUMED = "Enact: already consumed";
    public static final String ENACT_ALREADY_ENACTED = "Enact: already enacted";
    public static final String CONSUME_ALREADY_CANCELED = "Consume: already canceled";
    public static final String CONSUME_NOT_YET_ENACTED = "Consume: not yet enacted";
    public static final String CONSUME_ALREADY_CONSUMED = "Consume: already consumed";
    public static final String CANCEL_ALREADY_CONSUMED = "Cancel: already consumed";
    public static final String CANCEL_ALREADY_CANCELED = "Cancel: already canceled";

    private final TransactionRegistry registry;
    private final TransactionStateMachine stateMachine;

    /**
     * Processes one phase request from the ledger.
     *
     * @param transactionId  transaction identifier as received; malformed ids are reported as not found
     * @param phaseName      phase wire name: enact, consume or cancel
     * @param assetCallback  subsystem holding the asset
     * @return phase outcome to echo back to the ledger
     */
    public PhaseOutcome processPhaseRequest(String transactionId, String phaseName, AssetCallback assetCallback) {
        Optional<AssetTransaction> found = parseTransactionId(transactionId).flatMap(registry::get);
        if (found.isEmpty()) {
            log.warn("Phase request '{}' for unknown transaction {}", phaseName, transactionId);
            return PhaseOutcome.failure(NO_MATCHING_TRANSACTION);
        }

        AssetTransaction transaction = found.get();
        UUID id = transaction.getTransactionId();

        if (!registry.claim(transaction)) {
            log.info("Phase request '{}' for transaction {} while another is in flight, answering pending", phaseName, id);
            // the lookup may have reloaded a settled row after the owner evicted it
            if (!registry.isClaimedBy(transaction)) {
                evictIfSettled(transaction);
            }
            return PhaseOutcome.failure(PENDING);
        }

        try {
            Optional<TransactionPhase> phase = TransactionPhase.fromWireName(phaseName);
            if (phase.isEmpty()) {
                log.warn("Unrecognized state request '{}' for transaction {}", phaseName, id);
                return PhaseOutcome.failure(UNRECOGNIZED_STATE_REQUEST);
            }

            PhaseOutcome outcome = switch (phase.get()) {
                case ENACT -> enactHold(transaction, assetCallback);
                case CONSUME -> consumeHold(transaction, assetCallback);
                case CANCEL -> cancelHold(transaction, assetCallback);
            };

            evictIfSettled(transaction);
            return outcome;
        } finally {
            registry.release(id);
        }
    }

    private PhaseOutcome enactHold(AssetTransaction transaction, AssetCallback assetCallback) {
        if (transaction.isCanceled()) {
            // delayed enact sent before the cancel
            return rejected(transaction, TransactionPhase.ENACT, ENACT_ALREADY_CANCELED);
        }
        if (transaction.isConsumed()) {
            return PhaseOutcome.success(ENACT_ALREADY_CONSUMED);
        }
        if (transaction.isEnacted()) {
            return PhaseOutcome.success(ENACT_ALREADY_ENACTED);
        }
        return apply(transaction, TransactionPhase.ENACT, assetCallback.enactHold(transaction));
    }

    private PhaseOutcome consumeHold(AssetTransaction transaction, AssetCallback assetCallback) {
        if (transaction.isCanceled()) {
            return rejected(transaction, TransactionPhase.CONSUME, CONSUME_ALREADY_CANCELED);
        }
        if (!transaction.isEnacted()) {
            return rejected(transaction, TransactionPhase.CONSUME, CONSUME_NOT_YET_ENACTED);
        }
        if (transaction.isConsumed()) {
            return PhaseOutcome.success(CONSUME_ALREADY_CONSUMED);
        }
        return apply(transaction, TransactionPhase.CONSUME, assetCallback.consumeHold(transaction));
    }

    private PhaseOutcome cancelHold(AssetTransaction transaction, AssetCallback assetCallback) {
        if (transaction.isConsumed()) {
            return rejected(transaction, TransactionPhase.CANCEL, CANCEL_ALREADY_CONSUMED);
        }
        if (transaction.isCanceled()) {
            return PhaseOutcome.success(CANCEL_ALREADY_CANCELED);
        }
        if (!transaction.isEnacted()) {
            // the callback still runs, only it knows whether partial work needs undoing
            log.debug("Canceling transaction {} before it was enacted", transaction.getTransactionId());
        }
        return apply(transaction, TransactionPhase.CANCEL, assetCallback.cancelHold(transaction));
    }

    private PhaseOutcome apply(AssetTransaction transaction, TransactionPhase phase, PhaseOutcome outcome) {
        Objects.requireNonNull(outcome, () -> "Asset callback returned no outcome for " + phase);

        if (!outcome.success()) {
            log.warn("Asset callback declined {} for transaction {}: {}",
                    phase.wireName(), transaction.getTransactionId(), outcome.message());
            return outcome;
        }

        TransactionState from = transaction.getState();
        TransactionState to = stateMachine.targetStateOf(phase);
        stateMachine.validateTransition(from, to);
        transaction.moveTo(to, LocalDateTime.now());
        registry.store(transaction);

        log.info("Transaction {} moved {} → {} (amount={}, payerId={}, payeeId={}, partId={})",
                transaction.getTransactionId(), from, to, transaction.getAmount(),
                transaction.getPayerId(), transaction.getPayeeId(), transaction.getPartId());
        log.debug("Transaction {} timestamps: createdAt={}, enactedAt={}, finishedAt={}",
                transaction.getTransactionId(), transaction.getCreatedAt(),
                transaction.getEnactedAt(), transaction.getFinishedAt());
        return outcome;
    }

    private void evictIfSettled(AssetTransaction transaction) {
        if (stateMachine.isFinalState(transaction.getState()) && !transaction.isAwaitingStore()) {
            registry.evict(transaction.getTransactionId());
        }
    }

    private PhaseOutcome rejected(AssetTransaction transaction, TransactionPhase phase, String message) {
        log.warn("Rejected out-of-order {} for transaction {} in state {}",
                phase.wireName(), transaction.getTransactionId(), transaction.getState());
        return PhaseOutcome.failure(message);
    }

    private static Optional<UUID> parseTransactionId(String transactionId) {
        if (transactionId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(transactionId.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("Malformed transaction id '{}': {}", transactionId, e.getMessage());
            return Optional.empty();
        }
    }
}
