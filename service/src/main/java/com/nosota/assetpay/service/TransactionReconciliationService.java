package com.nosota.assetpay.service;

import com.nosota.assetpay.api.model.TransactionState;
import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.registry.TransactionRegistry;
import com.nosota.assetpay.repository.AssetTransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Housekeeping for the two gaps the phase protocol leaves open.
 *
 * <ul>
 *   <li><b>Unstored transitions</b>: a phase whose write-through failed stays cached and flagged.
 *       {@link #retryUnstoredTransactions()} writes it again and evicts it once it is final.</li>
 *   <li><b>Stale holds</b>: the protocol has no timeout, a transaction waits in CREATED or ENACTED
 *       until the ledger calls back. {@link #reportStaleTransactions()} only reports them;
 *       settling them is up to reconciliation against the ledger.</li>
 * </ul>
 */
@Service
@Slf4j
public class TransactionReconciliationService {

    private static final EnumSet<TransactionState> OPEN_STATES = EnumSet.of(TransactionState.CREATED, TransactionState.ENACTED);

    private final TransactionRegistry registry;
    private final TransactionStateMachine stateMachine;
    private final AssetTransactionRepository repository;
    private final Duration staleAfter;

    public TransactionReconciliationService(TransactionRegistry registry,
                                            TransactionStateMachine stateMachine,
                                            AssetTransactionRepository repository,
                                            @Value("${scheduler.reconciliation.stale-after:PT24H}") Duration staleAfter) {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.repository = repository;
        this.staleAfter = staleAfter;
    }

    /**
     * Stores cached transactions whose last write-through failed.
     *
     * <p>Each transaction is fenced while it is written so a phase request cannot run concurrently;
     * transactions with a request in flight are left for the next run.
     *
     * @return number of transactions stored
     */
    public int retryUnstoredTransactions() {
        List<AssetTransaction> unstored = registry.findAwaitingStore();
        int stored = 0;

        for (AssetTransaction transaction : unstored) {
            if (!registry.claim(transaction)) {
                log.debug("Transaction {} is being processed, retrying store later", transaction.getTransactionId());
                continue;
            }
            try {
                if (registry.store(transaction)) {
                    stored++;
                    if (stateMachine.isFinalState(transaction.getState())) {
                        registry.evict(transaction.getTransactionId());
                    }
                }
            } finally {
                registry.release(transaction.getTransactionId());
            }
        }

        if (stored > 0) {
            log.info("Stored {} of {} transactions awaiting store", stored, unstored.size());
        }
        return stored;
    }

    /**
     * Logs every stored transaction that has been waiting in CREATED or ENACTED longer than the threshold.
     *
     * @return stale transactions found
     */
    public List<AssetTransaction> reportStaleTransactions() {
        LocalDateTime cutoff = LocalDateTime.now().minus(staleAfter);
        List<AssetTransaction> stale = repository.findAllByStateInAndCreatedAtBeforeOrderByCreatedAtAsc(OPEN_STATES, cutoff);

        for (AssetTransaction transaction : stale) {
            log.warn("Stale transaction: transactionId={}, state={}, createdAt={}, enactedAt={}, submitted={}, responseReceived={}",
                    transaction.getTransactionId(), transaction.getState(), transaction.getCreatedAt(),
                    transaction.getEnactedAt(), transaction.isSubmitted(), transaction.isResponseReceived());
        }
        return stale;
    }
}
