package com.nosota.assetpay.service;

import com.nosota.assetpay.api.CallbackUris;
import com.nosota.assetpay.api.dto.AssetTransactionDTO;
import com.nosota.assetpay.api.request.CreateTransactionRequest;
import com.nosota.assetpay.api.request.LedgerResponseRequest;
import com.nosota.assetpay.api.response.CallbackUrisResponse;
import com.nosota.assetpay.error.TransactionAlreadyExistsException;
import com.nosota.assetpay.error.TransactionBusyException;
import com.nosota.assetpay.error.TransactionNotFoundException;
import com.nosota.assetpay.mapper.AssetTransactionMapper;
import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.registry.TransactionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.UUID;

/**
 * Record-keeping side of asset transactions, used by the module that initiates transfers:
 * creation, lookup, ledger submission bookkeeping and callback URIs.
 */
@Service
@Slf4j
public class AssetTransactionService {

    private final TransactionRegistry registry;
    private final TransactionStateMachine stateMachine;
    private final URI callbackBaseUri;

    public AssetTransactionService(TransactionRegistry registry,
                                   TransactionStateMachine stateMachine,
                                   @Value("${assetpay.callback-base-uri}") URI callbackBaseUri) {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.callbackBaseUri = callbackBaseUri;
    }

    /**
     * Records a new transaction and stores it.
     *
     * @throws TransactionAlreadyExistsException if the identifier is already recorded
     */
    public AssetTransactionDTO createTransaction(CreateTransactionRequest request) throws TransactionAlreadyExistsException {
        AssetTransaction candidate = AssetTransaction.newTransaction()
                .transactionId(request.transactionId())
                .payerId(request.payerId())
                .payerName(request.payerName())
                .payeeId(request.payeeId())
                .payeeName(request.payeeName())
                .amount(request.amount())
                .transactionType(request.transactionType())
                .transactionTypeName(request.transactionTypeName())
                .subscriptionDebit(request.subscriptionDebit())
                .subscriptionId(request.subscriptionId())
                .partId(request.partId())
                .partName(request.partName())
                .partDescription(request.partDescription())
                .categoryId(request.categoryId())
                .localId(request.localId())
                .saleType(request.saleType())
                .build();

        AssetTransaction created = registry.create(candidate)
                .orElseThrow(() -> new TransactionAlreadyExistsException(
                        "Transaction with ID " + request.transactionId() + " already exists"));
        return AssetTransactionMapper.INSTANCE.toDTO(created);
    }

    public AssetTransactionDTO getTransaction(UUID transactionId) throws TransactionNotFoundException {
        AssetTransaction transaction = find(transactionId);
        evictIfFinal(transaction);
        return AssetTransactionMapper.INSTANCE.toDTO(transaction);
    }

    /**
     * Marks the transaction as handed to the remote ledger.
     *
     * @throws TransactionBusyException if a phase request for the transaction is in flight
     */
    public AssetTransactionDTO markSubmitted(UUID transactionId)
            throws TransactionNotFoundException, TransactionBusyException {
        AssetTransaction transaction = find(transactionId);
        claim(transaction);
        try {
            transaction.setSubmitted(true);
            registry.store(transaction);
            evictIfSettled(transaction);
        } finally {
            registry.release(transactionId);
        }

        log.info("Transaction {} submitted to ledger", transactionId);
        return AssetTransactionMapper.INSTANCE.toDTO(transaction);
    }

    /**
     * Stores the ledger's synchronous answer to the submission.
     *
     * @throws TransactionBusyException if a phase request for the transaction is in flight
     */
    public AssetTransactionDTO recordLedgerResponse(UUID transactionId, LedgerResponseRequest response)
            throws TransactionNotFoundException, TransactionBusyException {
        AssetTransaction transaction = find(transactionId);
        claim(transaction);
        try {
            transaction.recordLedgerResponse(response.success(), response.status(), response.reason(),
                    response.payerEndingBalance());
            registry.store(transaction);
            evictIfSettled(transaction);
        } finally {
            registry.release(transactionId);
        }

        log.info("Ledger response for transaction {}: success={}, status={}, reason={}",
                transactionId, response.success(), response.status(), response.reason());
        return AssetTransactionMapper.INSTANCE.toDTO(transaction);
    }

    public CallbackUrisResponse getCallbackUris(UUID transactionId) throws TransactionNotFoundException {
        evictIfFinal(find(transactionId));
        return new CallbackUrisResponse(
                transactionId,
                CallbackUris.enact(callbackBaseUri, transactionId),
                CallbackUris.consume(callbackBaseUri, transactionId),
                CallbackUris.cancel(callbackBaseUri, transactionId));
    }

    private AssetTransaction find(UUID transactionId) throws TransactionNotFoundException {
        return registry.get(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction with ID " + transactionId + " not found"));
    }

    // writes share the phase fence so a bookkeeping save never overwrites a newer state
    private void claim(AssetTransaction transaction) throws TransactionBusyException {
        if (!registry.claim(transaction)) {
            if (!registry.isClaimedBy(transaction)) {
                evictIfSettled(transaction);
            }
            log.info("Transaction {} has a phase request in flight, refusing bookkeeping update",
                    transaction.getTransactionId());
            throw new TransactionBusyException(
                    "Transaction with ID " + transaction.getTransactionId() + " is being processed, retry later");
        }
    }

    // lookups load stored rows into the registry cache; settled ones must not stay there
    private void evictIfFinal(AssetTransaction transaction) {
        if (!registry.isClaimed(transaction.getTransactionId())) {
            evictIfSettled(transaction);
        }
    }

    private void evictIfSettled(AssetTransaction transaction) {
        if (stateMachine.isFinalState(transaction.getState()) && !transaction.isAwaitingStore()) {
            registry.evict(transaction.getTransactionId());
        }
    }
}
