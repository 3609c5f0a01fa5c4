package com.nosota.assetpay.model;

import com.nosota.assetpay.api.model.TransactionState;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Asset transaction entity - one row per attempted currency transfer for an asset.
 *
 * <p>The economic and asset fields are fixed when the record is built and have no setters.
 * Only the ledger response bookkeeping, the state and its timestamps change afterwards.
 *
 * <p>Rows are never deleted: once a transaction reaches CONSUMED or CANCELED it leaves the
 * in-memory registry but stays here for audit.
 *
 * <p>Use {@link #newTransaction()} to build a fresh record for
 * {@link com.nosota.assetpay.registry.TransactionRegistry#create(AssetTransaction)}.
 */
@Entity
@Table(name = "asset_transaction")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AssetTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "transaction_id", nullable = false, unique = true, updatable = false)
    private UUID transactionId;

    // ==================== Transfer ====================

    @Column(name = "payer_id", nullable = false, updatable = false)
    private UUID payerId;

    @Column(name = "payer_name", updatable = false)
    private String payerName;

    @Column(name = "payee_id", nullable = false, updatable = false)
    private UUID payeeId;

    @Column(name = "payee_name", updatable = false)
    private String payeeName;

    @Column(name = "amount", nullable = false, updatable = false)
    private Integer amount;

    @Column(name = "transaction_type", nullable = false, updatable = false)
    private Integer transactionType;

    @Column(name = "transaction_type_name", updatable = false)
    private String transactionTypeName;

    @Column(name = "subscription_debit", nullable = false, updatable = false)
    private boolean subscriptionDebit;

    @Column(name = "subscription_id", updatable = false)
    private UUID subscriptionId;

    // ==================== Asset ====================

    @Column(name = "part_id", updatable = false)
    private UUID partId;

    @Column(name = "part_name", updatable = false)
    private String partName;

    @Column(name = "part_description", updatable = false)
    private String partDescription;

    /**
     * Delivery folder, used when the sale type is a copy.
     */
    @Column(name = "category_id", updatable = false)
    private UUID categoryId;

    /**
     * Region-local object id. Not every initiator knows it.
     */
    @Column(name = "local_id", updatable = false)
    private Long localId;

    @Column(name = "sale_type", updatable = false)
    private Integer saleType;

    // ==================== Ledger response ====================

    @Setter
    @Column(name = "submitted", nullable = false)
    private boolean submitted;

    @Column(name = "response_received", nullable = false)
    private boolean responseReceived;

    @Column(name = "response_success", nullable = false)
    private boolean responseSuccess;

    @Column(name = "response_status")
    private String responseStatus;

    @Column(name = "response_reason")
    private String responseReason;

    /**
     * Payer balance reported by the ledger after the transfer, -1 until known.
     */
    @Column(name = "payer_ending_balance", nullable = false)
    private Integer payerEndingBalance;

    // ==================== Lifecycle ====================

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private TransactionState state;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "enacted_at")
    private LocalDateTime enactedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    /**
     * Set when the last write-through failed; the record must stay cached until it is stored.
     */
    @Transient
    @Setter
    private volatile boolean awaitingStore;

    @Builder(builderMethodName = "newTransaction")
    private AssetTransaction(UUID transactionId,
                             UUID payerId, String payerName,
                             UUID payeeId, String payeeName,
                             Integer amount,
                             Integer transactionType, String transactionTypeName,
                             boolean subscriptionDebit, UUID subscriptionId,
                             UUID partId, String partName, String partDescription,
                             UUID categoryId, Long localId, Integer saleType) {
        this.transactionId = transactionId;
        this.payerId = payerId;
        this.payerName = payerName;
        this.payeeId = payeeId;
        this.payeeName = payeeName;
        this.amount = amount;
        this.transactionType = transactionType;
        this.transactionTypeName = transactionTypeName;
        this.subscriptionDebit = subscriptionDebit;
        this.subscriptionId = subscriptionId;
        this.partId = partId;
        this.partName = partName;
        this.partDescription = partDescription;
        this.categoryId = categoryId;
        this.localId = localId;
        this.saleType = saleType;

        this.submitted = false;
        this.responseReceived = false;
        this.responseSuccess = false;
        this.responseStatus = "";
        this.responseReason = "";
        this.payerEndingBalance = -1;

        this.state = TransactionState.CREATED;
        this.createdAt = LocalDateTime.now();
    }

    public Optional<Long> findLocalId() {
        return Optional.ofNullable(localId);
    }

    public boolean isEnacted() {
        return state == TransactionState.ENACTED
                || state == TransactionState.CONSUMED
                || (state == TransactionState.CANCELED && enactedAt != null);
    }

    public boolean isConsumed() {
        return state == TransactionState.CONSUMED;
    }

    public boolean isCanceled() {
        return state == TransactionState.CANCELED;
    }

    /**
     * Records the ledger's answer to the submission.
     * A null balance leaves the previous value in place.
     */
    public void recordLedgerResponse(boolean success, String status, String reason, Integer endingBalance) {
        this.responseReceived = true;
        this.responseSuccess = success;
        this.responseStatus = status != null ? status : "";
        this.responseReason = reason != null ? reason : "";
        if (endingBalance != null) {
            this.payerEndingBalance = endingBalance;
        }
    }

    /**
     * Moves the record to {@code target} and stamps the matching timestamp.
     * The caller validates the transition; timestamps already set are kept.
     */
    public void moveTo(TransactionState target, LocalDateTime at) {
        this.state = target;
        if (target == TransactionState.ENACTED && enactedAt == null) {
            enactedAt = at;
        } else if ((target == TransactionState.CONSUMED || target == TransactionState.CANCELED) && finishedAt == null) {
            finishedAt = at;
        }
    }
}
