package com.nosota.assetpay.repository;

import com.nosota.assetpay.api.model.TransactionState;
import com.nosota.assetpay.model.AssetTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface AssetTransactionRepository extends JpaRepository<AssetTransaction, Integer> {

    /**
     * Finds every stored row for a transaction identifier.
     *
     * <p>The unique constraint on {@code transaction_id} means the result holds zero or one row;
     * callers treat anything more as a data-integrity fault.
     *
     * @param transactionId transaction identifier
     * @return matching rows
     */
    List<AssetTransaction> findAllByTransactionId(UUID transactionId);

    /**
     * Finds transactions still waiting in one of the given states that were created before the cutoff.
     * Used by the stale transaction report.
     *
     * @param states  non-final states to look at
     * @param cutoff  creation time threshold
     * @return stale transactions, oldest first
     */
    List<AssetTransaction> findAllByStateInAndCreatedAtBeforeOrderByCreatedAtAsc(
            Collection<TransactionState> states, LocalDateTime cutoff);
}
