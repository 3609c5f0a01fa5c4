package com.nosota.assetpay.registry;

import com.nosota.assetpay.error.DuplicateTransactionRecordException;
import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.repository.AssetTransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory registry of asset transactions in front of the store.
 *
 * <p>Holds two maps, each guarded by its own monitor:
 * <ul>
 *   <li><b>known</b>: transactions that have not reached a final state, written through to the store.
 *       Entries leave only after a successful consume or cancel.</li>
 *   <li><b>pending</b>: transactions with a phase request in flight. A pure fence, never read as a cache.</li>
 * </ul>
 *
 * <p>A monitor is held only for the check-and-mutate on its map. Store calls and asset callbacks
 * always run outside both monitors so a slow transaction never blocks unrelated ones.
 */
@Component
@Slf4j
public class TransactionRegistry {

    private final AssetTransactionRepository repository;

    private final Map<UUID, AssetTransaction> known = new HashMap<>();
    private final Map<UUID, AssetTransaction> pending = new HashMap<>();

    public TransactionRegistry(AssetTransactionRepository repository) {
        this.repository = repository;
    }

    /**
     * Resolves a transaction from the cache, falling back to the store.
     *
     * <p>A row found in the store is cached before it is returned. If another thread cached the
     * same transaction in the meantime, that instance wins so every caller mutates one object.
     *
     * @param transactionId transaction identifier
     * @return the transaction, or empty when nothing is stored under this identifier
     * @throws DuplicateTransactionRecordException if the store holds more than one row for the identifier
     */
    public Optional<AssetTransaction> get(UUID transactionId) {
        AssetTransaction cached;
        synchronized (known) {
            cached = known.get(transactionId);
        }
        if (cached != null) {
            return Optional.of(cached);
        }

        log.debug("Looking for stored transaction {}", transactionId);
        List<AssetTransaction> rows = repository.findAllByTransactionId(transactionId);

        switch (rows.size()) {
            case 0:
                log.debug("Could not find transaction matching transactionId={}", transactionId);
                return Optional.empty();
            case 1:
                AssetTransaction stored = rows.get(0);
                log.debug("Found stored transaction: transactionId={}, payerId={}, payeeId={}, state={}",
                        stored.getTransactionId(), stored.getPayerId(), stored.getPayeeId(), stored.getState());
                synchronized (known) {
                    AssetTransaction raced = known.putIfAbsent(transactionId, stored);
                    return Optional.of(raced != null ? raced : stored);
                }
            default:
                log.error("Data integrity fault: {} rows stored for transactionId={}", rows.size(), transactionId);
                throw new DuplicateTransactionRecordException(transactionId, rows.size());
        }
    }

    /**
     * Registers and stores a freshly built transaction.
     *
     * <p>The identifier is checked twice: once against the cache and the store without a lock, then again
     * under the known-map monitor right before insertion. The first check never caches what it finds. A unique-constraint violation on insert
     * (another instance stored it first) also counts as a duplicate.
     *
     * @param candidate transaction built with {@link AssetTransaction#newTransaction()}
     * @return the registered transaction, or empty if the identifier is already taken
     * @throws DataAccessException if the insert fails for any other reason; nothing is registered then
     */
    public Optional<AssetTransaction> create(AssetTransaction candidate) {
        UUID transactionId = candidate.getTransactionId();

        if (exists(transactionId)) {
            log.warn("Transaction {} already exists, refusing to create it again", transactionId);
            return Optional.empty();
        }

        synchronized (known) {
            if (known.containsKey(transactionId)) {
                log.warn("Transaction {} was registered concurrently, refusing to create it again", transactionId);
                return Optional.empty();
            }
            known.put(transactionId, candidate);
        }

        try {
            repository.save(candidate);
        } catch (DataIntegrityViolationException e) {
            evict(transactionId);
            log.warn("Transaction {} already stored by another owner: {}", transactionId, e.getMostSpecificCause().getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            evict(transactionId);
            throw e;
        }

        log.info("Created transaction: transactionId={}, payerId={}, payeeId={}, amount={}, type={}",
                transactionId, candidate.getPayerId(), candidate.getPayeeId(),
                candidate.getAmount(), candidate.getTransactionType());
        return Optional.of(candidate);
    }

    private boolean exists(UUID transactionId) {
        synchronized (known) {
            if (known.containsKey(transactionId)) {
                return true;
            }
        }
        return !repository.findAllByTransactionId(transactionId).isEmpty();
    }

    /**
     * Writes the transaction through to the store.
     *
     * <p>A failed write is logged and flagged on the record instead of thrown: by the time this runs
     * the asset callback has usually changed external state already. Flagged records stay cached
     * until {@link com.nosota.assetpay.service.TransactionReconciliationService} stores them.
     *
     * @param transaction transaction to store
     * @return true if the row was written
     */
    public boolean store(AssetTransaction transaction) {
        try {
            repository.save(transaction);
            transaction.setAwaitingStore(false);
            return true;
        } catch (DataAccessException e) {
            transaction.setAwaitingStore(true);
            log.error("Failed to store transaction {} in state {}, keeping it cached: {}",
                    transaction.getTransactionId(), transaction.getState(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Drops a transaction from the known cache. The stored row is untouched.
     */
    public void evict(UUID transactionId) {
        synchronized (known) {
            known.remove(transactionId);
        }
    }

    /**
     * Claims the processing fence for a transaction.
     *
     * @return false if another phase request for the same transaction is in flight
     */
    public boolean claim(AssetTransaction transaction) {
        synchronized (pending) {
            if (pending.containsKey(transaction.getTransactionId())) {
                return false;
            }
            pending.put(transaction.getTransactionId(), transaction);
            return true;
        }
    }

    /**
     * Releases the processing fence for a transaction.
     */
    public void release(UUID transactionId) {
        synchronized (pending) {
            pending.remove(transactionId);
        }
    }

    public boolean isCached(UUID transactionId) {
        synchronized (known) {
            return known.containsKey(transactionId);
        }
    }

    public boolean isClaimed(UUID transactionId) {
        synchronized (pending) {
            return pending.containsKey(transactionId);
        }
    }

    /**
     * True when the fence for this transaction is held through this very instance.
     */
    public boolean isClaimedBy(AssetTransaction transaction) {
        synchronized (pending) {
            return pending.get(transaction.getTransactionId()) == transaction;
        }
    }

    /**
     * Cached transactions whose last write-through failed.
     */
    public List<AssetTransaction> findAwaitingStore() {
        List<AssetTransaction> result = new ArrayList<>();
        synchronized (known) {
            for (AssetTransaction transaction : known.values()) {
                if (transaction.isAwaitingStore()) {
                    result.add(transaction);
                }
            }
        }
        return result;
    }
}
