package com.nosota.assetpay.service;

import com.nosota.assetpay.api.model.TransactionState;
import com.nosota.assetpay.callback.PhaseOutcome;
import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.registry.TransactionRegistry;
import com.nosota.assetpay.support.RecordingAssetCallback;
import com.nosota.assetpay.support.TestTransactions;
import com.nosota.assetpay.support.TestTransactions.InMemoryRows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.nosota.assetpay.service.TransactionPhaseService.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

class TransactionPhaseServiceTest {

    private InMemoryRows store;
    private TransactionRegistry registry;
    private TransactionPhaseService phaseService;
    private RecordingAssetCallback callback;
    private ExecutorService executor;

    private UUID transactionId;

    @BeforeEach
    void setUp() {
        store = new InMemoryRows();
        registry = new TransactionRegistry(store.repository());
        phaseService = new TransactionPhaseService(registry, new TransactionStateMachine());
        callback = new RecordingAssetCallback();
        executor = Executors.newFixedThreadPool(8);

        transactionId = UUID.randomUUID();
        registry.create(TestTransactions.newTransaction(transactionId));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PhaseOutcome request(String phase) {
        return phaseService.processPhaseRequest(transactionId.toString(), phase, callback);
    }

    private AssetTransaction stored() {
        return store.rows().get(transactionId).get(0);
    }

    // ==================== Happy paths ====================

    @Test
    @DisplayName("Enact then consume settles the transaction and evicts it")
    void enactThenConsume_ShouldSettle() {
        PhaseOutcome enacted = request("enact");
        assertThat(enacted).isEqualTo(PhaseOutcome.success("held"));
        assertThat(stored().getState()).isEqualTo(TransactionState.ENACTED);
        assertThat(stored().getEnactedAt()).isNotNull();
        assertThat(registry.isCached(transactionId)).isTrue();

        PhaseOutcome consumed = request("consume");
        assertThat(consumed).isEqualTo(PhaseOutcome.success("delivered"));
        assertThat(stored().getState()).isEqualTo(TransactionState.CONSUMED);
        assertThat(stored().getFinishedAt()).isNotNull();

        assertThat(registry.isCached(transactionId)).isFalse();
        assertThat(registry.isClaimed(transactionId)).isFalse();
        assertThat(callback.enactCalls()).isEqualTo(1);
        assertThat(callback.consumeCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Enact then cancel releases the hold and keeps the enacted timestamp")
    void enactThenCancel_ShouldCancel() {
        request("enact");
        LocalDateTime enactedAt = stored().getEnactedAt();

        PhaseOutcome canceled = request("cancel");

        assertThat(canceled).isEqualTo(PhaseOutcome.success("released"));
        assertThat(stored().getState()).isEqualTo(TransactionState.CANCELED);
        assertThat(stored().isEnacted()).isTrue();
        assertThat(stored().getEnactedAt()).isEqualTo(enactedAt);
        assertThat(registry.isCached(transactionId)).isFalse();
    }

    @Test
    @DisplayName("Cancel before enact still runs the callback")
    void cancelBeforeEnact_ShouldRunCallback() {
        PhaseOutcome canceled = request("cancel");

        assertThat(canceled.success()).isTrue();
        assertThat(callback.cancelCalls()).isEqualTo(1);
        assertThat(stored().getState()).isEqualTo(TransactionState.CANCELED);
        assertThat(stored().isEnacted()).isFalse();
    }

    // ==================== Idempotence ====================

    @Test
    @DisplayName("Repeated enact is acknowledged without a second callback")
    void repeatedEnact_ShouldNotCallBackAgain() {
        request("enact");
        LocalDateTime enactedAt = stored().getEnactedAt();

        PhaseOutcome repeated = request("enact");

        assertThat(repeated).isEqualTo(PhaseOutcome.success(ENACT_ALREADY_ENACTED));
        assertThat(callback.enactCalls()).isEqualTo(1);
        assertThat(stored().getEnactedAt()).isEqualTo(enactedAt);
    }

    @Test
    @DisplayName("Repeated consume and cancel on settled transactions are acknowledged")
    void repeatedFinalPhases_ShouldBeAcknowledged() {
        request("enact");
        request("consume");

        assertThat(request("consume")).isEqualTo(PhaseOutcome.success(CONSUME_ALREADY_CONSUMED));
        assertThat(request("enact")).isEqualTo(PhaseOutcome.success(ENACT_ALREADY_CONSUMED));
        assertThat(callback.consumeCalls()).isEqualTo(1);
        assertThat(callback.enactCalls()).isEqualTo(1);

        UUID canceledId = UUID.randomUUID();
        registry.create(TestTransactions.newTransaction(canceledId));
        phaseService.processPhaseRequest(canceledId.toString(), "cancel", callback);

        assertThat(phaseService.processPhaseRequest(canceledId.toString(), "cancel", callback))
                .isEqualTo(PhaseOutcome.success(CANCEL_ALREADY_CANCELED));
        assertThat(callback.cancelCalls()).isEqualTo(1);
    }

    // ==================== Ordering ====================

    @Test
    @DisplayName("Consume before enact is rejected and leaves the state alone")
    void consumeBeforeEnact_ShouldBeRejected() {
        PhaseOutcome outcome = request("consume");

        assertThat(outcome).isEqualTo(PhaseOutcome.failure(CONSUME_NOT_YET_ENACTED));
        assertThat(callback.consumeCalls()).isZero();
        assertThat(stored().getState()).isEqualTo(TransactionState.CREATED);
    }

    @Test
    @DisplayName("Consume and cancel never both succeed")
    void consumeAndCancel_ShouldBeExclusive() {
        request("enact");
        request("consume");

        assertThat(request("cancel")).isEqualTo(PhaseOutcome.failure(CANCEL_ALREADY_CONSUMED));

        UUID otherId = UUID.randomUUID();
        registry.create(TestTransactions.newTransaction(otherId));
        phaseService.processPhaseRequest(otherId.toString(), "enact", callback);
        phaseService.processPhaseRequest(otherId.toString(), "cancel", callback);

        assertThat(phaseService.processPhaseRequest(otherId.toString(), "consume", callback))
                .isEqualTo(PhaseOutcome.failure(CONSUME_ALREADY_CANCELED));
        assertThat(phaseService.processPhaseRequest(otherId.toString(), "enact", callback))
                .isEqualTo(PhaseOutcome.failure(ENACT_ALREADY_CANCELED));
        assertThat(callback.consumeCalls()).isEqualTo(1);
    }

    // ==================== Request validation ====================

    @Nested
    @DisplayName("Requests that never reach the callback")
    class Rejections {

        @Test
        void unknownTransaction_ShouldNotBeFenced() {
            UUID unknown = UUID.randomUUID();

            PhaseOutcome outcome = phaseService.processPhaseRequest(unknown.toString(), "enact", callback);

            assertThat(outcome).isEqualTo(PhaseOutcome.failure(NO_MATCHING_TRANSACTION));
            assertThat(registry.isClaimed(unknown)).isFalse();
            assertThat(callback.totalCalls()).isZero();
        }

        @Test
        void malformedId_ShouldCountAsNotFound() {
            assertThat(phaseService.processPhaseRequest("not-a-uuid", "enact", callback))
                    .isEqualTo(PhaseOutcome.failure(NO_MATCHING_TRANSACTION));
            assertThat(phaseService.processPhaseRequest(null, "enact", callback))
                    .isEqualTo(PhaseOutcome.failure(NO_MATCHING_TRANSACTION));
            assertThat(phaseService.processPhaseRequest("", "enact", callback))
                    .isEqualTo(PhaseOutcome.failure(NO_MATCHING_TRANSACTION));
        }

        @Test
        void unrecognizedPhase_ShouldReleaseFence() {
            PhaseOutcome outcome = request("ENACT");

            assertThat(outcome).isEqualTo(PhaseOutcome.failure(UNRECOGNIZED_STATE_REQUEST));
            assertThat(registry.isClaimed(transactionId)).isFalse();
            assertThat(callback.totalCalls()).isZero();
            assertThat(stored().getState()).isEqualTo(TransactionState.CREATED);
        }
    }

    // ==================== Callback failures ====================

    @Test
    @DisplayName("Declined enact leaves the transaction in CREATED so it can be retried")
    void declinedEnact_ShouldLeaveStateAlone() {
        callback.onEnact(transaction -> PhaseOutcome.failure("Insufficient stock"));

        PhaseOutcome outcome = request("enact");

        assertThat(outcome).isEqualTo(PhaseOutcome.failure("Insufficient stock"));
        assertThat(stored().getState()).isEqualTo(TransactionState.CREATED);
        assertThat(stored().getEnactedAt()).isNull();

        callback.onEnact(transaction -> PhaseOutcome.success("held"));
        assertThat(request("enact").success()).isTrue();
        assertThat(callback.enactCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Callback exception propagates and the fence is released")
    void throwingCallback_ShouldReleaseFence() {
        callback.onConsume(transaction -> {
            throw new IllegalStateException("inventory offline");
        });
        request("enact");

        assertThatThrownBy(() -> request("consume"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("inventory offline");
        assertThat(registry.isClaimed(transactionId)).isFalse();
        assertThat(stored().getState()).isEqualTo(TransactionState.ENACTED);
    }

    @Test
    void nullOutcome_ShouldBeRejected() {
        callback.onEnact(transaction -> null);

        assertThatThrownBy(() -> request("enact")).isInstanceOf(NullPointerException.class);
        assertThat(registry.isClaimed(transactionId)).isFalse();
    }

    // ==================== Persistence failure ====================

    @Test
    @DisplayName("Final transition that fails to store stays cached and flagged")
    void finalTransitionNotStored_ShouldStayCached() {
        request("enact");
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(store.repository()).save(any(AssetTransaction.class));

        PhaseOutcome outcome = request("cancel");

        assertThat(outcome.success()).isTrue();
        assertThat(registry.isCached(transactionId)).isTrue();
        assertThat(registry.findAwaitingStore()).hasSize(1);
        assertThat(registry.get(transactionId)).hasValueSatisfying(
                transaction -> assertThat(transaction.getState()).isEqualTo(TransactionState.CANCELED));

        assertThat(request("cancel")).isEqualTo(PhaseOutcome.success(CANCEL_ALREADY_CANCELED));
        assertThat(callback.cancelCalls()).isEqualTo(1);
    }

    // ==================== Mutual exclusion ====================

    @Test
    @DisplayName("Request arriving while another is in flight answers pending")
    void concurrentRequest_ShouldAnswerPending() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        callback.onEnact(transaction -> {
            entered.countDown();
            await(proceed);
            return PhaseOutcome.success("held");
        });

        Future<PhaseOutcome> first = executor.submit(() -> request("enact"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(request("enact")).isEqualTo(PhaseOutcome.failure(PENDING));
        assertThat(request("cancel")).isEqualTo(PhaseOutcome.failure(PENDING));

        proceed.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(PhaseOutcome.success("held"));

        assertThat(request("enact")).isEqualTo(PhaseOutcome.success(ENACT_ALREADY_ENACTED));
        assertThat(callback.enactCalls()).isEqualTo(1);
        assertThat(callback.cancelCalls()).isZero();
    }

    @Test
    @DisplayName("Request turned away by the fence does not leave a reloaded settled row cached")
    void pendingRequest_ShouldNotRecacheSettledRow() {
        UUID settledId = UUID.randomUUID();
        AssetTransaction stored = TestTransactions.newTransaction(settledId);
        stored.moveTo(TransactionState.CANCELED, LocalDateTime.now());
        store.seed(stored);
        // the fence holder works on its own instance, already evicted from the cache
        registry.claim(TestTransactions.newTransaction(settledId));

        PhaseOutcome outcome = phaseService.processPhaseRequest(settledId.toString(), "cancel", callback);

        assertThat(outcome).isEqualTo(PhaseOutcome.failure(PENDING));
        assertThat(registry.isCached(settledId)).isFalse();
        assertThat(registry.isClaimed(settledId)).isTrue();
        assertThat(callback.totalCalls()).isZero();
    }

    @Test
    @DisplayName("Request turned away by the fence keeps the holder's cached instance")
    void pendingRequest_ShouldKeepHolderInstance() {
        request("enact");
        AssetTransaction cached = registry.get(transactionId).orElseThrow();
        registry.claim(cached);
        cached.moveTo(TransactionState.CONSUMED, LocalDateTime.now());

        assertThat(request("consume")).isEqualTo(PhaseOutcome.failure(PENDING));
        assertThat(registry.isCached(transactionId)).isTrue();
    }

    @Test
    @DisplayName("Racing enact requests reach the callback exactly once")
    void racingRequests_ShouldCallBackOnce() throws Exception {
        int requests = 16;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PhaseOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < requests; i++) {
            futures.add(executor.submit(() -> {
                await(start);
                return request("enact");
            }));
        }

        start.countDown();

        for (Future<PhaseOutcome> future : futures) {
            PhaseOutcome outcome = future.get(5, TimeUnit.SECONDS);
            assertThat(outcome).isIn(
                    PhaseOutcome.success("held"),
                    PhaseOutcome.success(ENACT_ALREADY_ENACTED),
                    PhaseOutcome.failure(PENDING));
        }
        assertThat(callback.enactCalls()).isEqualTo(1);
        assertThat(stored().getState()).isEqualTo(TransactionState.ENACTED);
        assertThat(registry.isClaimed(transactionId)).isFalse();
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
