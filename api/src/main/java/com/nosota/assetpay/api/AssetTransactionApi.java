package com.nosota.assetpay.api;

import com.nosota.assetpay.api.dto.AssetTransactionDTO;
import com.nosota.assetpay.api.request.CreateTransactionRequest;
import com.nosota.assetpay.api.request.LedgerResponseRequest;
import com.nosota.assetpay.api.response.CallbackUrisResponse;
import com.nosota.assetpay.api.response.PhaseResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.UUID;

/**
 * Asset transaction API.
 *
 * <p>Two audiences:
 * <ul>
 *   <li>the remote ledger, which drives the enact/consume/cancel phases through {@link #processPhase}</li>
 *   <li>the initiating module, which records transactions and their ledger responses</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>AssetTransactionController - in service module (server-side implementation)</li>
 *   <li>AssetTransactionClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
public interface AssetTransactionApi {

    // ==================== Ledger Callback ====================

    /**
     * Processes a phase callback from the remote ledger.
     *
     * <p>Always answers HTTP 200; the outcome is carried in the body so the ledger can
     * tell a retryable {@code pending} from a final failure. A missing or malformed id reads as
     * no matching transaction.
     *
     * @param transactionId transaction identifier as sent by the ledger
     * @param state         phase wire name: enact, consume or cancel
     * @return phase outcome
     */
    @PostMapping(CallbackUris.CALLBACK_PATH)
    ResponseEntity<PhaseResponse> processPhase(
            @RequestParam(name = CallbackUris.ID_PARAM, required = false) String transactionId,
            @RequestParam(name = CallbackUris.STATE_PARAM, required = false) String state);

    // ==================== Transaction Records ====================

    /**
     * Records a new transaction.
     *
     * @param request immutable transaction fields
     * @return created transaction
     */
    @PostMapping("/api/v1/asset-transactions")
    ResponseEntity<AssetTransactionDTO> createTransaction(
            @RequestBody @Valid CreateTransactionRequest request) throws Exception;

    /**
     * Gets a transaction by its identifier.
     *
     * @param transactionId transaction identifier
     * @return transaction
     */
    @GetMapping("/api/v1/asset-transactions/{transactionId}")
    ResponseEntity<AssetTransactionDTO> getTransaction(
            @PathVariable("transactionId") UUID transactionId) throws Exception;

    /**
     * Marks a transaction as submitted to the remote ledger.
     *
     * @param transactionId transaction identifier
     * @return updated transaction
     */
    @PostMapping("/api/v1/asset-transactions/{transactionId}/submitted")
    ResponseEntity<AssetTransactionDTO> markSubmitted(
            @PathVariable("transactionId") UUID transactionId) throws Exception;

    /**
     * Records the synchronous answer of the remote ledger.
     *
     * @param transactionId transaction identifier
     * @param request       ledger answer
     * @return updated transaction
     */
    @PostMapping("/api/v1/asset-transactions/{transactionId}/ledger-response")
    ResponseEntity<AssetTransactionDTO> recordLedgerResponse(
            @PathVariable("transactionId") UUID transactionId,
            @RequestBody @Valid LedgerResponseRequest request) throws Exception;

    /**
     * Gets the callback URIs to hand to the remote ledger for a transaction.
     *
     * @param transactionId transaction identifier
     * @return enact, consume and cancel URIs
     */
    @GetMapping("/api/v1/asset-transactions/{transactionId}/callback-uris")
    ResponseEntity<CallbackUrisResponse> getCallbackUris(
            @PathVariable("transactionId") UUID transactionId) throws Exception;
}
