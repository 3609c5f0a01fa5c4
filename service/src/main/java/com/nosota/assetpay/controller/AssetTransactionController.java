package com.nosota.assetpay.controller;

import com.nosota.assetpay.api.AssetTransactionApi;
import com.nosota.assetpay.api.dto.AssetTransactionDTO;
import com.nosota.assetpay.api.request.CreateTransactionRequest;
import com.nosota.assetpay.api.request.LedgerResponseRequest;
import com.nosota.assetpay.api.response.CallbackUrisResponse;
import com.nosota.assetpay.api.response.PhaseResponse;
import com.nosota.assetpay.callback.AssetCallback;
import com.nosota.assetpay.callback.PhaseOutcome;
import com.nosota.assetpay.service.AssetTransactionService;
import com.nosota.assetpay.service.TransactionPhaseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AssetTransactionController implements AssetTransactionApi {

    private final TransactionPhaseService transactionPhaseService;
    private final AssetTransactionService assetTransactionService;
    private final AssetCallback assetCallback;

    @Override
    public ResponseEntity<PhaseResponse> processPhase(String transactionId, String state) {
        PhaseOutcome outcome = transactionPhaseService.processPhaseRequest(transactionId, state, assetCallback);
        log.debug("Phase callback answered: transactionId={}, state={}, success={}, reason={}",
                transactionId, state, outcome.success(), outcome.message());
        return ResponseEntity.ok(new PhaseResponse(transactionId, state, outcome.success(), outcome.message()));
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> createTransaction(CreateTransactionRequest request) throws Exception {
        AssetTransactionDTO created = assetTransactionService.createTransaction(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> getTransaction(UUID transactionId) throws Exception {
        return ResponseEntity.ok(assetTransactionService.getTransaction(transactionId));
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> markSubmitted(UUID transactionId) throws Exception {
        return ResponseEntity.ok(assetTransactionService.markSubmitted(transactionId));
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> recordLedgerResponse(UUID transactionId, LedgerResponseRequest request) throws Exception {
        return ResponseEntity.ok(assetTransactionService.recordLedgerResponse(transactionId, request));
    }

    @Override
    public ResponseEntity<CallbackUrisResponse> getCallbackUris(UUID transactionId) throws Exception {
        return ResponseEntity.ok(assetTransactionService.getCallbackUris(transactionId));
    }
}
