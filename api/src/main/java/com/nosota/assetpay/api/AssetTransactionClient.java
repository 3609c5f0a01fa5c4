package com.nosota.assetpay.api;

import com.nosota.assetpay.api.dto.AssetTransactionDTO;
import com.nosota.assetpay.api.request.CreateTransactionRequest;
import com.nosota.assetpay.api.request.LedgerResponseRequest;
import com.nosota.assetpay.api.response.CallbackUrisResponse;
import com.nosota.assetpay.api.response.PhaseResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of AssetTransactionApi for consuming the assetpay service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class AssetpayClientConfig {
 *     @Bean
 *     public WebClient assetpayWebClient(WebClient.Builder builder,
 *                                        @Value("${services.assetpay.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public AssetTransactionClient assetTransactionClient(WebClient assetpayWebClient) {
 *         return new AssetTransactionClient(assetpayWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class AssetTransactionClient implements AssetTransactionApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<PhaseResponse> processPhase(String transactionId, String state) {
        log.debug("Calling processPhase: transactionId={}, state={}", transactionId, state);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path(CallbackUris.CALLBACK_PATH)
                        .queryParam(CallbackUris.ID_PARAM, transactionId)
                        .queryParam(CallbackUris.STATE_PARAM, state)
                        .build())
                .retrieve()
                .toEntity(PhaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> createTransaction(CreateTransactionRequest request) {
        log.debug("Calling createTransaction: transactionId={}", request.transactionId());

        return webClient.post()
                .uri("/api/v1/asset-transactions")
                .bodyValue(request)
                .retrieve()
                .toEntity(AssetTransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> getTransaction(UUID transactionId) {
        log.debug("Calling getTransaction: transactionId={}", transactionId);

        return webClient.get()
                .uri("/api/v1/asset-transactions/{transactionId}", transactionId)
                .retrieve()
                .toEntity(AssetTransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> markSubmitted(UUID transactionId) {
        log.debug("Calling markSubmitted: transactionId={}", transactionId);

        return webClient.post()
                .uri("/api/v1/asset-transactions/{transactionId}/submitted", transactionId)
                .retrieve()
                .toEntity(AssetTransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<AssetTransactionDTO> recordLedgerResponse(UUID transactionId, LedgerResponseRequest request) {
        log.debug("Calling recordLedgerResponse: transactionId={}, success={}", transactionId, request.success());

        return webClient.post()
                .uri("/api/v1/asset-transactions/{transactionId}/ledger-response", transactionId)
                .bodyValue(request)
                .retrieve()
                .toEntity(AssetTransactionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<CallbackUrisResponse> getCallbackUris(UUID transactionId) {
        log.debug("Calling getCallbackUris: transactionId={}", transactionId);

        return webClient.get()
                .uri("/api/v1/asset-transactions/{transactionId}/callback-uris", transactionId)
                .retrieve()
                .toEntity(CallbackUrisResponse.class)
                .block();
    }
}
