package com.nosota.assetpay.api;

import com.nosota.assetpay.api.model.TransactionPhase;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds the URIs the remote ledger calls back for each transaction phase.
 *
 * <p>The path of the base URI is replaced by {@link #CALLBACK_PATH}; scheme, host and port are kept.
 * The query carries the transaction id and the phase wire name:
 * <pre>
 * https://region.example.org:8002/assetpay/transaction?id=0b6c...&amp;state=enact
 * </pre>
 */
public final class CallbackUris {

    public static final String CALLBACK_PATH = "/assetpay/transaction";
    public static final String ID_PARAM = "id";
    public static final String STATE_PARAM = "state";

    private CallbackUris() {
    }

    public static URI enact(URI baseUri, UUID transactionId) {
        return forPhase(baseUri, transactionId, TransactionPhase.ENACT);
    }

    public static URI consume(URI baseUri, UUID transactionId) {
        return forPhase(baseUri, transactionId, TransactionPhase.CONSUME);
    }

    public static URI cancel(URI baseUri, UUID transactionId) {
        return forPhase(baseUri, transactionId, TransactionPhase.CANCEL);
    }

    public static URI forPhase(URI baseUri, UUID transactionId, TransactionPhase phase) {
        Objects.requireNonNull(baseUri, "baseUri");
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(phase, "phase");

        return UriComponentsBuilder.fromUri(baseUri)
                .replacePath(CALLBACK_PATH)
                .replaceQuery(null)
                .fragment(null)
                .queryParam(ID_PARAM, transactionId)
                .queryParam(STATE_PARAM, phase.wireName())
                .build()
                .toUri();
    }
}
