package com.nosota.assetpay.api.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionPhaseTest {

    @Test
    void resolvesWireNames() {
        assertThat(TransactionPhase.fromWireName("enact")).contains(TransactionPhase.ENACT);
        assertThat(TransactionPhase.fromWireName("consume")).contains(TransactionPhase.CONSUME);
        assertThat(TransactionPhase.fromWireName("cancel")).contains(TransactionPhase.CANCEL);
    }

    @Test
    void wireNamesAreCaseSensitive() {
        assertThat(TransactionPhase.fromWireName("ENACT")).isEmpty();
        assertThat(TransactionPhase.fromWireName("Cancel")).isEmpty();
    }

    @Test
    void unknownNamesResolveToNothing() {
        assertThat(TransactionPhase.fromWireName("teleport")).isEmpty();
        assertThat(TransactionPhase.fromWireName("")).isEmpty();
        assertThat(TransactionPhase.fromWireName(null)).isEmpty();
    }
}
