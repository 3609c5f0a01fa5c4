package com.nosota.assetpay.callback;

import com.nosota.assetpay.model.AssetTransaction;

/**
 * Capability of the subsystem that actually holds, delivers and undoes an asset.
 *
 * <p>{@link com.nosota.assetpay.service.TransactionPhaseService} calls each operation at most once per
 * transaction in the success case and trusts the returned outcome verbatim. Implementations must
 * not block indefinitely.
 */
public interface AssetCallback {

    /**
     * Places the hold on the asset. Called once the ledger has reserved the payer's funds.
     */
    PhaseOutcome enactHold(AssetTransaction transaction);

    /**
     * Finalizes the hold: the transfer is committed, deliver the asset.
     */
    PhaseOutcome consumeHold(AssetTransaction transaction);

    /**
     * Releases the hold. Also called for transactions that were never enacted;
     * the implementation decides whether anything needs undoing.
     */
    PhaseOutcome cancelHold(AssetTransaction transaction);
}
