package com.nosota.assetpay.callback;

import com.nosota.assetpay.model.AssetHold;
import com.nosota.assetpay.model.AssetHoldStatus;
import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.repository.AssetHoldRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Asset callback backed by the {@code asset_hold} table.
 *
 * <p>Enact reserves the asset for the payer, consume marks it delivered, cancel releases it.
 * A cancel that finds no hold succeeds without doing anything: the transaction was never enacted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetHoldCallback implements AssetCallback {

    private final AssetHoldRepository assetHoldRepository;

    @Override
    @Transactional
    public PhaseOutcome enactHold(AssetTransaction transaction) {
        Optional<AssetHold> existing = assetHoldRepository.findByTransactionId(transaction.getTransactionId());
        if (existing.isPresent()) {
            AssetHold hold = existing.get();
            if (hold.getStatus() != AssetHoldStatus.HELD) {
                return PhaseOutcome.failure("Asset hold already " + hold.getStatus().name().toLowerCase());
            }
            return PhaseOutcome.success("Asset hold already placed");
        }

        AssetHold hold = new AssetHold();
        hold.setTransactionId(transaction.getTransactionId());
        hold.setRecipientId(transaction.getPayerId());
        hold.setPartId(transaction.getPartId());
        hold.setPartName(transaction.getPartName());
        hold.setCategoryId(transaction.getCategoryId());
        hold.setSaleType(transaction.getSaleType());
        hold.setStatus(AssetHoldStatus.HELD);
        hold.setHeldAt(LocalDateTime.now());
        assetHoldRepository.save(hold);

        log.info("Placed asset hold: transactionId={}, partId={}, recipientId={}",
                transaction.getTransactionId(), transaction.getPartId(), transaction.getPayerId());
        return PhaseOutcome.success("Asset hold placed");
    }

    @Override
    @Transactional
    public PhaseOutcome consumeHold(AssetTransaction transaction) {
        Optional<AssetHold> existing = assetHoldRepository.findByTransactionId(transaction.getTransactionId());
        if (existing.isEmpty()) {
            return PhaseOutcome.failure("No asset hold to deliver");
        }

        AssetHold hold = existing.get();
        switch (hold.getStatus()) {
            case DELIVERED:
                return PhaseOutcome.success("Asset already delivered");
            case RELEASED:
                return PhaseOutcome.failure("Asset hold already released");
            default:
                break;
        }

        hold.setStatus(AssetHoldStatus.DELIVERED);
        hold.setResolvedAt(LocalDateTime.now());
        assetHoldRepository.save(hold);

        log.info("Delivered asset: transactionId={}, partId={}, recipientId={}",
                transaction.getTransactionId(), hold.getPartId(), hold.getRecipientId());
        return PhaseOutcome.success("Asset delivered");
    }

    @Override
    @Transactional
    public PhaseOutcome cancelHold(AssetTransaction transaction) {
        Optional<AssetHold> existing = assetHoldRepository.findByTransactionId(transaction.getTransactionId());
        if (existing.isEmpty()) {
            log.info("Cancel without asset hold, nothing to release: transactionId={}", transaction.getTransactionId());
            return PhaseOutcome.success("No asset hold to release");
        }

        AssetHold hold = existing.get();
        switch (hold.getStatus()) {
            case RELEASED:
                return PhaseOutcome.success("Asset hold already released");
            case DELIVERED:
                return PhaseOutcome.failure("Asset already delivered");
            default:
                break;
        }

        hold.setStatus(AssetHoldStatus.RELEASED);
        hold.setResolvedAt(LocalDateTime.now());
        assetHoldRepository.save(hold);

        log.info("Released asset hold: transactionId={}, partId={}", transaction.getTransactionId(), hold.getPartId());
        return PhaseOutcome.success("Asset hold released");
    }
}
