package com.nosota.assetpay.repository;

import com.nosota.assetpay.model.AssetHold;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface AssetHoldRepository extends JpaRepository<AssetHold, Integer> {
    Optional<AssetHold> findByTransactionId(UUID transactionId);
}
