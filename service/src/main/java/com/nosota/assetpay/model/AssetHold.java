package com.nosota.assetpay.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Asset hold entity - the local resource reserved for a buyer while the ledger settles.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * 1. HELD: created on enact, the asset is reserved for the payer
 * 2. DELIVERED: on consume, the asset was handed over
 * 3. RELEASED: on cancel, the reservation was dropped
 * </pre>
 *
 * <p>At most one hold exists per transaction.
 */
@Entity
@Table(name = "asset_hold")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AssetHold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "transaction_id", nullable = false, unique = true)
    private UUID transactionId;

    /**
     * Who receives the asset on delivery.
     */
    @Column(name = "recipient_id", nullable = false)
    private UUID recipientId;

    @Column(name = "part_id")
    private UUID partId;

    @Column(name = "part_name")
    private String partName;

    @Column(name = "category_id")
    private UUID categoryId;

    @Column(name = "sale_type")
    private Integer saleType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AssetHoldStatus status;

    @Column(name = "held_at", nullable = false)
    private LocalDateTime heldAt;

    /**
     * When the hold was delivered or released. Null while HELD.
     */
    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
