package com.nosota.assetpay.api.dto;

import com.nosota.assetpay.api.model.TransactionState;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class AssetTransactionDTO {
    private UUID transactionId;

    private UUID payerId;
    private String payerName;
    private UUID payeeId;
    private String payeeName;
    private Integer amount;

    private Integer transactionType;
    private String transactionTypeName;

    private boolean subscriptionDebit;
    private UUID subscriptionId;

    private UUID partId;
    private String partName;
    private String partDescription;
    private UUID categoryId;
    private Long localId;
    private Integer saleType;

    private boolean submitted;
    private boolean responseReceived;
    private boolean responseSuccess;
    private String responseStatus;
    private String responseReason;
    private Integer payerEndingBalance;

    private TransactionState state;
    private LocalDateTime createdAt;
    private LocalDateTime enactedAt;
    private LocalDateTime finishedAt;
}
