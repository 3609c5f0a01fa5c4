package com.nosota.assetpay.scheduler;

import com.nosota.assetpay.model.AssetTransaction;
import com.nosota.assetpay.service.TransactionReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheduled job for transaction reconciliation.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   reconciliation:
 *     enabled: true              # enable/disable scheduler
 *     cron: "0 *&#47;5 * * * *"       # every 5 minutes
 *     stale-after: PT24H         # age after which an open transaction is reported
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ReconciliationScheduler {

    private final TransactionReconciliationService reconciliationService;

    @Scheduled(cron = "${scheduler.reconciliation.cron:0 */5 * * * *}")
    public void reconcile() {
        log.debug("Starting scheduled job: transaction reconciliation");

        try {
            reconciliationService.retryUnstoredTransactions();
        } catch (Exception e) {
            log.error("Failed to store pending transactions: {}", e.getMessage(), e);
        }

        try {
            List<AssetTransaction> stale = reconciliationService.reportStaleTransactions();
            if (!stale.isEmpty()) {
                log.warn("{} transactions are waiting for a ledger callback past the stale threshold", stale.size());
            }
        } catch (Exception e) {
            log.error("Failed to report stale transactions: {}", e.getMessage(), e);
        }
    }
}
