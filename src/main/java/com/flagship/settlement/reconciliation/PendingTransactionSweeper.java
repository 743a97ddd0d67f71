package com.flagship.settlement.reconciliation;

import com.flagship.settlement.config.SettlementProperties;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Flags transactions that stayed PENDING past the configured window.
 *
 * The sweep only raises alerts, one per transaction; it never changes a
 * transaction's state, since the provider may still report the outcome.
 */
@Component
@ConditionalOnProperty(name = "settlement.reconciliation.sweep-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PendingTransactionSweeper {

    private final TransactionLedger ledger;
    private final ReconciliationAlertService alertService;
    private final SettlementProperties properties;

    @Scheduled(fixedDelayString = "${settlement.reconciliation.sweep-interval-ms:60000}")
    public void sweep() {
        int flagged = flagStalePending(Instant.now());
        if (flagged > 0) {
            log.warn("Flagged {} transactions pending longer than {}",
                flagged, properties.getReconciliation().getPendingTimeout());
        }
    }

    /**
     * @return number of newly flagged transactions
     */
    public int flagStalePending(Instant now) {
        Instant cutoff = now.minus(properties.getReconciliation().getPendingTimeout());
        List<Transaction> stale = ledger.findPendingCreatedBefore(cutoff);

        int flagged = 0;
        for (Transaction transaction : stale) {
            String detail = String.format("Transaction %s pending since %s (payment reference %s)",
                transaction.getId(), transaction.getCreatedAt(), transaction.getPaymentReference());
            if (alertService.raiseOnce(AlertType.STALE_PENDING_TRANSACTION, transaction.getId().toString(), detail)) {
                flagged++;
            }
        }
        return flagged;
    }
}
