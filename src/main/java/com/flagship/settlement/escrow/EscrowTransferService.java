package com.flagship.settlement.escrow;

import com.flagship.settlement.catalog.SellerAccountDirectory;
import com.flagship.settlement.catalog.SellerPayoutAccount;
import com.flagship.settlement.escrow.event.EscrowReleasedEvent;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.provider.PaymentProviderGateway;
import com.flagship.settlement.provider.TransferRequest;
import com.flagship.settlement.provider.TransferResult;
import com.flagship.settlement.reconciliation.AlertType;
import com.flagship.settlement.reconciliation.ReconciliationAlertService;
import com.flagship.settlement.transaction.TransactionRefundService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Optional;
import java.util.UUID;

/**
 * Transfers released escrow funds to the seller's connected account.
 *
 * Runs after the release has committed, so a provider failure never undoes
 * the release; it is raised as a reconciliation alert instead. The provider
 * call is keyed by escrow id, and an escrow with a recorded transfer is never
 * sent again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowTransferService {

    private final EscrowManager escrowManager;
    private final SellerAccountDirectory accountDirectory;
    private final TransactionRefundService refundService;
    private final PaymentProviderGateway gateway;
    private final ReconciliationAlertService alertService;
    private final SettlementMetrics metrics;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEscrowReleased(EscrowReleasedEvent event) {
        try {
            transfer(event.getEscrowId());
        } catch (RuntimeException e) {
            fail(event.getEscrowId(), "Transfer of released escrow failed: " + e.getMessage());
        }
    }

    /**
     * Sends the transfer for a released escrow unless one is already recorded.
     *
     * @return the recorded transfer reference, empty when nothing was sent
     */
    public Optional<String> transfer(UUID escrowId) {
        Escrow escrow = escrowManager.findById(escrowId).orElse(null);
        if (escrow == null || !escrow.isReleased()) {
            log.warn("Escrow {} is not released, no transfer sent", escrowId);
            return Optional.empty();
        }
        if (escrow.getTransferReference() != null) {
            log.info("Escrow {} already transferred as {}", escrowId, escrow.getTransferReference());
            return Optional.empty();
        }

        long amount = escrow.getHeldAmount() - refundService.sellerRefundedAmount(escrow.getTransactionId());
        if (amount <= 0) {
            metrics.recordEscrowAction("transfer", "refunded");
            log.info("Escrow {} was refunded in full, nothing to transfer", escrowId);
            return Optional.empty();
        }

        Optional<String> destination = accountDirectory.findBySellerId(escrow.getSellerId())
            .map(SellerPayoutAccount::getProviderAccountId)
            .filter(id -> !id.isBlank());
        if (destination.isEmpty()) {
            fail(escrowId, "Seller " + escrow.getSellerId() + " has no connected account to receive " + amount);
            return Optional.empty();
        }

        TransferResult result = gateway.createTransfer(new TransferRequest(escrowId, escrow.getTransactionId(),
            escrow.getSellerId(), destination.get(), amount, escrow.getCurrency()));

        try {
            if (!escrowManager.recordTransfer(escrowId, result.getTransferId())) {
                log.warn("Escrow {} had a transfer recorded concurrently, provider returned {}",
                    escrowId, result.getTransferId());
                return Optional.empty();
            }
        } catch (RuntimeException e) {
            fail(escrowId, String.format("Provider transfer %s of %d %s was accepted but could not be recorded: %s",
                result.getTransferId(), amount, escrow.getCurrency(), e.getMessage()));
            return Optional.empty();
        }

        metrics.recordEscrowAction("transfer", "applied");
        log.info("Escrow {} transferred {} {} to seller {} as {}",
            escrowId, amount, escrow.getCurrency(), escrow.getSellerId(), result.getTransferId());
        return Optional.of(result.getTransferId());
    }

    private void fail(UUID escrowId, String detail) {
        metrics.recordEscrowAction("transfer", "failed");
        alertService.raise(AlertType.ESCROW_TRANSFER_FAILED, escrowId.toString(), detail);
    }
}
