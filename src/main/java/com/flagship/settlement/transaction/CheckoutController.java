package com.flagship.settlement.transaction;

import com.flagship.settlement.exception.NotFoundException;
import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.transaction.dto.CheckoutRequest;
import com.flagship.settlement.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Checkout and transaction lookup.
 *
 * POST /api/checkout requires an Idempotency-Key header. A new checkout
 * answers 201; a replayed key answers 200 with the original transaction.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class CheckoutController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CheckoutService checkoutService;
    private final TransactionLedger ledger;
    private final SettlementMetrics metrics;

    @PostMapping("/api/checkout")
    public ResponseEntity<TransactionResponse> checkout(
            @Valid @RequestBody CheckoutRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        log.info("Checkout request: itemId={}, buyerId={}, usesEscrow={}, idempotencyKey={}",
                request.getItemId(), request.getBuyerId(), request.isUsesEscrow(), idempotencyKey);

        try {
            CheckoutResult result = checkoutService.checkout(new CheckoutCommand(
                request.getItemId(),
                request.getBuyerId(),
                request.getPaymentMethodRef(),
                request.isUsesEscrow(),
                request.getClickId(),
                idempotencyKey
            ));

            HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
            return ResponseEntity.status(status)
                .body(TransactionResponse.from(result.getTransaction(), result.getProviderClientSecret()));
        } catch (RuntimeException e) {
            log.warn("Checkout failed for idempotencyKey={}: {}", idempotencyKey, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("checkout", System.currentTimeMillis() - startTime);
        }
    }

    @GetMapping("/api/transactions/{id}")
    public TransactionResponse getTransaction(@PathVariable("id") UUID id) {
        return ledger.findById(id)
            .map(TransactionResponse::from)
            .orElseThrow(() -> NotFoundException.of("Transaction", id));
    }
}
