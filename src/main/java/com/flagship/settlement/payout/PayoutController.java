package com.flagship.settlement.payout;

import com.flagship.settlement.observability.SettlementMetrics;
import com.flagship.settlement.payout.dto.BalanceResponse;
import com.flagship.settlement.payout.dto.PayoutRequestBody;
import com.flagship.settlement.payout.dto.PayoutResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@Slf4j
public class PayoutController {

    private final PayoutCalculator payoutCalculator;
    private final SettlementMetrics metrics;

    @PostMapping("/api/payouts")
    public ResponseEntity<PayoutResponse> createPayout(@Valid @RequestBody PayoutRequestBody request) {
        long startTime = System.currentTimeMillis();
        log.info("Payout request: sellerId={}, amount={}", request.getSellerId(),
            request.getAmount() != null ? request.getAmount() : "full balance");

        try {
            Payout payout = payoutCalculator.createPayout(request.getSellerId(), request.getAmount());
            return ResponseEntity.status(HttpStatus.CREATED).body(PayoutResponse.from(payout));
        } finally {
            metrics.recordLatency("payout", System.currentTimeMillis() - startTime);
        }
    }

    @GetMapping("/api/sellers/{sellerId}/balance")
    public BalanceResponse getBalance(@PathVariable("sellerId") UUID sellerId) {
        return new BalanceResponse(sellerId, payoutCalculator.availableBalance(sellerId));
    }
}
