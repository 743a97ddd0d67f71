package com.flagship.settlement.affiliate;

import com.flagship.settlement.affiliate.dto.CommissionRequest;
import com.flagship.settlement.affiliate.dto.CommissionResponse;
import com.flagship.settlement.observability.SettlementMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Commission trigger used by the click-tracking collaborator.
 */
@RestController
@RequestMapping("/api/affiliate")
@RequiredArgsConstructor
@Slf4j
public class CommissionController {

    private final CommissionEngine commissionEngine;
    private final SettlementMetrics metrics;

    @PostMapping("/commissions")
    public ResponseEntity<CommissionResponse> calculateCommission(@Valid @RequestBody CommissionRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Commission request: clickId={}, transactionId={}", request.getClickId(), request.getTransactionId());

        try {
            CommissionResult result = commissionEngine.calculateCommission(
                request.getClickId(), request.getTransactionId());
            return ResponseEntity.status(HttpStatus.CREATED).body(CommissionResponse.from(result));
        } finally {
            metrics.recordLatency("commission", System.currentTimeMillis() - startTime);
        }
    }
}
