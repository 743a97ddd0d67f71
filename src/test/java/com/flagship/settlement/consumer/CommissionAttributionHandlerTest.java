package com.flagship.settlement.consumer;

import com.flagship.settlement.affiliate.CommissionEngine;
import com.flagship.settlement.affiliate.CommissionResult;
import com.flagship.settlement.affiliate.ConversionPayoutStatus;
import com.flagship.settlement.exception.ConflictException;
import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.transaction.CurrencyCode;
import com.flagship.settlement.transaction.event.TransactionSucceededEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommissionAttributionHandlerTest {

    @Mock
    private CommissionEngine commissionEngine;

    @InjectMocks
    private CommissionAttributionHandler handler;

    private final UUID transactionId = UUID.randomUUID();
    private final UUID clickId = UUID.randomUUID();

    @Test
    void purchaseWithoutReferralIsIgnored() {
        handler.onTransactionSucceeded(event(null));

        verifyNoInteractions(commissionEngine);
    }

    @Test
    void referredPurchaseRecordsCommission() {
        when(commissionEngine.calculateCommission(clickId, transactionId)).thenReturn(new CommissionResult(
                UUID.randomUUID(), 500, BigDecimal.TEN, CurrencyCode.USD, ConversionPayoutStatus.PENDING));

        handler.onTransactionSucceeded(event(clickId));

        verify(commissionEngine).calculateCommission(clickId, transactionId);
    }

    @Test
    void businessRejectionCompletesTheEvent() {
        when(commissionEngine.calculateCommission(clickId, transactionId))
                .thenThrow(new ConflictException(SettlementErrorCode.ALREADY_CONVERTED, "already converted"));

        assertDoesNotThrow(() -> handler.onTransactionSucceeded(event(clickId)));
    }

    @Test
    void infrastructureFailurePropagatesForRedelivery() {
        when(commissionEngine.calculateCommission(clickId, transactionId))
                .thenThrow(new QueryTimeoutException("timeout"));

        assertThrows(QueryTimeoutException.class, () -> handler.onTransactionSucceeded(event(clickId)));
    }

    private TransactionSucceededEvent event(UUID click) {
        return new TransactionSucceededEvent(UUID.randomUUID(), transactionId, UUID.randomUUID(), "pi_1",
                5_000, 4_225, "USD", click, Instant.now());
    }
}
