package com.flagship.settlement.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Money returned to the buyer for a succeeded transaction.
 *
 * Amounts are cumulative, as the provider reports them. The seller bears the
 * refund in proportion to their share of the gross: a full refund removes the
 * whole seller net, half a refund removes half of it (HALF_UP).
 */
@Value
public class TransactionRefund {
    UUID transactionId;
    String chargeReference;
    long refundedAmount;
    long sellerRefundAmount;
    CurrencyCode currency;
    Instant updatedAt;

    public static TransactionRefund of(Transaction transaction, String chargeReference, long refundedAmount) {
        if (refundedAmount <= 0 || refundedAmount > transaction.getGrossAmount()) {
            throw new IllegalArgumentException(String.format(
                "Refunded amount %d is outside (0, %d] for transaction %s",
                refundedAmount, transaction.getGrossAmount(), transaction.getId()));
        }
        return new TransactionRefund(
            transaction.getId(),
            chargeReference,
            refundedAmount,
            sellerShare(transaction.getSellerNet(), transaction.getGrossAmount(), refundedAmount),
            transaction.getCurrency(),
            Instant.now()
        );
    }

    static long sellerShare(long sellerNet, long grossAmount, long refundedAmount) {
        return BigDecimal.valueOf(sellerNet)
            .multiply(BigDecimal.valueOf(refundedAmount))
            .divide(BigDecimal.valueOf(grossAmount), 0, RoundingMode.HALF_UP)
            .longValueExact();
    }
}
