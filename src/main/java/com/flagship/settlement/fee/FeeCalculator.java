package com.flagship.settlement.fee;

import com.flagship.settlement.exception.SettlementErrorCode;
import com.flagship.settlement.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes fee splits for a checkout.
 *
 * All inputs and outputs are integer minor units. Each fee is rounded once,
 * half-up, at the point it is computed:
 * <pre>
 * platformFee  = round(gross * categoryRateBps / 10000)
 * processorFee = round(gross * processorRateBps / 10000) + processorFixedFee
 * sellerNet    = gross - platformFee - processorFee
 * </pre>
 * A negative seller net means the configuration cannot price this sale, and
 * checkout must be refused before the provider is contacted.
 */
public final class FeeCalculator {

    private static final BigDecimal BPS_DIVISOR = BigDecimal.valueOf(10_000);

    private FeeCalculator() {
    }

    public static FeeBreakdown computeFees(long grossAmount, EarnerCategory category,
                                           int processorRateBps, long processorFixedFee) {
        if (grossAmount <= 0) {
            throw new ValidationException(SettlementErrorCode.INVALID_FEE_CONFIGURATION,
                    "Gross amount must be positive, got " + grossAmount);
        }
        if (processorRateBps < 0 || processorFixedFee < 0) {
            throw new ValidationException(SettlementErrorCode.INVALID_FEE_CONFIGURATION,
                    String.format("Processor pricing must not be negative (rateBps=%d, fixedFee=%d)",
                            processorRateBps, processorFixedFee));
        }

        EarnerCategory effective = category != null ? category : EarnerCategory.VENDOR;

        long platformFee = applyBps(grossAmount, effective.getPlatformRateBps());
        long processorFee = applyBps(grossAmount, processorRateBps) + processorFixedFee;
        long sellerNet = grossAmount - platformFee - processorFee;

        if (sellerNet < 0) {
            throw new ValidationException(SettlementErrorCode.INVALID_FEE_CONFIGURATION,
                    String.format("Fees exceed gross amount: gross=%d, platformFee=%d, processorFee=%d",
                            grossAmount, platformFee, processorFee));
        }

        return new FeeBreakdown(grossAmount, platformFee, processorFee, sellerNet);
    }

    static long applyBps(long amount, int bps) {
        return BigDecimal.valueOf(amount)
                .multiply(BigDecimal.valueOf(bps))
                .divide(BPS_DIVISOR, 0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
