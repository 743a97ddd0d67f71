package com.flagship.settlement.provider;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Value;

import java.util.UUID;

/**
 * Moves released escrow proceeds from the platform balance to the seller's
 * connected account.
 */
@Value
public class TransferRequest {
    UUID escrowId;
    UUID transactionId;
    UUID sellerId;
    String destinationAccountId;
    long amount;
    CurrencyCode currency;
}
