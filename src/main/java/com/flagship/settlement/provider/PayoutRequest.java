package com.flagship.settlement.provider;

import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Value;

import java.util.UUID;

@Value
public class PayoutRequest {
    UUID payoutId;
    UUID sellerId;
    String destinationAccountId;
    long amount;
    CurrencyCode currency;
}
