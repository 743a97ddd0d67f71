package com.flagship.settlement.provider;

import lombok.Value;

@Value
public class PayoutResult {
    String externalPayoutId;
    String status;
}
