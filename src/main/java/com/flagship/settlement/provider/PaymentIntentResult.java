package com.flagship.settlement.provider;

import lombok.Value;

@Value
public class PaymentIntentResult {
    String paymentReference;
    String clientSecret;
    String status;
}
