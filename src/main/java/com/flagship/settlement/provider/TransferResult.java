package com.flagship.settlement.provider;

import lombok.Value;

@Value
public class TransferResult {
    String transferId;
}
