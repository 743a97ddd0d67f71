package com.flagship.settlement.fee;

import lombok.Value;

/**
 * Split of a gross amount into platform fee, processor fee and seller net,
 * all in minor currency units.
 */
@Value
public class FeeBreakdown {
    long grossAmount;
    long platformFee;
    long processorFee;
    long sellerNet;
}
