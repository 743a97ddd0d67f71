package com.flagship.settlement.transaction;

import com.flagship.settlement.catalog.CatalogItem;
import lombok.Value;

import java.util.UUID;

/**
 * Input to {@link TransactionLedger#create}.
 */
@Value
public class NewTransaction {
    UUID buyerId;
    CatalogItem item;
    boolean usesEscrow;
    String idempotencyKey;
    UUID affiliateClickId;
}
