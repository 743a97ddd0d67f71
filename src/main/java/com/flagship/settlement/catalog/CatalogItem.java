package com.flagship.settlement.catalog;

import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.transaction.CurrencyCode;
import lombok.Value;

import java.util.UUID;

/**
 * Read-only view of a marketplace listing as needed for checkout.
 * A null inventory count means the item is not stock-tracked.
 */
@Value
public class CatalogItem {
    UUID id;
    UUID sellerId;
    String title;
    long price;
    CurrencyCode currency;
    EarnerCategory earnerCategory;
    Integer inventoryCount;
    boolean published;

    public boolean isInStock() {
        return inventoryCount == null || inventoryCount > 0;
    }
}
