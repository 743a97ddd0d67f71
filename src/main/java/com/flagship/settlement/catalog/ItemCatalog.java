package com.flagship.settlement.catalog;

import java.util.Optional;
import java.util.UUID;

/**
 * Marketplace listings owned by the catalog service. Settlement only reads them.
 */
public interface ItemCatalog {

    Optional<CatalogItem> findItem(UUID itemId);
}
