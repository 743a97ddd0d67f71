package com.flagship.settlement.catalog;

import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.transaction.CurrencyCode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads listings from the catalog's marketplace_items table.
 */
@Repository
public class JdbcItemCatalog implements ItemCatalog {

    private final JdbcTemplate jdbcTemplate;

    public JdbcItemCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CatalogItem> findItem(UUID itemId) {
        List<CatalogItem> items = jdbcTemplate.query(
            "SELECT id, seller_id, title, price, currency, earner_category, inventory_count, is_published " +
            "FROM marketplace_items WHERE id = ?",
            itemRowMapper(),
            itemId
        );
        return items.stream().findFirst();
    }

    private RowMapper<CatalogItem> itemRowMapper() {
        return (rs, rowNum) -> new CatalogItem(
            rs.getObject("id", UUID.class),
            rs.getObject("seller_id", UUID.class),
            rs.getString("title"),
            rs.getLong("price"),
            CurrencyCode.valueOf(rs.getString("currency")),
            EarnerCategory.fromCode(rs.getString("earner_category")),
            (Integer) rs.getObject("inventory_count"),
            rs.getBoolean("is_published")
        );
    }
}
