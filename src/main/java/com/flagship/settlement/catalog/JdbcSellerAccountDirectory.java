package com.flagship.settlement.catalog;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcSellerAccountDirectory implements SellerAccountDirectory {

    private static final String SELECT_ACCOUNT =
        "SELECT seller_id, provider_account_id, charges_enabled, payouts_enabled " +
        "FROM seller_payout_accounts WHERE seller_id = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcSellerAccountDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<SellerPayoutAccount> findBySellerId(UUID sellerId) {
        return first(jdbcTemplate.query(SELECT_ACCOUNT, accountRowMapper(), sellerId));
    }

    @Override
    public Optional<SellerPayoutAccount> lockBySellerId(UUID sellerId) {
        return first(jdbcTemplate.query(SELECT_ACCOUNT + " FOR UPDATE", accountRowMapper(), sellerId));
    }

    @Override
    public boolean updateCapabilities(String providerAccountId, boolean chargesEnabled, boolean payoutsEnabled) {
        int updated = jdbcTemplate.update(
            "UPDATE seller_payout_accounts " +
            "SET charges_enabled = ?, payouts_enabled = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE provider_account_id = ?",
            chargesEnabled,
            payoutsEnabled,
            providerAccountId
        );
        return updated > 0;
    }

    private Optional<SellerPayoutAccount> first(List<SellerPayoutAccount> accounts) {
        return accounts.stream().findFirst();
    }

    private RowMapper<SellerPayoutAccount> accountRowMapper() {
        return (rs, rowNum) -> new SellerPayoutAccount(
            rs.getObject("seller_id", UUID.class),
            rs.getString("provider_account_id"),
            rs.getBoolean("charges_enabled"),
            rs.getBoolean("payouts_enabled")
        );
    }
}
