package com.flagship.settlement.payout;

import com.flagship.settlement.transaction.CurrencyCode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Computes a seller's withdrawable balance in one currency, in SQL.
 *
 * Earned: seller net of SUCCEEDED transactions that either bypass escrow or
 * whose escrow has been RELEASED, less the seller's share of their refunds.
 * Reserved: PENDING and COMPLETED payouts. The result is negative when
 * refunds took back money that was already paid out.
 */
@Repository
public class SellerBalanceQuery {

    private static final String BALANCE_SQL = """
        SELECT
          COALESCE((SELECT SUM(t.seller_net - COALESCE(r.seller_refund_amount, 0))
                    FROM settlement_transactions t
                    LEFT JOIN escrows e ON e.transaction_id = t.id
                    LEFT JOIN settlement_refunds r ON r.transaction_id = t.id
                    WHERE t.seller_id = ?
                    AND t.currency = ?
                    AND t.status = 'SUCCEEDED'
                    AND (t.uses_escrow = FALSE OR e.status = 'RELEASED')), 0)
          - COALESCE((SELECT SUM(p.amount)
                      FROM payouts p
                      WHERE p.seller_id = ?
                      AND p.currency = ?
                      AND p.status IN ('PENDING', 'COMPLETED')), 0)
        """;

    private final JdbcTemplate jdbcTemplate;

    public SellerBalanceQuery(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long availableBalance(UUID sellerId, CurrencyCode currency) {
        Long balance = jdbcTemplate.queryForObject(BALANCE_SQL, Long.class,
            sellerId, currency.name(), sellerId, currency.name());
        return balance != null ? balance : 0L;
    }
}
