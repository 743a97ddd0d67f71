package com.flagship.settlement.escrow;

import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.fee.FeeBreakdown;
import com.flagship.settlement.transaction.CurrencyCode;
import com.flagship.settlement.transaction.Transaction;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EscrowTest {

    private final UUID buyerId = UUID.randomUUID();
    private final UUID sellerId = UUID.randomUUID();

    @Test
    void holdsTheSellerNet() {
        Transaction tx = transaction(true);

        Escrow escrow = Escrow.holdFor(tx);

        assertEquals(EscrowStatus.HELD, escrow.getStatus());
        assertEquals(tx.getId(), escrow.getTransactionId());
        assertEquals(8_480, escrow.getHeldAmount());
        assertEquals(CurrencyCode.USD, escrow.getCurrency());
        assertFalse(escrow.isReleased());
        assertNull(escrow.getReleasedBy());
    }

    @Test
    void refusesTransactionWithoutEscrow() {
        assertThrows(IllegalArgumentException.class, () -> Escrow.holdFor(transaction(false)));
    }

    @Test
    void buyerAndSellerAreParties() {
        Escrow escrow = Escrow.holdFor(transaction(true));

        assertTrue(escrow.isParty(buyerId));
        assertTrue(escrow.isParty(sellerId));
        assertFalse(escrow.isParty(UUID.randomUUID()));
    }

    private Transaction transaction(boolean usesEscrow) {
        return Transaction.pending(UUID.randomUUID(), buyerId, sellerId, UUID.randomUUID(),
                new FeeBreakdown(10_000, 1_200, 320, 8_480), CurrencyCode.USD,
                EarnerCategory.VENDOR, usesEscrow, null);
    }
}
