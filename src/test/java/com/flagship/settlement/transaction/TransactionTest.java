package com.flagship.settlement.transaction;

import com.flagship.settlement.fee.EarnerCategory;
import com.flagship.settlement.fee.FeeBreakdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine rules for a single transaction: PENDING moves once, to
 * SUCCEEDED or FAILED, and never leaves a terminal state.
 */
class TransactionTest {

    private Transaction pending;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        pending = Transaction.pending(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                new FeeBreakdown(10_000, 1_200, 320, 8_480), CurrencyCode.USD, EarnerCategory.VENDOR, false, null);
    }

    @Test
    @DisplayName("New transaction starts PENDING with its fee split")
    void testPending_CarriesFees() {
        printTestHeader("Pending Transaction");

        assertEquals(TransactionStatus.PENDING, pending.getStatus());
        assertEquals(10_000, pending.getGrossAmount());
        assertEquals(1_200, pending.getPlatformFee());
        assertEquals(320, pending.getProcessorFee());
        assertEquals(8_480, pending.getSellerNet());
        assertNull(pending.getPaymentReference());
        assertNotNull(pending.getCreatedAt());
        printOutput("Transaction", pending);

        printSuccess("Pending transaction created");
    }

    @Test
    @DisplayName("Fee split that does not add up is rejected")
    void testPending_InconsistentFees() {
        printTestHeader("Inconsistent Fee Split");

        assertThrows(IllegalArgumentException.class, () ->
                Transaction.pending(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                        new FeeBreakdown(10_000, 1_200, 320, 8_000), CurrencyCode.USD,
                        EarnerCategory.VENDOR, false, null));

        printSuccess("Inconsistent split rejected");
    }

    @Test
    @DisplayName("PENDING -> SUCCEEDED and PENDING -> FAILED are allowed")
    void testTransitions_FromPending() {
        printTestHeader("Transitions From PENDING");

        Transaction succeeded = pending.succeed();
        assertEquals(TransactionStatus.SUCCEEDED, succeeded.getStatus());
        assertTrue(succeeded.isSucceeded());
        assertEquals(pending.getId(), succeeded.getId());

        Transaction failed = pending.fail("card_declined");
        assertEquals(TransactionStatus.FAILED, failed.getStatus());
        assertEquals("card_declined", failed.getFailureReason());

        // transitions return new instances
        assertEquals(TransactionStatus.PENDING, pending.getStatus());

        printSuccess("Both terminal states reachable from PENDING");
    }

    @Test
    @DisplayName("Terminal states cannot move again")
    void testTransitions_FromTerminal() {
        printTestHeader("Transitions From Terminal States");

        Transaction succeeded = pending.succeed();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> succeeded.fail("late"));
        printOutput("Error", e.getMessage());
        assertThrows(IllegalStateException.class, succeeded::succeed);

        Transaction failed = pending.fail("declined");
        assertThrows(IllegalStateException.class, failed::succeed);

        printSuccess("Terminal states are final");
    }

    @Test
    @DisplayName("Repeating the current state counts as allowed")
    void testCanTransitionTo() {
        assertTrue(pending.canTransitionTo(TransactionStatus.SUCCEEDED));
        assertTrue(pending.canTransitionTo(TransactionStatus.FAILED));

        Transaction succeeded = pending.succeed();
        assertTrue(succeeded.canTransitionTo(TransactionStatus.SUCCEEDED));
        assertFalse(succeeded.canTransitionTo(TransactionStatus.FAILED));
        assertFalse(succeeded.canTransitionTo(TransactionStatus.PENDING));
    }
}
