package com.flagship.property_ledger.ledger;

import com.flagship.property_ledger.LedgerFixture;
import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.property.Property;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: Try to break share accounting
 *
 * These tests attempt to violate ledger invariants:
 * - Issuing more than the unissued supply
 * - Transferring more than a holder owns
 * - Self-transfers that could double a balance
 *
 * After every rejected operation the state must be exactly as before.
 */
class OwnershipLedgerTest {

    private LedgerFixture fixture;
    private OwnershipLedger ledger;
    private long propertyId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        ledger = fixture.ownershipLedger;
        propertyId = fixture.registerProperty("Harbour View", 100).getId();
    }

    @Test
    @DisplayName("Issuing shares moves them from the available pool to the holder")
    void testIssueShares() {
        printTestHeader("Issue Shares");
        printInput("Amount", 60);

        ledger.issue(propertyId, "alice", 60);

        Property property = fixture.propertyRegistry.getById(propertyId);
        printOutput("Alice balance", ledger.balance(propertyId, "alice"));
        printOutput("Shares available", property.getSharesAvailable());

        assertEquals(60, ledger.balance(propertyId, "alice"));
        assertEquals(40, property.getSharesAvailable());
        assertEquals(60, property.getIssuedShares());
        fixture.assertConservation();
        printSuccess("Shares issued and conservation holds");
    }

    @Test
    @DisplayName("Issuing more than the available supply should be rejected")
    void testIssueBeyondSupply() {
        printTestHeader("Issue Beyond Supply");
        ledger.issue(propertyId, "alice", 90);

        LedgerException exception = assertThrows(LedgerException.class,
            () -> ledger.issue(propertyId, "bob", 11));

        assertEquals(LedgerErrorCode.INSUFFICIENT_SUPPLY, exception.getCode());
        assertEquals(0, ledger.balance(propertyId, "bob"));
        assertEquals(10, fixture.propertyRegistry.getById(propertyId).getSharesAvailable());
        fixture.assertConservation();
        printSuccess("Over-issuance rejected, state unchanged");
    }

    @Test
    @DisplayName("Issuing the whole remaining supply is allowed")
    void testIssueExactSupply() {
        ledger.issue(propertyId, "alice", 100);

        assertEquals(100, ledger.balance(propertyId, "alice"));
        assertEquals(0, fixture.propertyRegistry.getById(propertyId).getSharesAvailable());
        fixture.assertConservation();
    }

    @Test
    @DisplayName("Issuing shares of an unknown property should fail with NOT_FOUND")
    void testIssueUnknownProperty() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> ledger.issue(999, "alice", 1));

        assertEquals(LedgerErrorCode.NOT_FOUND, exception.getCode());
        assertEquals(0, ledger.balance(999, "alice"));
    }

    @Test
    @DisplayName("Negative amounts are invalid input")
    void testNegativeAmounts() {
        assertThrows(IllegalArgumentException.class, () -> ledger.issue(propertyId, "alice", -1));
        assertThrows(IllegalArgumentException.class, () -> ledger.transfer(propertyId, "alice", "bob", -1));
        fixture.assertConservation();
    }

    @Test
    @DisplayName("Transfer debits the sender and credits the recipient")
    void testTransfer() {
        printTestHeader("Transfer");
        ledger.issue(propertyId, "alice", 60);
        printInput("Transfer alice -> bob", 25);

        ledger.transfer(propertyId, "alice", "bob", 25);

        printOutput("Alice", ledger.balance(propertyId, "alice"));
        printOutput("Bob", ledger.balance(propertyId, "bob"));
        assertEquals(35, ledger.balance(propertyId, "alice"));
        assertEquals(25, ledger.balance(propertyId, "bob"));
        fixture.assertConservation();
        printSuccess("Transfer preserved conservation");
    }

    @Test
    @DisplayName("Transfer beyond balance should be rejected and leave balances unchanged")
    void testTransferInsufficientBalance() {
        ledger.issue(propertyId, "alice", 10);

        LedgerException exception = assertThrows(LedgerException.class,
            () -> ledger.transfer(propertyId, "alice", "bob", 11));

        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, exception.getCode());
        assertEquals(10, ledger.balance(propertyId, "alice"));
        assertEquals(0, ledger.balance(propertyId, "bob"));
        fixture.assertConservation();
    }

    @Test
    @DisplayName("Transfer from a holder with no shares fails even for an unknown property")
    void testTransferFromNobody() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> ledger.transfer(12345, "ghost", "bob", 1));

        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, exception.getCode());
    }

    @Test
    @DisplayName("Self-transfer is a no-op success, not a balance doubling")
    void testSelfTransfer() {
        printTestHeader("Self Transfer");
        ledger.issue(propertyId, "alice", 40);

        ledger.transfer(propertyId, "alice", "alice", 40);

        assertEquals(40, ledger.balance(propertyId, "alice"));
        fixture.assertConservation();
        printSuccess("Self-transfer left the balance unchanged");
    }

    @Test
    @DisplayName("Self-transfer larger than the balance is still rejected")
    void testSelfTransferBeyondBalance() {
        ledger.issue(propertyId, "alice", 5);

        LedgerException exception = assertThrows(LedgerException.class,
            () -> ledger.transfer(propertyId, "alice", "alice", 6));

        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, exception.getCode());
        assertEquals(5, ledger.balance(propertyId, "alice"));
    }

    @Test
    @DisplayName("A balance drained to zero behaves exactly like an absent entry")
    void testZeroBalanceIsAbsent() {
        ledger.issue(propertyId, "alice", 30);
        ledger.transfer(propertyId, "alice", "bob", 30);

        assertEquals(0, ledger.balance(propertyId, "alice"));
        assertEquals(Map.of("bob", 30L), ledger.holders(propertyId));
        assertTrue(ledger.statement("alice").isEmpty());
    }

    @Test
    @DisplayName("Ownership statement lists positive balances ordered by property id")
    void testOwnershipStatement() {
        long secondPropertyId = fixture.registerProperty("Canal Lofts", 50).getId();
        ledger.issue(secondPropertyId, "alice", 5);
        ledger.issue(propertyId, "alice", 20);
        ledger.issue(propertyId, "bob", 10);

        List<OwnershipRecord> statement = ledger.statement("alice");

        assertEquals(List.of(
            new OwnershipRecord(propertyId, "Harbour View", 20),
            new OwnershipRecord(secondPropertyId, "Canal Lofts", 5)
        ), statement);
    }

    @Test
    @DisplayName("Conservation holds across a sequence of issues and transfers")
    void testConservationAcrossOperations() {
        ledger.issue(propertyId, "alice", 50);
        ledger.issue(propertyId, "bob", 30);
        ledger.transfer(propertyId, "alice", "carol", 20);
        ledger.transfer(propertyId, "bob", "alice", 30);
        assertThrows(LedgerException.class, () -> ledger.transfer(propertyId, "carol", "bob", 21));
        assertThrows(LedgerException.class, () -> ledger.issue(propertyId, "dave", 21));

        long held = ledger.holders(propertyId).values().stream().mapToLong(Long::longValue).sum();
        assertEquals(80, held);
        assertEquals(20, fixture.propertyRegistry.getById(propertyId).getSharesAvailable());
        fixture.assertConservation();
    }

    @Test
    @DisplayName("Rejected operations are counted by outcome")
    void testMetricsRecordOutcome() {
        ledger.issue(propertyId, "alice", 10);
        assertThrows(LedgerException.class, () -> ledger.transfer(propertyId, "alice", "bob", 11));

        assertEquals(1.0, fixture.meterRegistry.counter("ledger.operations",
                "operation", "issue", "outcome", "success").count());
        assertEquals(1.0, fixture.meterRegistry.counter("ledger.operations",
                "operation", "transfer", "outcome", "INSUFFICIENT_BALANCE").count());
    }
}
