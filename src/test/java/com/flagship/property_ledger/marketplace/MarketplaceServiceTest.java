package com.flagship.property_ledger.marketplace;

import com.flagship.property_ledger.LedgerFixture;
import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.ledger.OwnershipLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests: Settlement of unescrowed listings
 *
 * Listings do not lock shares, so a seller can list and then move the shares away.
 * These tests check that settlement never transfers shares the seller no longer holds
 * and that the order book reflects only successful trades.
 */
class MarketplaceServiceTest {

    private LedgerFixture fixture;
    private MarketplaceService marketplace;
    private OwnershipLedger ledger;
    private long propertyId;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        marketplace = fixture.marketplace;
        ledger = fixture.ownershipLedger;
        propertyId = fixture.registerProperty("Harbour View", 100).getId();
        ledger.issue(propertyId, "alice", 60);
        ledger.issue(propertyId, "bob", 40);
    }

    @Test
    @DisplayName("Listing more than the seller holds is rejected")
    void testListBeyondBalance() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> marketplace.list(propertyId, "alice", 61, 5));

        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, exception.getCode());
        assertTrue(marketplace.listings().isEmpty());
    }

    @Test
    @DisplayName("Listing does not move shares")
    void testListingDoesNotEscrow() {
        marketplace.list(propertyId, "alice", 10, 5);

        assertEquals(List.of(new Listing(propertyId, "alice", 10, 5)), marketplace.listings());
        assertEquals(60, ledger.balance(propertyId, "alice"));
    }

    @Test
    @DisplayName("Buying the whole listing settles the trade and removes the listing")
    void testFullPurchase() {
        marketplace.list(propertyId, "alice", 10, 5);

        Trade trade = marketplace.buy(propertyId, "alice", "carol", 10);

        assertEquals(50, trade.getTotalPrice());
        assertEquals(5, trade.getPricePerShare());
        assertEquals(50, ledger.balance(propertyId, "alice"));
        assertEquals(10, ledger.balance(propertyId, "carol"));
        assertTrue(marketplace.listings().isEmpty());
        fixture.assertConservation();
    }

    @Test
    @DisplayName("A partial purchase reduces the listing in place")
    void testPartialPurchase() {
        marketplace.list(propertyId, "alice", 10, 7);

        Trade trade = marketplace.buy(propertyId, "alice", "carol", 4);

        assertEquals(28, trade.getTotalPrice());
        assertEquals(List.of(new Listing(propertyId, "alice", 6, 7)), marketplace.listings());
        assertEquals(56, ledger.balance(propertyId, "alice"));
        assertEquals(4, ledger.balance(propertyId, "carol"));
        fixture.assertConservation();
    }

    @Test
    @DisplayName("The first covering listing in insertion order is matched, regardless of price")
    void testFirstMatchOrder() {
        marketplace.list(propertyId, "alice", 3, 1);
        marketplace.list(propertyId, "alice", 10, 9);
        marketplace.list(propertyId, "alice", 10, 2);

        Trade trade = marketplace.buy(propertyId, "alice", "carol", 5);

        assertEquals(9, trade.getPricePerShare());
        assertEquals(List.of(
            new Listing(propertyId, "alice", 3, 1),
            new Listing(propertyId, "alice", 5, 9),
            new Listing(propertyId, "alice", 10, 2)
        ), marketplace.listings());
    }

    @Test
    @DisplayName("Buying without a covering listing fails with NOT_FOUND")
    void testNoMatchingListing() {
        marketplace.list(propertyId, "alice", 10, 5);

        LedgerException tooMany = assertThrows(LedgerException.class,
            () -> marketplace.buy(propertyId, "alice", "carol", 11));
        LedgerException wrongSeller = assertThrows(LedgerException.class,
            () -> marketplace.buy(propertyId, "bob", "carol", 1));

        assertEquals(LedgerErrorCode.NOT_FOUND, tooMany.getCode());
        assertEquals(LedgerErrorCode.NOT_FOUND, wrongSeller.getCode());
        assertEquals(0, ledger.balance(propertyId, "carol"));
        assertEquals(1, marketplace.listings().size());
    }

    @Test
    @DisplayName("A stale listing fails settlement and stays in the book")
    void testStaleListingKept() {
        marketplace.list(propertyId, "alice", 10, 5);
        ledger.transfer(propertyId, "alice", "bob", 55);

        LedgerException exception = assertThrows(LedgerException.class,
            () -> marketplace.buy(propertyId, "alice", "carol", 10));

        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, exception.getCode());
        assertEquals(5, ledger.balance(propertyId, "alice"));
        assertEquals(0, ledger.balance(propertyId, "carol"));
        assertEquals(List.of(new Listing(propertyId, "alice", 10, 5)), marketplace.listings());
        fixture.assertConservation();
    }

    @Test
    @DisplayName("With purging enabled a stale listing is dropped on failed settlement")
    void testStaleListingPurged() {
        ReflectionTestUtils.setField(marketplace, "purgeStaleListings", true);
        marketplace.list(propertyId, "alice", 10, 5);
        ledger.transfer(propertyId, "alice", "bob", 55);

        assertThrows(LedgerException.class, () -> marketplace.buy(propertyId, "alice", "carol", 10));

        assertTrue(marketplace.listings().isEmpty());
        assertEquals(5, ledger.balance(propertyId, "alice"));
    }

    @Test
    @DisplayName("Open listings are reported through a gauge")
    void testOpenListingsGauge() {
        marketplace.list(propertyId, "alice", 10, 5);
        marketplace.list(propertyId, "bob", 10, 5);

        assertEquals(2.0, fixture.meterRegistry.get("marketplace.listings.open").gauge().value());
    }
}
