package com.flagship.property_ledger.marketplace;

import com.flagship.property_ledger.exception.LedgerErrorCode;
import com.flagship.property_ledger.exception.LedgerException;
import com.flagship.property_ledger.ledger.LedgerStateGuard;
import com.flagship.property_ledger.ledger.OwnershipLedger;
import com.flagship.property_ledger.observability.CorrelationContext;
import com.flagship.property_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Peer-to-peer marketplace for shares.
 *
 * Matching policy: the first open listing, in insertion order, for the requested
 * (property, seller) whose amount covers the requested quantity. There is no price
 * priority.
 *
 * Settlement re-validates the seller's live balance because listings are not escrowed.
 * When that check fails the purchase is rejected and, unless
 * ledger.marketplace.purge-stale-listings is set, the listing stays in the book.
 */
@Service
@Slf4j
public class MarketplaceService {

    private final LedgerStateGuard guard;
    private final OwnershipLedger ownershipLedger;
    private final LedgerMetrics metrics;

    private final List<Listing> listings = new ArrayList<>();

    @Value("${ledger.marketplace.purge-stale-listings:false}")
    private boolean purgeStaleListings;

    public MarketplaceService(LedgerStateGuard guard, OwnershipLedger ownershipLedger, LedgerMetrics metrics) {
        this.guard = guard;
        this.ownershipLedger = ownershipLedger;
        this.metrics = metrics;
        metrics.registerOpenListingsGauge(() -> guard.atomically(listings::size));
    }

    /**
     * Offers shares for sale.
     *
     * @throws LedgerException INSUFFICIENT_BALANCE if the seller currently holds fewer
     *         than amount shares
     */
    public Listing list(long propertyId, String seller, long amount, long pricePerShare) {
        if (seller == null || seller.isBlank()) {
            throw new IllegalArgumentException("Seller identity is required");
        }
        if (amount < 0 || pricePerShare < 0) {
            throw new IllegalArgumentException("Amount and price per share cannot be negative");
        }

        MDC.put(CorrelationContext.PROPERTY_ID_MDC_KEY, String.valueOf(propertyId));
        try {
            Listing listing = guard.atomically(() -> {
                long held = ownershipLedger.balance(propertyId, seller);
                if (held < amount) {
                    throw LedgerException.insufficientBalance(propertyId, seller, held, amount);
                }
                Listing created = new Listing(propertyId, seller, amount, pricePerShare);
                listings.add(created);
                return created;
            });
            metrics.recordOperation("list_shares", "success");
            log.info("Shares listed for sale: seller={}, amount={}, pricePerShare={}",
                    seller, amount, pricePerShare);
            return listing;
        } catch (LedgerException e) {
            metrics.recordOperation("list_shares", e.getCode().name());
            log.warn("Listing rejected: seller={}, amount={}, reason={}", seller, amount, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.PROPERTY_ID_MDC_KEY);
        }
    }

    /**
     * Buys shares from a seller's open listing and settles through the ownership ledger.
     *
     * On success the matched listing is removed when fully consumed, or reduced by the
     * purchased amount otherwise.
     *
     * @return The settled trade
     * @throws LedgerException NOT_FOUND if no listing matches, INSUFFICIENT_BALANCE if the
     *         seller no longer holds the shares
     */
    public Trade buy(long propertyId, String seller, String buyer, long amount) {
        if (seller == null || seller.isBlank() || buyer == null || buyer.isBlank()) {
            throw new IllegalArgumentException("Seller and buyer identities are required");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Share amount cannot be negative");
        }

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.PROPERTY_ID_MDC_KEY, String.valueOf(propertyId));
        try {
            Trade trade = guard.atomically(() -> settle(propertyId, seller, buyer, amount));
            metrics.recordOperation("buy_shares", "success");
            log.info("Shares bought: seller={}, buyer={}, amount={}, totalPrice={}",
                    seller, buyer, amount, trade.getTotalPrice());
            return trade;
        } catch (LedgerException e) {
            metrics.recordOperation("buy_shares", e.getCode().name());
            log.warn("Purchase rejected: seller={}, buyer={}, amount={}, reason={}",
                    seller, buyer, amount, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("buy_shares", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.PROPERTY_ID_MDC_KEY);
        }
    }

    /**
     * All open listings in insertion order.
     */
    public List<Listing> listings() {
        return guard.atomically(() -> List.copyOf(listings));
    }

    // Runs inside the guard: every check precedes the first mutation
    private Trade settle(long propertyId, String seller, String buyer, long amount) {
        int position = findFirstMatch(propertyId, seller, amount);
        if (position < 0) {
            throw new LedgerException(LedgerErrorCode.NOT_FOUND,
                String.format("No listing of property %d by %s covers %d shares", propertyId, seller, amount));
        }
        Listing listing = listings.get(position);

        long held = ownershipLedger.balance(propertyId, seller);
        if (held < amount) {
            if (purgeStaleListings) {
                listings.remove(position);
                log.info("Stale listing purged: seller={}, listedAmount={}, held={}",
                        seller, listing.getAmount(), held);
            }
            throw LedgerException.insufficientBalance(propertyId, seller, held, amount);
        }
        long totalPrice = Math.multiplyExact(amount, listing.getPricePerShare());

        ownershipLedger.transfer(propertyId, seller, buyer, amount);

        if (listing.getAmount() == amount) {
            listings.remove(position);
        } else {
            listings.set(position, listing.reduceBy(amount));
        }
        return new Trade(propertyId, seller, buyer, amount, listing.getPricePerShare(), totalPrice);
    }

    private int findFirstMatch(long propertyId, String seller, long amount) {
        for (int i = 0; i < listings.size(); i++) {
            if (listings.get(i).matches(propertyId, seller, amount)) {
                return i;
            }
        }
        return -1;
    }
}
