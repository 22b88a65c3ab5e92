package com.flagship.property_ledger.marketplace;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Open sell offer on the marketplace.
 *
 * The amount is not escrowed: the seller keeps the shares until a purchase settles,
 * so settlement re-checks the seller's live balance.
 */
@Value
public class Listing {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("price_per_share")
    long pricePerShare;

    boolean matches(long propertyId, String seller, long requestedAmount) {
        return this.propertyId == propertyId && this.seller.equals(seller) && this.amount >= requestedAmount;
    }

    /**
     * @return Listing with amount reduced by the purchased quantity
     */
    Listing reduceBy(long purchased) {
        return new Listing(propertyId, seller, amount - purchased, pricePerShare);
    }
}
