package com.flagship.property_ledger.marketplace;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Settled marketplace purchase. The total price is informational: no currency moves
 * through the ledger.
 */
@Value
public class Trade {

    @JsonProperty("property_id")
    long propertyId;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("price_per_share")
    long pricePerShare;

    @JsonProperty("total_price")
    long totalPrice;
}
