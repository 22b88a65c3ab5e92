package com.flagship.property_ledger.marketplace;

import com.flagship.property_ledger.marketplace.dto.BuySharesRequest;
import com.flagship.property_ledger.marketplace.dto.ListSharesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the share marketplace.
 */
@RestController
@RequestMapping("/api/marketplace")
@RequiredArgsConstructor
public class MarketplaceController {

    private final MarketplaceService marketplaceService;

    @PostMapping("/listings")
    public ResponseEntity<Listing> list(@Valid @RequestBody ListSharesRequest request) {
        Listing listing = marketplaceService.list(
            request.getPropertyId(), request.getSeller(), request.getAmount(), request.getPricePerShare());
        return ResponseEntity.status(HttpStatus.CREATED).body(listing);
    }

    @GetMapping("/listings")
    public List<Listing> listings() {
        return marketplaceService.listings();
    }

    @PostMapping("/purchases")
    public Trade buy(@Valid @RequestBody BuySharesRequest request) {
        return marketplaceService.buy(
            request.getPropertyId(), request.getSeller(), request.getBuyer(), request.getAmount());
    }
}
