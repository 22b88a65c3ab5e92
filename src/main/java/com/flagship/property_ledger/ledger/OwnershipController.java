package com.flagship.property_ledger.ledger;

import com.flagship.property_ledger.ledger.dto.BalanceResponse;
import com.flagship.property_ledger.ledger.dto.IssueSharesRequest;
import com.flagship.property_ledger.ledger.dto.TransferSharesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for share issuance, transfers and balances.
 */
@RestController
@RequiredArgsConstructor
public class OwnershipController {

    private final OwnershipLedger ownershipLedger;

    @PostMapping("/api/properties/{id}/issuances")
    public BalanceResponse issue(@PathVariable("id") long propertyId,
                                 @Valid @RequestBody IssueSharesRequest request) {
        ownershipLedger.issue(propertyId, request.getHolder(), request.getAmount());
        return balanceOf(propertyId, request.getHolder());
    }

    @PostMapping("/api/properties/{id}/transfers")
    public BalanceResponse transfer(@PathVariable("id") long propertyId,
                                    @Valid @RequestBody TransferSharesRequest request) {
        ownershipLedger.transfer(propertyId, request.getFrom(), request.getTo(), request.getAmount());
        return balanceOf(propertyId, request.getTo());
    }

    @GetMapping("/api/properties/{id}/owners/{holder}")
    public BalanceResponse balance(@PathVariable("id") long propertyId,
                                   @PathVariable("holder") String holder) {
        return balanceOf(propertyId, holder);
    }

    @GetMapping("/api/holders/{holder}/ownership")
    public List<OwnershipRecord> ownershipStatement(@PathVariable("holder") String holder) {
        return ownershipLedger.statement(holder);
    }

    private BalanceResponse balanceOf(long propertyId, String holder) {
        return new BalanceResponse(propertyId, holder, ownershipLedger.balance(propertyId, holder));
    }
}
