package com.flagship.property_ledger.income;

import com.flagship.property_ledger.auth.CallerIdentity;
import com.flagship.property_ledger.income.dto.DepositIncomeRequest;
import com.flagship.property_ledger.income.dto.IncomeAmountResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for rental income deposits and claims.
 */
@RestController
@RequiredArgsConstructor
public class IncomeController {

    private final IncomeDistributionService incomeService;

    @PostMapping("/api/properties/{id}/income")
    public Distribution deposit(@PathVariable("id") long propertyId,
                                @Valid @RequestBody DepositIncomeRequest request) {
        return incomeService.deposit(propertyId, request.getAmount());
    }

    @GetMapping("/api/properties/{id}/income")
    public IncomeAmountResponse totalDeposited(@PathVariable("id") long propertyId) {
        return new IncomeAmountResponse(propertyId, null, incomeService.totalDeposited(propertyId));
    }

    /**
     * Claims the caller's unclaimed income.
     */
    @PostMapping("/api/properties/{id}/income/claims")
    public IncomeAmountResponse claim(@PathVariable("id") long propertyId,
                                      @RequestHeader(CallerIdentity.HEADER) String caller) {
        return new IncomeAmountResponse(propertyId, caller, incomeService.claim(propertyId, caller));
    }

    @GetMapping("/api/properties/{id}/income/{holder}")
    public IncomeAmountResponse unclaimed(@PathVariable("id") long propertyId,
                                          @PathVariable("holder") String holder) {
        return new IncomeAmountResponse(propertyId, holder, incomeService.unclaimed(propertyId, holder));
    }

    @GetMapping("/api/holders/{holder}/income")
    public List<RentalIncomeRecord> incomeStatement(@PathVariable("holder") String holder) {
        return incomeService.statement(holder);
    }
}
