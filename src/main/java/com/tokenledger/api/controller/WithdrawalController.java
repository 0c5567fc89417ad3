package com.tokenledger.api.controller;

import com.tokenledger.api.dto.WithdrawalRequest;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.withdrawal.WithdrawalResult;
import com.tokenledger.withdrawal.WithdrawalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for withdrawals.
 */
@RestController
@RequestMapping("/api/v1/accounts/{accountId}/withdrawals")
@RequiredArgsConstructor
@Tag(name = "Withdrawals", description = "Token withdrawals to external addresses")
public class WithdrawalController {

    private final WithdrawalService withdrawalService;

    @PostMapping
    @Operation(summary = "Withdraw tokens; the network fee is charged on top of the amount")
    public ResponseEntity<WithdrawalResult> withdraw(
            @PathVariable String accountId,
            @Valid @RequestBody WithdrawalRequest request) {
        Money amount = Money.parse(request.getAmount(), Currency.USDT);
        return ResponseEntity.ok(withdrawalService.withdraw(accountId, amount, request.getAddress().trim()));
    }
}
