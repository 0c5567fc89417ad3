package com.tokenledger.api.controller;

import com.tokenledger.accounts.AccountService;
import com.tokenledger.api.dto.VerifyDepositRequest;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.deposit.DepositIntent;
import com.tokenledger.deposit.DepositIntentRegistry;
import com.tokenledger.deposit.DepositSettlementVerifier;
import com.tokenledger.ledger.TransactionRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for deposits: announce the amount, then submit the chain reference.
 */
@RestController
@RequestMapping("/api/v1/accounts/{accountId}/deposits")
@RequiredArgsConstructor
@Tag(name = "Deposits", description = "Deposit intents and chain verification")
public class DepositController {

    private final AccountService accountService;
    private final DepositIntentRegistry intentRegistry;
    private final DepositSettlementVerifier settlementVerifier;

    @PostMapping("/intent")
    @Operation(summary = "Open a deposit intent with a unique expected amount")
    public ResponseEntity<DepositIntent> openIntent(
            @PathVariable String accountId,
            @RequestParam(required = false) String baseAmount) {
        accountService.getAccount(accountId);
        Money base = baseAmount == null ? null : Money.parse(baseAmount, Currency.USDT);
        return ResponseEntity.status(HttpStatus.CREATED).body(intentRegistry.open(accountId, base));
    }

    @GetMapping("/intent")
    @Operation(summary = "Get the open deposit intent")
    public ResponseEntity<DepositIntent> getIntent(@PathVariable String accountId) {
        return ResponseEntity.ok(intentRegistry.get(accountId));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify a submitted deposit on chain and credit it")
    public ResponseEntity<TransactionRecord> verify(
            @PathVariable String accountId,
            @Valid @RequestBody VerifyDepositRequest request) {
        TransactionRecord deposit = settlementVerifier.verify(accountId, request.getChainTxReference().trim());
        return ResponseEntity.status(HttpStatus.CREATED).body(deposit);
    }
}
