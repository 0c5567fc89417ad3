package com.tokenledger.api.controller;

import com.tokenledger.accounts.Account;
import com.tokenledger.accounts.AccountService;
import com.tokenledger.api.dto.BalanceResponse;
import com.tokenledger.api.dto.RegisterAccountRequest;
import com.tokenledger.common.Money;
import com.tokenledger.ledger.BalanceEngine;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for accounts and their balances.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Account registration, balance and history")
public class AccountController {

    private final AccountService accountService;
    private final BalanceEngine balanceEngine;
    private final TransactionRecordStore recordStore;

    @PostMapping
    @Operation(summary = "Register an account, or refresh an existing one")
    public ResponseEntity<Account> registerAccount(@Valid @RequestBody RegisterAccountRequest request) {
        Account account = accountService.findOrCreate(request.getAccountId(), request.getDisplayName());
        return ResponseEntity.ok(account);
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account details")
    public ResponseEntity<Account> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(accountService.getAccount(accountId));
    }

    @GetMapping("/{accountId}/balance")
    @Operation(summary = "Get the spendable balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String accountId) {
        accountService.getAccount(accountId);
        Money balance = balanceEngine.computeBalance(accountId);
        return ResponseEntity.ok(new BalanceResponse(accountId, balance.format(), balance.getCurrency()));
    }

    @GetMapping("/{accountId}/history")
    @Operation(summary = "Get the most recent transactions, newest first")
    public ResponseEntity<List<TransactionRecord>> getHistory(
            @PathVariable String accountId,
            @RequestParam(defaultValue = "10") int limit) {
        accountService.getAccount(accountId);
        return ResponseEntity.ok(recordStore.historyForAccount(accountId, limit));
    }
}
