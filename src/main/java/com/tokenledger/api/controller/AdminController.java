package com.tokenledger.api.controller;

import com.tokenledger.api.dto.ExchangeDecisionRequest;
import com.tokenledger.api.dto.UpdateFeeRequest;
import com.tokenledger.api.dto.UpdateRatesRequest;
import com.tokenledger.chain.WalletBalanceService;
import com.tokenledger.chain.WalletBalances;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.exchange.ExchangeRate;
import com.tokenledger.exchange.ExchangeRateService;
import com.tokenledger.exchange.ExchangeService;
import com.tokenledger.ledger.TransactionRecord;
import com.tokenledger.ledger.TransactionRecordStore;
import com.tokenledger.withdrawal.WithdrawalFee;
import com.tokenledger.withdrawal.WithdrawalFeeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for administrators: exchange decisions, rates, the withdrawal fee,
 * wallet balances and transaction lookup.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Administration", description = "Exchange settlement, rate and fee management")
public class AdminController {

    private final ExchangeService exchangeService;
    private final ExchangeRateService rateService;
    private final TransactionRecordStore recordStore;
    private final WithdrawalFeeService feeService;
    private final WalletBalanceService walletBalanceService;

    @GetMapping("/exchanges/pending")
    @Operation(summary = "List exchanges awaiting a decision, oldest first")
    public ResponseEntity<List<TransactionRecord>> pendingExchanges() {
        return ResponseEntity.ok(exchangeService.pendingExchanges());
    }

    @PostMapping("/exchanges/{txId}/complete")
    @Operation(summary = "Mark an exchange as paid out")
    public ResponseEntity<TransactionRecord> completeExchange(
            @PathVariable Long txId,
            @Valid @RequestBody(required = false) ExchangeDecisionRequest request) {
        String note = request == null ? null : request.getNote();
        return ResponseEntity.ok(exchangeService.completeExchange(txId, note));
    }

    @PostMapping("/exchanges/{txId}/reject")
    @Operation(summary = "Reject an exchange and release the reserved tokens")
    public ResponseEntity<TransactionRecord> rejectExchange(
            @PathVariable Long txId,
            @Valid @RequestBody(required = false) ExchangeDecisionRequest request) {
        String reason = request == null ? null : request.getNote();
        return ResponseEntity.ok(exchangeService.rejectExchange(txId, reason));
    }

    @GetMapping("/rates")
    @Operation(summary = "Get current exchange rates")
    public ResponseEntity<ExchangeRate> getRates() {
        return ResponseEntity.ok(rateService.currentRates());
    }

    @PutMapping("/rates")
    @Operation(summary = "Update exchange rates")
    public ResponseEntity<ExchangeRate> updateRates(@Valid @RequestBody UpdateRatesRequest request) {
        return ResponseEntity.ok(rateService.updateRates(request.getRateToUsd(), request.getRateToUah()));
    }

    @GetMapping("/fee")
    @Operation(summary = "Get the withdrawal fee")
    public ResponseEntity<WithdrawalFee> getFee() {
        return ResponseEntity.ok(feeService.currentSetting());
    }

    @PutMapping("/fee")
    @Operation(summary = "Update the withdrawal fee for future withdrawals")
    public ResponseEntity<WithdrawalFee> updateFee(@Valid @RequestBody UpdateFeeRequest request) {
        Money fee = Money.parse(request.getFee(), Currency.USDT);
        return ResponseEntity.ok(feeService.updateFee(fee));
    }

    @GetMapping("/wallet/balance")
    @Operation(summary = "Get token balances of the deposit address and the hot wallet")
    public ResponseEntity<WalletBalances> walletBalance() {
        return ResponseEntity.ok(walletBalanceService.walletBalances());
    }

    @GetMapping("/transactions/{txId}")
    @Operation(summary = "Get a transaction record")
    public ResponseEntity<TransactionRecord> getTransaction(@PathVariable Long txId) {
        return ResponseEntity.ok(recordStore.get(txId));
    }
}
