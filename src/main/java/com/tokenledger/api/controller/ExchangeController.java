package com.tokenledger.api.controller;

import com.tokenledger.api.dto.ExchangeRequest;
import com.tokenledger.common.Currency;
import com.tokenledger.common.Money;
import com.tokenledger.exchange.ExchangeService;
import com.tokenledger.ledger.TransactionRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for token to fiat exchange requests.
 */
@RestController
@RequestMapping("/api/v1/accounts/{accountId}/exchanges")
@RequiredArgsConstructor
@Tag(name = "Exchanges", description = "Token to fiat exchange requests")
public class ExchangeController {

    private final ExchangeService exchangeService;

    @PostMapping
    @Operation(summary = "Request an exchange; the tokens are reserved until an administrator decides")
    public ResponseEntity<TransactionRecord> requestExchange(
            @PathVariable String accountId,
            @Valid @RequestBody ExchangeRequest request) {
        Money amount = Money.parse(request.getAmount(), Currency.USDT);
        TransactionRecord record = exchangeService.requestExchange(accountId, amount, request.getFiatCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }
}
