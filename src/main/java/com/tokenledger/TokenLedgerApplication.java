package com.tokenledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Token Ledger.
 *
 * Token Ledger is the settlement and ledger engine behind a stablecoin wallet:
 * it credits chain-verified deposits, drives withdrawals through on-chain
 * transfers and reserves funds for manually settled fiat exchanges.
 */
@SpringBootApplication
public class TokenLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenLedgerApplication.class, args);
    }
}
