package com.tokenledger.ledger;

/**
 * Kinds of ledger records.
 */
public enum TransactionKind {
    /**
     * Incoming token transfer to the shared deposit address, credited after chain verification.
     */
    DEPOSIT,

    /**
     * Outgoing token transfer from the hot wallet to an external address.
     */
    WITHDRAWAL,

    /**
     * Conversion of tokens to fiat, settled manually by an administrator.
     */
    EXCHANGE
}
