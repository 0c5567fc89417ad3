package com.tokenledger.chain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Raw event log emitted by a contract.
 */
@Value
@Builder
public class ReceiptLog {
    String address;

    @Singular
    List<String> topics;

    String data;
}
