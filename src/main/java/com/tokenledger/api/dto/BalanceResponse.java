package com.tokenledger.api.dto;

import com.tokenledger.common.Currency;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    private String accountId;

    /**
     * Spendable balance, formatted with the currency's full precision.
     */
    private String balance;

    private Currency currency;
}
