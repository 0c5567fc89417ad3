package com.tokenledger.api.dto;

import com.tokenledger.common.Currency;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for exchanging tokens to fiat.
 */
@Data
public class ExchangeRequest {

    @NotBlank(message = "Amount is required")
    private String amount;

    @NotNull(message = "Fiat currency is required")
    private Currency fiatCurrency;
}
