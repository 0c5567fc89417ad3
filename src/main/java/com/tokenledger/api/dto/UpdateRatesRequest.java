package com.tokenledger.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for updating exchange rates. Omitted rates are left unchanged.
 */
@Data
public class UpdateRatesRequest {

    @Positive(message = "USD rate must be positive")
    private BigDecimal rateToUsd;

    @Positive(message = "UAH rate must be positive")
    private BigDecimal rateToUah;
}
