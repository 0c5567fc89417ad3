package com.tokenledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for a withdrawal to an external address.
 * The amount is a decimal string so that it is never read as a binary float.
 */
@Data
public class WithdrawalRequest {

    @NotBlank(message = "Amount is required")
    private String amount;

    @NotBlank(message = "Destination address is required")
    private String address;
}
