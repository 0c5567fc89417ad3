package com.tokenledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class VerifyDepositRequest {

    @NotBlank(message = "Transaction reference is required")
    private String chainTxReference;
}
