package com.tokenledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for changing the withdrawal fee, as a token amount string.
 */
@Data
public class UpdateFeeRequest {

    @NotBlank(message = "Fee is required")
    private String fee;
}
