package com.tokenledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for registering an account, or refreshing an existing one.
 */
@Data
public class RegisterAccountRequest {

    @NotBlank(message = "Account ID is required")
    @Size(max = 64, message = "Account ID must be at most 64 characters")
    private String accountId;

    @Size(max = 255, message = "Display name must be at most 255 characters")
    private String displayName;
}
