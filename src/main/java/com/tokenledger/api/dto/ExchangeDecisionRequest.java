package com.tokenledger.api.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ExchangeDecisionRequest {

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    private String note;
}
