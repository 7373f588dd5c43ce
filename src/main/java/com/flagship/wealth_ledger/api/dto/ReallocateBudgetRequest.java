package com.flagship.wealth_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReallocateBudgetRequest {

    @NotNull(message = "Allocated amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Allocated amount must be greater than 0")
    @JsonProperty("allocated")
    private BigDecimal allocated;
}
