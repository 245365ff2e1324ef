package com.gamebank.ledger.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class AdjustmentRequest {

    @NotNull(message = "target_id is required")
    private Long targetId;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be at least 0.01")
    @Digits(integer = 16, fraction = 2, message = "amount must have at most 2 decimal places")
    private BigDecimal amount;

    @NotNull(message = "direction is required")
    @Pattern(regexp = "^(credit|debit)$", message = "direction must be 'credit' or 'debit'")
    private String direction;

    @Size(max = 200, message = "note must be at most 200 characters")
    private String note;

    public boolean isCredit() {
        return "credit".equals(direction);
    }
}
