package com.gamebank.ledger.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CreatePaymentRequestRequest {

    @NotNull(message = "requester_id is required")
    private Long requesterId;

    /** Omitted for an open request where the payer chooses the amount. */
    @DecimalMin(value = "0.01", message = "amount must be at least 0.01")
    @Digits(integer = 16, fraction = 2, message = "amount must have at most 2 decimal places")
    private BigDecimal amount;
}
