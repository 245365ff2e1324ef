package com.gamebank.ledger.model.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateAccountRequest {

    @Size(max = 255, message = "handle must be at most 255 characters")
    private String handle;
}
