package com.gamebank.ledger.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RegistrationRequest {

    @Size(max = 255, message = "handle must be at most 255 characters")
    private String handle;

    @NotBlank(message = "display_name is required")
    @Size(max = 255, message = "display_name must be at most 255 characters")
    private String displayName;

    @NotBlank(message = "game_id is required")
    @Size(max = 64, message = "game_id must be at most 64 characters")
    private String gameId;
}
