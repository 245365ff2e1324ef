package com.gamebank.ledger.model.dto;

import com.gamebank.ledger.model.TransactionRecord;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class TransactionResponse {
    private TransactionRecord transaction;
    /**
     * Balance of the account whose funds were committed by the operation:
     * the sender for a transfer or redemption, the target for an adjustment.
     */
    private BigDecimal balance;
}
