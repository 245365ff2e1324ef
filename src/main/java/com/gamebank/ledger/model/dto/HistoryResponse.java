package com.gamebank.ledger.model.dto;

import com.gamebank.ledger.model.TransactionView;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class HistoryResponse {
    private Long accountId;
    private List<TransactionView> entries;
}
