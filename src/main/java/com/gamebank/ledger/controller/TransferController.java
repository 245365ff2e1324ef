package com.gamebank.ledger.controller;

import com.gamebank.ledger.model.TransactionRecord;
import com.gamebank.ledger.model.dto.TransactionResponse;
import com.gamebank.ledger.model.dto.TransferRequest;
import com.gamebank.ledger.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final LedgerService ledgerService;

    /**
     * POST /api/v1/transfers
     *
     * Moves funds between two active accounts.
     * Returns 422 if the sender has insufficient funds.
     *
     * Not idempotent: a client that lost the response must check the history
     * before sending the same transfer again.
     */
    @PostMapping
    public ResponseEntity<TransactionResponse> transfer(@Valid @RequestBody TransferRequest req) {
        TransactionRecord record = ledgerService.transfer(
                req.getSenderId(), req.getRecipientId(), req.getAmount(), req.getNote());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new TransactionResponse(record, ledgerService.balance(req.getSenderId())));
    }
}
