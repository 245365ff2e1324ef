package com.gamebank.ledger.controller;

import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.model.TransactionRecord;
import com.gamebank.ledger.model.dto.AdjustmentRequest;
import com.gamebank.ledger.model.dto.TransactionResponse;
import com.gamebank.ledger.service.AccountService;
import com.gamebank.ledger.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Administrative operations. The acting identity comes from the X-Admin-Id
 * header; whether it holds the admin flag is always checked against the store.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    static final String ADMIN_HEADER = "X-Admin-Id";

    private final LedgerService ledgerService;
    private final AccountService accountService;

    /**
     * POST /api/v1/admin/adjustments
     *
     * Credits or debits an account. A debit may leave the balance negative.
     * Returns 403 if the acting identity is not an admin.
     */
    @PostMapping("/adjustments")
    public ResponseEntity<TransactionResponse> adjust(
            @RequestHeader(ADMIN_HEADER) long adminId,
            @Valid @RequestBody AdjustmentRequest req) {
        TransactionRecord record = ledgerService.adjust(
                adminId, req.getTargetId(), req.getAmount(), req.isCredit(), req.getNote());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new TransactionResponse(record, ledgerService.balance(req.getTargetId())));
    }

    /**
     * DELETE /api/v1/admin/accounts/{externalId}
     * Soft delete: the account keeps its history but can no longer transact.
     */
    @DeleteMapping("/accounts/{externalId}")
    public ResponseEntity<Account> softDelete(
            @RequestHeader(ADMIN_HEADER) long adminId,
            @PathVariable("externalId") long externalId) {
        return ResponseEntity.ok(accountService.softDelete(adminId, externalId));
    }

    @PostMapping("/accounts/{externalId}/restore")
    public ResponseEntity<Account> restore(
            @RequestHeader(ADMIN_HEADER) long adminId,
            @PathVariable("externalId") long externalId) {
        return ResponseEntity.ok(accountService.restore(adminId, externalId));
    }
}
