package com.gamebank.ledger.controller;

import com.gamebank.ledger.exception.AccountNotFoundException;
import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.model.Reconciliation;
import com.gamebank.ledger.model.dto.BalanceResponse;
import com.gamebank.ledger.model.dto.CreateAccountRequest;
import com.gamebank.ledger.model.dto.HistoryResponse;
import com.gamebank.ledger.model.dto.RegistrationRequest;
import com.gamebank.ledger.service.AccountService;
import com.gamebank.ledger.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final LedgerService ledgerService;

    /**
     * GET /health
     * Liveness probe: 200 while the service is running.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * PUT /api/v1/accounts/{externalId}
     * First contact: returns the account, creating an unregistered one if needed.
     * A changed handle in the body is stored.
     */
    @PutMapping("/api/v1/accounts/{externalId}")
    public ResponseEntity<Account> createOrGet(
            @PathVariable("externalId") long externalId,
            @Valid @RequestBody(required = false) CreateAccountRequest req) {
        String handle = req != null ? req.getHandle() : null;
        return ResponseEntity.ok(accountService.createOrGet(externalId, handle));
    }

    /**
     * POST /api/v1/accounts/{externalId}/registration
     * Stores the in-game display name and id and marks the account registered.
     */
    @PostMapping("/api/v1/accounts/{externalId}/registration")
    public ResponseEntity<Account> register(
            @PathVariable("externalId") long externalId,
            @Valid @RequestBody RegistrationRequest req) {
        return ResponseEntity.ok(accountService.completeRegistration(
                externalId, req.getHandle(), req.getDisplayName(), req.getGameId()));
    }

    @GetMapping("/api/v1/accounts/{externalId}")
    public ResponseEntity<Account> getAccount(@PathVariable("externalId") long externalId) {
        return ResponseEntity.ok(accountService.resolve(externalId)
                .orElseThrow(() -> new AccountNotFoundException(externalId)));
    }

    @GetMapping("/api/v1/accounts/by-handle/{handle}")
    public ResponseEntity<Account> getByHandle(@PathVariable("handle") String handle) {
        return ResponseEntity.ok(accountService.resolveByHandle(handle)
                .orElseThrow(() -> new AccountNotFoundException("handle", handle)));
    }

    @GetMapping("/api/v1/accounts/by-game-id/{gameId}")
    public ResponseEntity<Account> getByGameId(@PathVariable("gameId") String gameId) {
        return ResponseEntity.ok(accountService.resolveByGameId(gameId)
                .orElseThrow(() -> new AccountNotFoundException("game_id", gameId)));
    }

    /**
     * GET /api/v1/accounts?limit=100
     * Active (registered, not deleted) accounts ordered by display name.
     */
    @GetMapping("/api/v1/accounts")
    public ResponseEntity<List<Account>> listActive(
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(accountService.listActive(limit));
    }

    /**
     * GET /api/v1/accounts/{externalId}/balance
     * Always read from the store, never cached.
     */
    @GetMapping("/api/v1/accounts/{externalId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("externalId") long externalId) {
        return ResponseEntity.ok(new BalanceResponse(externalId, ledgerService.balance(externalId)));
    }

    /**
     * GET /api/v1/accounts/{externalId}/transactions?limit=20
     * Newest first, both parties resolved for display.
     */
    @GetMapping("/api/v1/accounts/{externalId}/transactions")
    public ResponseEntity<HistoryResponse> getHistory(
            @PathVariable("externalId") long externalId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(new HistoryResponse(externalId, ledgerService.history(externalId, limit)));
    }

    @GetMapping("/api/v1/accounts/{externalId}/reconciliation")
    public ResponseEntity<Reconciliation> reconcile(@PathVariable("externalId") long externalId) {
        return ResponseEntity.ok(ledgerService.reconcile(externalId));
    }
}
