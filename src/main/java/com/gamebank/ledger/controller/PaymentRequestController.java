package com.gamebank.ledger.controller;

import com.gamebank.ledger.exception.InvalidPaymentRequestException;
import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.model.PaymentRequest;
import com.gamebank.ledger.model.PaymentRequestStatus;
import com.gamebank.ledger.model.Redemption;
import com.gamebank.ledger.model.dto.CreatePaymentRequestRequest;
import com.gamebank.ledger.model.dto.PaymentRequestResponse;
import com.gamebank.ledger.model.dto.RedeemRequest;
import com.gamebank.ledger.model.dto.TransactionResponse;
import com.gamebank.ledger.service.AccountService;
import com.gamebank.ledger.service.LedgerService;
import com.gamebank.ledger.service.PaymentRequestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Payment-request tokens. Turning a token into a deep link or QR image is the
 * front-end's job; this API only issues and consumes the opaque string.
 */
@RestController
@RequestMapping("/api/v1/payment-requests")
@RequiredArgsConstructor
public class PaymentRequestController {

    private final PaymentRequestService paymentRequestService;
    private final AccountService accountService;
    private final LedgerService ledgerService;

    /**
     * POST /api/v1/payment-requests
     * Issues a token; omit amount to let the payer choose.
     */
    @PostMapping
    public ResponseEntity<PaymentRequestResponse> create(@Valid @RequestBody CreatePaymentRequestRequest req) {
        PaymentRequest request = paymentRequestService.create(req.getRequesterId(), req.getAmount());
        Account requester = accountService.requireActive(req.getRequesterId());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(PaymentRequestResponse.of(request, requester.getExternalId(),
                        requester.getHandle(), requester.getDisplayName(), PaymentRequestStatus.REDEEMABLE));
    }

    /**
     * GET /api/v1/payment-requests/{token}
     * Returns the request while it is redeemable, 410 otherwise.
     */
    @GetMapping("/{token}")
    public ResponseEntity<PaymentRequestResponse> validate(@PathVariable("token") String token) {
        PaymentRequest request = paymentRequestService.validate(token)
                .orElseThrow(InvalidPaymentRequestException::new);
        Account requester = accountService.resolveById(request.getRequesterId())
                .filter(Account::isActive)
                .orElseThrow(InvalidPaymentRequestException::new);
        return ResponseEntity.ok(PaymentRequestResponse.of(request, requester.getExternalId(),
                requester.getHandle(), requester.getDisplayName(), PaymentRequestStatus.REDEEMABLE));
    }

    /**
     * GET /api/v1/payment-requests/{token}/status
     * Tells unknown, expired, used and redeemable tokens apart, for user-facing messages.
     */
    @GetMapping("/{token}/status")
    public ResponseEntity<Map<String, PaymentRequestStatus>> status(@PathVariable("token") String token) {
        return ResponseEntity.ok(Map.of("status", paymentRequestService.describe(token)));
    }

    /**
     * POST /api/v1/payment-requests/{token}/redemptions
     *
     * Pays the request. Returns 410 for an unknown, expired or used token and 422
     * on insufficient funds; in the latter case the request stays redeemable.
     */
    @PostMapping("/{token}/redemptions")
    public ResponseEntity<TransactionResponse> redeem(
            @PathVariable("token") String token,
            @Valid @RequestBody RedeemRequest req) {
        Redemption redemption = paymentRequestService.redeem(token, req.getPayerId(), req.getAmount());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new TransactionResponse(redemption.getTransaction(), ledgerService.balance(req.getPayerId())));
    }
}
