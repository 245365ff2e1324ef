package com.gamebank.ledger.model.dto;

import com.gamebank.ledger.model.PaymentRequest;
import com.gamebank.ledger.model.PaymentRequestStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Value
@Builder
public class PaymentRequestResponse {
    String token;
    Long requesterId;
    String requesterHandle;
    String requesterDisplayName;
    BigDecimal amount;
    OffsetDateTime expiresAt;
    PaymentRequestStatus status;

    public static PaymentRequestResponse of(PaymentRequest request, long requesterExternalId,
                                            String handle, String displayName, PaymentRequestStatus status) {
        return PaymentRequestResponse.builder()
                .token(request.getToken())
                .requesterId(requesterExternalId)
                .requesterHandle(handle)
                .requesterDisplayName(displayName)
                .amount(request.getAmount())
                .expiresAt(request.getExpiresAt())
                .status(status)
                .build();
    }
}
