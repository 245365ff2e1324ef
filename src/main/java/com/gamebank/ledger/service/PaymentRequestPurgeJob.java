package com.gamebank.ledger.service;

import com.gamebank.ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically deletes long-dead payment requests.
 *
 * <pre>
 * ledger:
 *   payment-request:
 *     purge:
 *       enabled: true
 *       cron: "0 0 * * * *"   # every hour
 *       retention: 7d
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "ledger.payment-request.purge.enabled", havingValue = "true")
public class PaymentRequestPurgeJob {

    private final PaymentRequestService paymentRequestService;
    private final LedgerProperties properties;

    @Scheduled(cron = "${ledger.payment-request.purge.cron:0 0 * * * *}")
    public void purgeExpiredRequests() {
        log.debug("Starting scheduled job: purge expired payment requests");
        try {
            paymentRequestService.purgeExpired(properties.getPaymentRequest().getPurge().getRetention());
        } catch (RuntimeException e) {
            log.error("Failed to purge expired payment requests", e);
        }
    }
}
