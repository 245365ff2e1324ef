package com.gamebank.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger settings, bound from the {@code ledger.*} namespace and handed to the
 * services through their constructors.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * External identity granted the admin flag on first contact and on registration.
     * Null disables the bootstrap admin.
     */
    private Long bootstrapAdminId;

    private PaymentRequestSettings paymentRequest = new PaymentRequestSettings();

    private HistorySettings history = new HistorySettings();

    public boolean isBootstrapAdmin(long externalId) {
        return bootstrapAdminId != null && bootstrapAdminId == externalId;
    }

    @Data
    public static class PaymentRequestSettings {
        /** How long a freshly issued token stays redeemable. */
        private Duration ttl = Duration.ofMinutes(15);

        /** Random bytes per token; 16 bytes encode to 22 URL-safe characters. */
        private int tokenBytes = 16;

        private PurgeSettings purge = new PurgeSettings();
    }

    @Data
    public static class PurgeSettings {
        private boolean enabled = false;

        private String cron = "0 0 * * * *";

        /** Dead requests are kept this long past their expiry before being deleted. */
        private Duration retention = Duration.ofDays(7);
    }

    @Data
    public static class HistorySettings {
        private int defaultLimit = 20;
        private int maxLimit = 100;
    }
}
