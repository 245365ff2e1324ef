package com.gamebank.ledger.service;

import com.gamebank.ledger.config.LedgerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Produces payment-request tokens: {@code tokenBytes} bytes from a
 * {@link SecureRandom}, base64url-encoded without padding. The token is the only
 * credential needed to pay a request, so it must not be guessable.
 */
@Component
public class RequestTokenGenerator {

    static final int MIN_TOKEN_BYTES = 16;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random;
    private final int tokenBytes;

    @Autowired
    public RequestTokenGenerator(LedgerProperties properties) {
        this(new SecureRandom(), properties.getPaymentRequest().getTokenBytes());
    }

    RequestTokenGenerator(SecureRandom random, int tokenBytes) {
        if (tokenBytes < MIN_TOKEN_BYTES) {
            throw new IllegalArgumentException(
                    "ledger.payment-request.token-bytes must be at least " + MIN_TOKEN_BYTES + ", got " + tokenBytes);
        }
        this.random = random;
        this.tokenBytes = tokenBytes;
    }

    public String nextToken() {
        byte[] bytes = new byte[tokenBytes];
        random.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
