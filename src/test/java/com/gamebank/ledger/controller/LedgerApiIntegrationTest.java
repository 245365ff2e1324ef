package com.gamebank.ledger.controller;

import com.gamebank.ledger.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full-stack tests: HTTP → Controller → Service → in-memory store.
 *
 * Each test method starts from the seed:
 *   - Admin (1000): admin flag, 0.00
 *   - Alice (1001): 100.00
 *   - Bob   (1002): 0.00
 *   - Carol (1003): unregistered
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("h2")
@Import(TestClockConfig.class)
@Sql(
    scripts = {"/db/truncate.sql", "/db/seed.sql"},
    executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD
)
class LedgerApiIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    // Seeded constants: must match db/seed.sql
    private static final long ADMIN_ID = 1000L;
    private static final long ALICE_ID = 1001L;
    private static final long BOB_ID   = 1002L;
    private static final long CAROL_ID = 1003L;

    // =========================================================================
    // Helper methods
    // =========================================================================

    private ResponseEntity<Map> post(String path, Long adminId, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (adminId != null) {
            headers.set(AdminController.ADMIN_HEADER, adminId.toString());
        }
        return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), Map.class);
    }

    private ResponseEntity<Map> transfer(long from, long to, String amount) {
        Map<String, Object> body = new HashMap<>();
        body.put("sender_id", from);
        body.put("recipient_id", to);
        body.put("amount", new BigDecimal(amount));
        return post("/api/v1/transfers", null, body);
    }

    private BigDecimal getBalance(long accountId) {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
                "/api/v1/accounts/{id}/balance", Map.class, accountId);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        return new BigDecimal(resp.getBody().get("balance").toString());
    }

    // =========================================================================
    // Accounts
    // =========================================================================

    @Test
    void health_isOk() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/health", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("status", "ok");
    }

    @Test
    void firstContactThenRegistration_activatesAccount() {
        ResponseEntity<Map> created = restTemplate.exchange("/api/v1/accounts/{id}", HttpMethod.PUT,
                new HttpEntity<>(Map.of("handle", "@zed")), Map.class, 7000L);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(created.getBody()).containsEntry("handle", "zed").containsEntry("registered", false);

        ResponseEntity<Map> registered = post("/api/v1/accounts/7000/registration", null,
                Map.of("display_name", "Zed", "game_id", "700"));
        assertThat(registered.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(registered.getBody()).containsEntry("display_name", "Zed").containsEntry("active", true);

        ResponseEntity<Map> byHandle = restTemplate.getForEntity("/api/v1/accounts/by-handle/{h}", Map.class, "ZED");
        assertThat(byHandle.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void registration_withBlankDisplayName_returns400() {
        ResponseEntity<Map> resp = post("/api/v1/accounts/1003/registration", null,
                Map.of("display_name", "", "game_id", "103"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("error", "validation_failed");
    }

    @Test
    void unknownAccount_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/accounts/{id}/balance", Map.class, 555L);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).containsEntry("error", "not_found");
    }

    // =========================================================================
    // Transfers
    // =========================================================================

    @Test
    void transfer_returns201WithSenderBalance() {
        ResponseEntity<Map> resp = transfer(ALICE_ID, BOB_ID, "30.00");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(new BigDecimal(resp.getBody().get("balance").toString())).isEqualByComparingTo("70.00");
        Map<?, ?> tx = (Map<?, ?>) resp.getBody().get("transaction");
        assertThat(tx.get("kind")).isEqualTo("transfer");

        assertThat(getBalance(ALICE_ID)).isEqualByComparingTo("70.00");
        assertThat(getBalance(BOB_ID)).isEqualByComparingTo("30.00");
    }

    @Test
    void transfer_insufficientFunds_returns422() {
        ResponseEntity<Map> resp = transfer(BOB_ID, ALICE_ID, "1.00");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("error", "insufficient_funds");
        assertThat(getBalance(ALICE_ID)).isEqualByComparingTo("100.00");
    }

    @Test
    void transfer_toUnregisteredAccount_returns404() {
        ResponseEntity<Map> resp = transfer(ALICE_ID, CAROL_ID, "1.00");

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void transfer_withInvalidAmounts_returns400() {
        assertThat(transfer(ALICE_ID, BOB_ID, "0").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(transfer(ALICE_ID, BOB_ID, "-1").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(transfer(ALICE_ID, BOB_ID, "1.005").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

        Map<String, Object> missing = new HashMap<>();
        missing.put("sender_id", ALICE_ID);
        missing.put("recipient_id", BOB_ID);
        ResponseEntity<Map> resp = post("/api/v1/transfers", null, missing);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("error", "validation_failed");

        assertThat(getBalance(ALICE_ID)).isEqualByComparingTo("100.00");
    }

    @Test
    void history_listsNewestFirst() {
        transfer(ALICE_ID, BOB_ID, "10.00");
        transfer(BOB_ID, ALICE_ID, "2.50");

        ResponseEntity<Map> resp = restTemplate.getForEntity(
                "/api/v1/accounts/{id}/transactions?limit={l}", Map.class, BOB_ID, 10);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        List<?> entries = (List<?>) resp.getBody().get("entries");
        assertThat(entries).hasSize(2);
        assertThat(((Map<?, ?>) entries.get(0)).get("from_external_id")).isEqualTo((int) BOB_ID);
    }

    // =========================================================================
    // Admin
    // =========================================================================

    @Test
    void adjustment_byAdmin_returns201() {
        ResponseEntity<Map> resp = post("/api/v1/admin/adjustments", ADMIN_ID,
                Map.of("target_id", BOB_ID, "amount", 15, "direction", "debit", "note", "fine"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(getBalance(BOB_ID)).isEqualByComparingTo("-15.00");
    }

    @Test
    void adjustment_byNonAdmin_returns403() {
        ResponseEntity<Map> resp = post("/api/v1/admin/adjustments", ALICE_ID,
                Map.of("target_id", BOB_ID, "amount", 5, "direction", "credit"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(resp.getBody()).containsEntry("error", "unauthorized");
        assertThat(getBalance(BOB_ID)).isEqualByComparingTo("0.00");
    }

    @Test
    void adjustment_withoutAdminHeader_returns400() {
        ResponseEntity<Map> resp = post("/api/v1/admin/adjustments", null,
                Map.of("target_id", BOB_ID, "amount", 5, "direction", "credit"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody()).containsEntry("error", "missing_header");
    }

    @Test
    void adjustment_withUnknownDirection_returns400() {
        ResponseEntity<Map> resp = post("/api/v1/admin/adjustments", ADMIN_ID,
                Map.of("target_id", BOB_ID, "amount", 5, "direction", "sideways"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    // =========================================================================
    // Payment requests
    // =========================================================================

    @Test
    void paymentRequest_redeemOnceThen410() {
        ResponseEntity<Map> created = post("/api/v1/payment-requests", null,
                Map.of("requester_id", BOB_ID, "amount", 20));
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String token = (String) created.getBody().get("token");
        assertThat(created.getBody()).containsEntry("status", "REDEEMABLE")
                .containsEntry("requester_handle", "bob");

        ResponseEntity<Map> shown = restTemplate.getForEntity("/api/v1/payment-requests/{t}", Map.class, token);
        assertThat(shown.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<Map> paid = post("/api/v1/payment-requests/" + token + "/redemptions", null,
                Map.of("payer_id", ALICE_ID));
        assertThat(paid.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(new BigDecimal(paid.getBody().get("balance").toString())).isEqualByComparingTo("80.00");

        ResponseEntity<Map> again = post("/api/v1/payment-requests/" + token + "/redemptions", null,
                Map.of("payer_id", ALICE_ID));
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.GONE);
        assertThat(again.getBody()).containsEntry("error", "invalid_request");

        assertThat(restTemplate.getForEntity("/api/v1/payment-requests/{t}", Map.class, token).getStatusCode())
                .isEqualTo(HttpStatus.GONE);
        assertThat(restTemplate.getForEntity("/api/v1/payment-requests/{t}/status", Map.class, token).getBody())
                .containsEntry("status", "USED");
        assertThat(getBalance(BOB_ID)).isEqualByComparingTo("20.00");
    }

    @Test
    void paymentRequest_unknownToken_returns410() {
        ResponseEntity<Map> resp = post("/api/v1/payment-requests/nope/redemptions", null,
                Map.of("payer_id", ALICE_ID, "amount", 1));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.GONE);
    }

    @Test
    void reconciliation_matchesAfterActivity() {
        transfer(ALICE_ID, BOB_ID, "12.34");

        ResponseEntity<Map> resp = restTemplate.getForEntity(
                "/api/v1/accounts/{id}/reconciliation", Map.class, ALICE_ID);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("consistent", true);
    }
}
