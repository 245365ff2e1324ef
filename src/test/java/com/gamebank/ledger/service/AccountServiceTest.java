package com.gamebank.ledger.service;

import com.gamebank.ledger.exception.InvalidRegistrationException;
import com.gamebank.ledger.exception.UnauthorizedException;
import com.gamebank.ledger.model.Account;
import com.gamebank.ledger.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("h2")
@Import(TestClockConfig.class)
@Sql(
    scripts = {"/db/truncate.sql", "/db/seed.sql"},
    executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD
)
class AccountServiceTest {

    private static final long ADMIN = 1000L;
    private static final long ALICE = 1001L;
    private static final long BOB   = 1002L;
    private static final long CAROL = 1003L;
    private static final long DAVE  = 1004L;

    // matches ledger.bootstrap-admin-id in application-h2.yml
    private static final long BOOTSTRAP_ADMIN = 9000L;

    @Autowired
    private AccountService accountService;

    @Test
    void createOrGet_createsUnregisteredZeroBalanceAccountOnce() {
        Account created = accountService.createOrGet(5000L, "@Newbie");

        assertThat(created.getHandle()).isEqualTo("Newbie");
        assertThat(created.isRegistered()).isFalse();
        assertThat(created.isAdmin()).isFalse();
        assertThat(created.getBalance()).isEqualByComparingTo("0.00");

        Account again = accountService.createOrGet(5000L, null);
        assertThat(again.getId()).isEqualTo(created.getId());
        assertThat(again.getHandle()).isEqualTo("Newbie");
    }

    @Test
    void createOrGet_refreshesChangedHandle() {
        Account refreshed = accountService.createOrGet(ALICE, "alice_new");

        assertThat(refreshed.getHandle()).isEqualTo("alice_new");
        assertThat(accountService.resolve(ALICE)).get()
                .extracting(Account::getHandle).isEqualTo("alice_new");
        assertThat(refreshed.getBalance()).isEqualByComparingTo("100.00");
    }

    @Test
    void bootstrapIdentity_becomesAdminAndStaysAdminAfterRegistration() {
        assertThat(accountService.createOrGet(BOOTSTRAP_ADMIN, "root").isAdmin()).isTrue();

        Account registered = accountService.completeRegistration(BOOTSTRAP_ADMIN, null, "Root", "900");

        assertThat(registered.isAdmin()).isTrue();
        assertThat(registered.isActive()).isTrue();
        assertThat(registered.getHandle()).isEqualTo("root");
    }

    @Test
    void completeRegistration_activatesAccount() {
        Account registered = accountService.completeRegistration(CAROL, "carol", " Carol ", "103");

        assertThat(registered.isRegistered()).isTrue();
        assertThat(registered.getDisplayName()).isEqualTo("Carol");
        assertThat(registered.getGameId()).isEqualTo("103");
        assertThat(registered.isAdmin()).isFalse();
        assertThat(accountService.requireActive(CAROL).getId()).isEqualTo(registered.getId());
    }

    @Test
    void completeRegistration_keepsExistingAdminFlag() {
        assertThat(accountService.completeRegistration(ADMIN, null, "Boss", "1").isAdmin()).isTrue();
    }

    @Test
    void completeRegistration_rejectsBlankFields() {
        assertThatThrownBy(() -> accountService.completeRegistration(CAROL, null, " ", "103"))
                .isInstanceOf(InvalidRegistrationException.class);
        assertThatThrownBy(() -> accountService.completeRegistration(CAROL, null, "Carol", null))
                .isInstanceOf(InvalidRegistrationException.class);

        assertThat(accountService.resolve(CAROL)).get()
                .extracting(Account::isRegistered).isEqualTo(false);
    }

    @Test
    void resolveByHandle_ignoresCaseAndAtSignAndSkipsInactive() {
        assertThat(accountService.resolveByHandle("@ALICE")).get()
                .extracting(Account::getExternalId).isEqualTo(ALICE);
        assertThat(accountService.resolveByHandle("dave")).isEmpty();
        assertThat(accountService.resolveByHandle("carol")).isEmpty();
        assertThat(accountService.resolveByHandle("@")).isEmpty();
    }

    @Test
    void resolveByGameIdAndDisplayName_findActiveAccounts() {
        assertThat(accountService.resolveByGameId("102")).get()
                .extracting(Account::getExternalId).isEqualTo(BOB);
        assertThat(accountService.resolveByDisplayName("Alice")).get()
                .extracting(Account::getExternalId).isEqualTo(ALICE);
        assertThat(accountService.resolveByGameId("104")).isEmpty();
    }

    @Test
    void listActive_ordersByDisplayName() {
        assertThat(accountService.listActive(100))
                .extracting(Account::getExternalId)
                .containsExactly(ADMIN, ALICE, BOB);
        assertThat(accountService.listActive(2)).hasSize(2);
    }

    @Test
    void softDelete_requiresAdmin() {
        assertThatThrownBy(() -> accountService.softDelete(ALICE, BOB))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(accountService.resolve(BOB)).get()
                .extracting(Account::isDeleted).isEqualTo(false);
    }

    @Test
    void softDeleteAndRestore_toggleVisibility() {
        accountService.softDelete(ADMIN, BOB);
        assertThat(accountService.resolveByHandle("bob")).isEmpty();
        assertThat(accountService.resolve(BOB)).isPresent();

        Account restored = accountService.restore(ADMIN, BOB);
        assertThat(restored.isDeleted()).isFalse();
        assertThat(accountService.resolveByHandle("bob")).isPresent();
        assertThat(accountService.resolve(DAVE)).get()
                .extracting(Account::isDeleted).isEqualTo(true);
    }

    @Test
    void requireAdmin_rejectsDeletedAdmin() {
        accountService.completeRegistration(BOOTSTRAP_ADMIN, "root", "Root", "900");
        accountService.softDelete(BOOTSTRAP_ADMIN, ADMIN);

        assertThatThrownBy(() -> accountService.requireAdmin(ADMIN, "adjust balances"))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessageContaining("1000");
    }
}
