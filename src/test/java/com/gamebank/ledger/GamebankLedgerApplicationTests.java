package com.gamebank.ledger;

import com.gamebank.ledger.controller.AccountController;
import com.gamebank.ledger.controller.AdminController;
import com.gamebank.ledger.controller.PaymentRequestController;
import com.gamebank.ledger.controller.TransferController;
import com.gamebank.ledger.service.AccountService;
import com.gamebank.ledger.service.LedgerService;
import com.gamebank.ledger.service.PaymentRequestService;
import com.gamebank.ledger.service.RequestTokenGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("h2")
class GamebankLedgerApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(RequestTokenGenerator.class).nextToken()).hasSize(22);
        assertThat(context.getBeansOfType(AccountService.class)).hasSize(1);
        assertThat(context.getBeansOfType(LedgerService.class)).hasSize(1);
        assertThat(context.getBeansOfType(PaymentRequestService.class)).hasSize(1);
        assertThat(context.getBeansOfType(AccountController.class)).hasSize(1);
        assertThat(context.getBeansOfType(TransferController.class)).hasSize(1);
        assertThat(context.getBeansOfType(AdminController.class)).hasSize(1);
        assertThat(context.getBeansOfType(PaymentRequestController.class)).hasSize(1);
    }
}
