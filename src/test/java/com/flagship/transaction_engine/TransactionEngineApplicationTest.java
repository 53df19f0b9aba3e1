package com.flagship.transaction_engine;

import com.flagship.transaction_engine.csv.AccountCsvWriter;
import com.flagship.transaction_engine.replay.ReplayRunner;
import com.flagship.transaction_engine.replay.ReplayService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TransactionEngineApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("Context should wire the replay pipeline without the command-line runner")
    void testContextLoads() {
        assertNotNull(context.getBean(ReplayService.class));
        assertNotNull(context.getBean(AccountCsvWriter.class));
        assertTrue(context.getBeansOfType(ReplayRunner.class).isEmpty(),
            "Runner is disabled in tests");
    }
}
