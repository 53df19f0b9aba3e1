package com.flagship.transaction_engine.replay;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ReplayRunnerTest {

    private ReplayService replayService;
    private StringWriter output;
    private ReplayRunner runner;

    @BeforeEach
    void setUp() {
        replayService = mock(ReplayService.class);
        output = new StringWriter();
        runner = new ReplayRunner(replayService, output);
    }

    @Test
    @DisplayName("Missing argument should exit with failure without replaying")
    void testMissingArgument() {
        runner.run(new DefaultApplicationArguments());

        assertEquals(ReplayRunner.EXIT_FAILURE, runner.getExitCode());
        verifyNoInteractions(replayService);
    }

    @Test
    @DisplayName("Successful replay should exit with success")
    void testSuccessfulReplay() {
        runner.run(new DefaultApplicationArguments("transactions.csv"));

        assertEquals(ReplayRunner.EXIT_OK, runner.getExitCode());
        verify(replayService).replay(eq(Path.of("transactions.csv")), same(output));
    }

    @Test
    @DisplayName("Option arguments should not be taken as the input path")
    void testOptionArgumentsIgnored() {
        runner.run(new DefaultApplicationArguments("--logging.level.root=DEBUG", "transactions.csv"));

        verify(replayService).replay(eq(Path.of("transactions.csv")), any());
    }

    @Test
    @DisplayName("Failed replay should exit with failure")
    void testFailedReplay() {
        doThrow(new ReplayException("Cannot read transaction log", new IOException("boom")))
            .when(replayService).replay(any(Path.class), any());

        runner.run(new DefaultApplicationArguments("missing.csv"));

        assertEquals(ReplayRunner.EXIT_FAILURE, runner.getExitCode());
    }
}
