package com.flagship.transaction_engine.replay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code transaction-engine <transactions.csv>}.
 *
 * Replays the given log and prints the account report to standard output.
 * Exit codes: 0 on success, 1 when the argument is missing or the replay fails.
 * Diagnostics go to the log (standard error), never to standard output.
 */
@Component
@ConditionalOnProperty(name = "transaction-engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class ReplayRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ReplayService replayService;
    private final Writer output;

    private int exitCode = EXIT_OK;

    @Autowired
    public ReplayRunner(ReplayService replayService) {
        this(replayService, new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    ReplayRunner(ReplayService replayService, Writer output) {
        this.replayService = replayService;
        this.output = output;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> paths = args.getNonOptionArgs();
        if (paths.isEmpty()) {
            log.error("Missing argument: expected path to a transaction CSV file");
            exitCode = EXIT_FAILURE;
            return;
        }
        if (paths.size() > 1) {
            log.warn("Ignoring extra arguments: {}", paths.subList(1, paths.size()));
        }

        Path input = Path.of(paths.get(0));
        try {
            replayService.replay(input, output);
            exitCode = EXIT_OK;
        } catch (ReplayException e) {
            log.error("Application error: {}", e.getMessage());
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
