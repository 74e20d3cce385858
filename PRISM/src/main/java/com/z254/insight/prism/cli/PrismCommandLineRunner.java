package com.z254.insight.prism.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Hands the process arguments to {@link AnalyticsCommand} and keeps its exit code for
 * {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
@ConditionalOnProperty(prefix = "prism.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PrismCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AnalyticsCommand command;
    private int exitCode;

    public PrismCommandLineRunner(AnalyticsCommand command) {
        this.command = command;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
