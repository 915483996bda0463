package com.formshift.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final FormshiftCommand formshiftCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FormshiftCommand formshiftCommand, IFactory factory) {
        this.formshiftCommand = formshiftCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        var cmd = new CommandLine(formshiftCommand, factory);
        cmd.getCommandSpec().exitCodeOnInvalidInput(ConvertCommand.EXIT_USAGE);
        for (CommandLine sub : cmd.getSubcommands().values()) {
            sub.getCommandSpec().exitCodeOnInvalidInput(ConvertCommand.EXIT_USAGE);
        }
        return cmd;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
