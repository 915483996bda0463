package com.formshift.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for formshift.
 * Routes to subcommands: convert, init-config, status.
 */
@Command(
        name = "formshift",
        mixinStandardHelpOptions = true,
        version = "formshift 0.1.0",
        description = "Converts WinForms designer files into an Avalonia MVVM project",
        subcommands = {
                ConvertCommand.class,
                InitConfigCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FormshiftCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
