package com.formshift.dispatch.cli;

import com.formshift.core.config.ConfigurationLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: formshift init-config [PATH]
 * <p>
 * Writes a {@code .formshiftconfig} holding every default setting.
 */
@Command(name = "init-config", mixinStandardHelpOptions = true,
        description = "Write a configuration file with default settings")
@Component
public class InitConfigCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", defaultValue = ".",
            description = "Target file or directory (default: current directory)")
    private Path target;

    @Option(names = "--force", description = "Overwrite an existing file")
    private boolean force;

    private final ConfigurationLoader configurationLoader;

    public InitConfigCommand(ConfigurationLoader configurationLoader) {
        this.configurationLoader = configurationLoader;
    }

    @Override
    public Integer call() {
        Path file = Files.isDirectory(target) ? target.resolve(ConfigurationLoader.FILE_NAME) : target;
        if (Files.exists(file) && !force) {
            ConsoleOutput.error(file + " already exists; use --force to overwrite");
            return 1;
        }
        try {
            Path written = configurationLoader.writeTemplate(file);
            ConsoleOutput.success("Wrote " + written);
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Could not write " + file + ": " + e.getMessage());
            return 2;
        }
    }
}
