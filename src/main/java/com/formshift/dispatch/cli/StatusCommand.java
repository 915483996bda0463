package com.formshift.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.config.ConverterConfig;
import com.formshift.core.model.ConversionState;
import com.formshift.core.model.ConversionStatistics;
import com.formshift.core.persistence.CheckpointStore;
import com.formshift.core.tracking.FingerprintTracker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: formshift status --output &lt;dir&gt;
 * <p>
 * Shows the checkpoint of an interrupted run in the output directory, and how many forms
 * the fingerprint cache knows about.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show conversion progress for an output directory")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--output", "-o"}, required = true, description = "Output directory of a conversion")
    private Path output;

    private final ConverterConfig config;
    private final ObjectMapper objectMapper;

    public StatusCommand(ConverterConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var tracker = new FingerprintTracker(output, config.getIncremental().getCacheFileName(), objectMapper);
        tracker.load();
        ConsoleOutput.info("Fingerprint cache: " + tracker.size() + " form(s) tracked");

        var store = new CheckpointStore(output, config.getIncremental().getCheckpointFileName(), objectMapper);
        Optional<ConversionState> checkpoint = store.load();
        if (checkpoint.isEmpty()) {
            ConsoleOutput.success("No interrupted conversion in " + output);
            return 0;
        }

        ConversionState state = checkpoint.get();
        ConversionStatistics stats = state.getStatistics();
        System.out.println();
        System.out.println("CHECKPOINT " + store.checkpointFile());
        System.out.println("Source: " + state.getSourcePath());
        System.out.println("Started: " + state.getStartTime());
        ConsoleOutput.info(String.format("Progress: %d of %d form(s) processed",
                state.processedCount(), stats == null ? 0 : stats.getTotalForms()));

        System.out.println();
        System.out.printf("  %-10s %s%n", "STATUS", "FILE");
        System.out.println("  " + "-".repeat(64));
        state.getCompleted().forEach(f -> System.out.printf("  %-10s %s%n", "DONE", f));
        state.getInProgress().forEach(f -> System.out.printf("  %-10s %s%n", "RUNNING", f));
        for (Map.Entry<String, String> failed : state.getFailed().entrySet()) {
            System.out.printf("  %-10s %s (%s)%n", "FAILED", failed.getKey(), failed.getValue());
        }

        System.out.println();
        ConsoleOutput.info("Resume with: formshift convert --input " + state.getSourcePath()
                + " --output " + output + " --resume");
        return 0;
    }
}
