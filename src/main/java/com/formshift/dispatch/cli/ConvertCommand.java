package com.formshift.dispatch.cli;

import com.formshift.core.config.ConfigurationException;
import com.formshift.core.config.ConfigurationLoader;
import com.formshift.core.config.ConverterConfig;
import com.formshift.core.engine.CancellationSignal;
import com.formshift.core.engine.ConversionEngine;
import com.formshift.core.engine.ConversionRequest;
import com.formshift.core.engine.ConversionResult;
import com.formshift.core.engine.ProgressObserver;
import com.formshift.core.events.ConversionEvent;
import com.formshift.core.events.EventBus;
import com.formshift.core.layout.LayoutMode;
import com.formshift.core.model.ConversionOptions;
import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.ReportMessage;
import com.formshift.core.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: formshift convert --input &lt;dir&gt; --output &lt;dir&gt;
 * <p>
 * Resolves the effective configuration (Spring defaults, then a {@code .formshiftconfig}
 * file given with {@code --config} or found above the input directory, then command-line
 * flags), runs the conversion engine, prints per-form outcomes as their events arrive, then
 * the warnings, errors and statistics of the run.
 * Ctrl-C requests cancellation and waits for the rollback to finish before the JVM exits.
 */
@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Convert WinForms designer files into an Avalonia project")
@Component
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_FAILED = 2;
    static final int EXIT_USAGE = 64;
    static final int EXIT_CANCELLED = 130;

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private static final List<String> FEED_EVENTS = List.of(
            ConversionEvent.PHASE_CHANGED,
            ConversionEvent.FORM_CONVERTED,
            ConversionEvent.FORM_FAILED,
            ConversionEvent.FORM_SKIPPED);

    @Option(names = {"--input", "-i"}, required = true, description = "Directory containing the WinForms sources")
    private Path input;

    @Option(names = {"--output", "-o"}, required = true, description = "Directory receiving the Avalonia project")
    private Path output;

    @Option(names = "--layout", description = "Layout mode: auto or canvas (default: configured mode)")
    private String layout;

    @Option(names = "--incremental", description = "Skip forms whose source is unchanged since the last run")
    private boolean incremental;

    @Option(names = "--force", description = "Convert every form, ignoring the fingerprint cache")
    private boolean force;

    @Option(names = "--resume", description = "Continue an interrupted run from its checkpoint")
    private boolean resume;

    @Option(names = "--parallel", negatable = true,
            description = "Convert forms concurrently (default: configured)")
    private Boolean parallel;

    @Option(names = "--max-parallel", description = "Maximum concurrent forms, 0 for one per processor")
    private Integer maxParallel;

    @Option(names = "--dry-run", description = "Parse and analyze only; write nothing")
    private boolean dryRun;

    @Option(names = "--migration-guide", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Write the migration guide (default: ${DEFAULT-VALUE})")
    private boolean migrationGuide;

    @Option(names = "--report", description = "Write a run report to this file")
    private Path report;

    @Option(names = "--report-format", description = "Report format: md, json or csv (default: from file name)")
    private String reportFormat;

    @Option(names = "--config", description = "Configuration file (default: nearest .formshiftconfig)")
    private Path configFile;

    @Option(names = "--git", description = "Commit the output when it is inside a git repository")
    private boolean git;

    private final ConversionEngine engine;
    private final ConverterConfig baseConfig;
    private final ConfigurationLoader configurationLoader;
    private final EventBus eventBus;

    public ConvertCommand(ConversionEngine engine, ConverterConfig baseConfig, ConfigurationLoader configurationLoader,
                          EventBus eventBus) {
        this.engine = engine;
        this.baseConfig = baseConfig;
        this.configurationLoader = configurationLoader;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ConverterConfig config;
        ConversionOptions options;
        ReportFormat format;
        try {
            config = resolveConfig();
            options = buildOptions(config);
            format = reportFormat == null ? null : ReportFormat.fromString(reportFormat);
        } catch (ConfigurationException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_USAGE;
        }

        ConsoleOutput.info("Converting " + input + " -> " + output + (options.dryRun() ? " (dry run)" : ""));
        var request = new ConversionRequest(input, output, config, options, report, format);
        ConversionResult result;
        try (var feed = eventBus.subscribeTo(FEED_EVENTS, ConsoleOutput::event)) {
            result = runWithInterruptHandling(request);
        }
        printResult(result);
        return exitCode(result.outcome());
    }

    ConverterConfig resolveConfig() {
        if (configFile != null) {
            return configurationLoader.load(configFile, baseConfig);
        }
        Optional<Path> found = configurationLoader.findConfigurationFile(input);
        return found.map(f -> configurationLoader.loadOrDefault(f, baseConfig)).orElse(baseConfig);
    }

    ConversionOptions buildOptions(ConverterConfig config) {
        return ConversionOptions.defaults()
                .withIncremental(incremental && config.getIncremental().isEnabled())
                .withForce(force)
                .withResume(resume)
                .withParallel(parallel != null ? parallel : config.getParallel().isEnabled(),
                        maxParallel != null ? maxParallel : config.getParallel().getMaxDegreeOfParallelism())
                .withDryRun(dryRun)
                .withMigrationGuide(migrationGuide)
                .withLayoutMode(layout == null ? null : LayoutMode.fromString(layout))
                .withGitCommit(git);
    }

    private ConversionResult runWithInterruptHandling(ConversionRequest request) {
        var cancel = new CancellationSignal();
        var finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            ConsoleOutput.warn("Interrupted; cancelling and rolling back...");
            cancel.cancel();
            try {
                if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Rollback did not finish within {}s", SHUTDOWN_WAIT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "formshift-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return engine.run(request, cancel, ProgressObserver.NONE);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; shutdown hook stays registered");
            }
        }
    }

    private static void printResult(ConversionResult result) {
        System.out.println();
        if (result.report() != null) {
            for (ReportMessage warning : result.report().warnings()) {
                ConsoleOutput.warn(warning.toString());
            }
            for (ReportMessage error : result.report().errors()) {
                ConsoleOutput.error(error.toString());
            }
            ConsoleOutput.statistics(result.report().statistics(), result.report().elapsed());
        }
        result.rollbackReport().ifPresent(ConsoleOutput::rollback);
        System.out.println();
        ConsoleOutput.outcome(result.outcome(), result.message());
    }

    static int exitCode(ConversionOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> EXIT_SUCCESS;
            case PARTIAL_SUCCESS -> EXIT_PARTIAL;
            case FAILED -> EXIT_FAILED;
            case CANCELLED -> EXIT_CANCELLED;
        };
    }
}
