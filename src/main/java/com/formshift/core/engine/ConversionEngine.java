package com.formshift.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.config.ConverterConfig;
import com.formshift.core.docs.MigrationGuideGenerator;
import com.formshift.core.events.ConversionEvent;
import com.formshift.core.events.EventBus;
import com.formshift.core.generator.ArtifactEmitter;
import com.formshift.core.generator.ControlMappings;
import com.formshift.core.generator.FormStatistics;
import com.formshift.core.generator.GeneratedArtifact;
import com.formshift.core.generator.NamingContext;
import com.formshift.core.generator.ProjectFileGenerator;
import com.formshift.core.git.GitException;
import com.formshift.core.git.GitIntegration;
import com.formshift.core.layout.LayoutAnalysisContext;
import com.formshift.core.layout.LayoutInferenceEngine;
import com.formshift.core.logging.MdcContext;
import com.formshift.core.metrics.ConversionMetrics;
import com.formshift.core.model.ControlNode;
import com.formshift.core.model.ConversionOptions;
import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.ConversionPhase;
import com.formshift.core.model.ConversionProgress;
import com.formshift.core.model.ConversionReport;
import com.formshift.core.model.ConversionState;
import com.formshift.core.model.ConversionStatistics;
import com.formshift.core.model.FormReport;
import com.formshift.core.model.FormStatus;
import com.formshift.core.model.FormTally;
import com.formshift.core.model.LayoutAnalysisResult;
import com.formshift.core.model.ReportMessage;
import com.formshift.core.parsing.FormParser;
import com.formshift.core.parsing.ParseResult;
import com.formshift.core.persistence.CheckpointStore;
import com.formshift.core.report.ReportBuilder;
import com.formshift.core.scanner.SourceDiscovery;
import com.formshift.core.tracking.FingerprintTracker;
import com.formshift.core.transaction.FileSink;
import com.formshift.core.transaction.GuardedFileWriter;
import com.formshift.core.transaction.RollbackReport;
import com.formshift.core.transaction.TransactionalFileGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a conversion run from source discovery to the committed output.
 * <p>
 * Phases: {@code INIT -> PARSE -> (ANALYZE -> GENERATE per form) -> PROJECT_FILES ->
 * DOCUMENTATION -> COMMIT -> COMPLETE}. Every write of the run, the checkpoint included,
 * goes through one {@link TransactionalFileGuard} transaction opened before the first write,
 * so cancellation and unexpected failures both end in a rollback that leaves the output
 * directory as it was found.
 * <p>
 * Per-form parse and generation failures are recorded and the run continues. Cancellation is
 * checked between phases and between forms; in parallel mode no new form is started once it
 * is observed and in-flight forms are allowed to finish before the rollback.
 * <p>
 * Shared run state (statistics, checkpoint state, form reports) is only touched under the
 * run's lock. The engine itself keeps no per-run state and can run several conversions at once.
 */
@Service
public class ConversionEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversionEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger(0);

    static final String DESIGNER_SUFFIX = ".Designer.cs";

    private final SourceDiscovery discovery;
    private final FormParser parser;
    private final LayoutInferenceEngine layoutEngine;
    private final List<ArtifactEmitter> emitters;
    private final ProjectFileGenerator projectFiles;
    private final MigrationGuideGenerator guideGenerator;
    private final ReportBuilder reportBuilder;
    private final GitIntegration git;
    private final EventBus eventBus;
    private final ConversionMetrics metrics;
    private final ObjectMapper objectMapper;

    public ConversionEngine(SourceDiscovery discovery, FormParser parser, LayoutInferenceEngine layoutEngine,
                            List<ArtifactEmitter> emitters, ProjectFileGenerator projectFiles,
                            MigrationGuideGenerator guideGenerator, ReportBuilder reportBuilder,
                            GitIntegration git, EventBus eventBus, ConversionMetrics metrics,
                            ObjectMapper objectMapper) {
        this.discovery = discovery;
        this.parser = parser;
        this.layoutEngine = layoutEngine;
        this.emitters = List.copyOf(emitters);
        this.projectFiles = projectFiles;
        this.guideGenerator = guideGenerator;
        this.reportBuilder = reportBuilder;
        this.git = git;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /** A form that parsed and still needs analysis and generation. */
    record PendingForm(Path file, ControlNode root) {}

    /** Mutable state of one run; guarded by {@link #lock} where shared with workers. */
    private final class Run {
        final String runId;
        final ConversionRequest request;
        final ConverterConfig config;
        final ConversionOptions options;
        final Path source;
        final Path output;
        final CancellationSignal cancel;
        final ProgressReporter progress;
        final Instant startTime = Instant.now();

        final Object lock = new Object();
        final TransactionalFileGuard guard = new TransactionalFileGuard();
        final GuardedFileWriter writer = new GuardedFileWriter(guard);
        final FingerprintTracker tracker;
        final CheckpointStore checkpoints;
        final ConversionStatistics stats = new ConversionStatistics();
        final List<FormReport> forms = new ArrayList<>();
        final List<ReportMessage> warnings = new ArrayList<>();
        final List<ReportMessage> errors = new ArrayList<>();
        final Set<Path> written = new LinkedHashSet<>();
        final Set<String> formNames = new HashSet<>();
        final Map<String, NamingContext> windows = new TreeMap<>();

        LayoutAnalysisContext layoutContext;
        ConversionState state;
        ConversionPhase phase = ConversionPhase.INIT;
        int processed;
        int sinceCheckpoint;

        Run(String runId, ConversionRequest request, CancellationSignal cancel, ProgressObserver observer) {
            this.runId = runId;
            this.request = request;
            this.config = request.config();
            this.options = request.options();
            this.source = request.sourcePath().toAbsolutePath().normalize();
            this.output = request.outputPath().toAbsolutePath().normalize();
            this.cancel = cancel;
            this.progress = new ProgressReporter(observer == null ? ProgressObserver.NONE : observer,
                    config.getProgress().getThrottleMillis());
            this.tracker = new FingerprintTracker(output, config.getIncremental().getCacheFileName(), objectMapper);
            this.checkpoints = new CheckpointStore(output, config.getIncremental().getCheckpointFileName(), objectMapper);
        }
    }

    public ConversionResult run(ConversionRequest request, CancellationSignal cancel, ProgressObserver observer) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            if (request.sourcePath() == null || request.outputPath() == null) {
                return failedBeforeStart(runId, request, "Source and output paths are required");
            }
            if (!Files.isDirectory(request.sourcePath())) {
                return failedBeforeStart(runId, request, "Source directory not found: " + request.sourcePath());
            }
            Run run = new Run(runId, request, cancel == null ? new CancellationSignal() : cancel, observer);
            return execute(run);
        } finally {
            MdcContext.clear();
        }
    }

    public ConversionResult run(ConversionRequest request) {
        return run(request, new CancellationSignal(), ProgressObserver.NONE);
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("FSR-%d-%04d", year, count);
    }

    // -- Run ------------------------------------------------------------------

    private ConversionResult execute(Run run) {
        log.info("Starting conversion {} of {} into {}{}", run.runId, run.source, run.output,
                run.options.dryRun() ? " (dry run)" : "");
        publish(run, ConversionEvent.CONVERSION_STARTED, null, Map.of(
                "source", run.source.toString(),
                "output", run.output.toString(),
                "dryRun", run.options.dryRun()));
        reportProgress(run, "init", null);

        try {
            run.layoutContext = layoutContext(run);
            run.tracker.load();
            run.state = initialState(run);

            String pattern = run.config.getNaming().getSourcePattern();
            List<Path> files = discovery.discover(run.source, pattern, run.config.getExcludePatterns());
            synchronized (run.lock) {
                run.stats.setTotalForms(files.size());
            }
            if (files.isEmpty()) {
                warn(run, null, "No files matching " + pattern + " under " + run.source);
            }
            if (run.cancel.isCancelled()) {
                return cancelled(run);
            }

            if (!run.options.dryRun()) {
                run.guard.begin();
                run.writer.createDirectories(run.output);
            }

            enterPhase(run, ConversionPhase.PARSE, null);
            List<PendingForm> pending = parseAll(run, files);
            if (run.cancel.isCancelled()) {
                return cancelled(run);
            }
            saveCheckpoint(run);

            convertAll(run, pending);
            if (run.cancel.isCancelled()) {
                return cancelled(run);
            }

            ConversionOutcome outcome = outcomeOf(run);
            if (!run.options.dryRun()) {
                enterPhase(run, ConversionPhase.PROJECT_FILES, null);
                writeProjectFiles(run);

                if (run.options.migrationGuide() && run.config.getDocumentation().isEnabled()) {
                    enterPhase(run, ConversionPhase.DOCUMENTATION, null);
                    writeMigrationGuide(run, outcome);
                }
                if (run.request.reportPath() != null) {
                    writeReport(run, outcome);
                }
                if (run.cancel.isCancelled()) {
                    return cancelled(run);
                }

                RollbackReport commit = run.guard.commit();
                commit.failures().forEach(f -> warn(run, null, "Cleanup: " + f));
                persistFingerprints(run);
                clearCheckpoint(run);

                if (run.options.gitCommit() || run.config.getGit().isEnabled()) {
                    enterPhase(run, ConversionPhase.COMMIT, null);
                    commitToGit(run);
                }
            }

            enterPhase(run, ConversionPhase.COMPLETE, null);
            ConversionReport report = buildReport(run, outcome);
            String message = summary(run, outcome);
            metrics.recordRunResult(outcome);
            publish(run, ConversionEvent.CONVERSION_COMPLETED, null, Map.of(
                    "outcome", outcome.name(),
                    "converted", report.statistics().getConvertedForms(),
                    "failed", report.statistics().getFailedForms()));
            log.info("Conversion {} finished: {}", run.runId, message);
            return new ConversionResult(outcome, message, report, run.output, null);
        } catch (Exception e) {
            return failed(run, e);
        }
    }

    private LayoutAnalysisContext layoutContext(Run run) {
        LayoutAnalysisContext context = run.config.layoutContext();
        return run.options.layoutMode() == null ? context : context.withMode(run.options.layoutMode());
    }

    private ConversionState initialState(Run run) {
        if (run.options.resume()) {
            Optional<ConversionState> saved = run.checkpoints.load();
            if (saved.isPresent() && saved.get().matches(run.source, run.output)) {
                log.info("Resuming from checkpoint: {} form(s) already completed", saved.get().getCompleted().size());
                return saved.get();
            }
            if (saved.isPresent()) {
                warn(run, null, "Checkpoint was taken for a different source or output; starting fresh");
            } else {
                log.info("No checkpoint found in {}; starting fresh", run.output);
            }
        }
        return new ConversionState(run.source, run.output, run.startTime);
    }

    // -- Parse ----------------------------------------------------------------

    private List<PendingForm> parseAll(Run run, List<Path> files) {
        List<PendingForm> pending = new ArrayList<>();
        for (Path file : files) {
            if (run.cancel.isCancelled()) {
                break;
            }
            String name = formNameFor(file);
            if (run.options.resume() && run.state.isCompleted(file.toString())) {
                skip(run, file, name, FormStatus.RESUMED);
                rememberWindow(run, file);
                continue;
            }
            if (run.options.incremental() && !run.options.force() && isUnchanged(run, file)) {
                skip(run, file, name, FormStatus.UP_TO_DATE);
                continue;
            }

            reportProgress(run, "parse", name);
            ParseResult result;
            try {
                result = parser.parse(file);
            } catch (RuntimeException e) {
                log.debug("Parser error in {}", file, e);
                recordFailure(run, file, name, "Parse failed: " + describe(e));
                continue;
            }
            if (!result.isSuccess()) {
                recordFailure(run, file, name, "Parse failed: " + result.failureReason());
                continue;
            }
            ControlNode root = result.root();
            for (String warning : result.warnings()) {
                warn(run, root.name(), warning);
            }
            synchronized (run.lock) {
                run.stats.addTotalControls(root.subtreeSize());
            }
            pending.add(new PendingForm(file, root));
        }
        log.info("Parsed {} form(s), {} to convert", files.size(), pending.size());
        return pending;
    }

    /**
     * Registers a form converted before the resume as a window candidate, so the project
     * files written by this run still name a main view.
     */
    private void rememberWindow(Run run, Path file) {
        ParseResult result;
        try {
            result = parser.parse(file);
        } catch (RuntimeException e) {
            log.debug("Cannot re-read resumed form {}: {}", file, e.getMessage());
            return;
        }
        if (result.isSuccess() && isWindow(result.root())) {
            NamingContext naming = NamingContext.of(run.config.getNaming(), result.root().name());
            synchronized (run.lock) {
                run.windows.put(file.toString(), naming);
            }
        }
    }

    private boolean isUnchanged(Run run, Path file) {
        try {
            return !run.tracker.hasChanged(file);
        } catch (IOException e) {
            log.debug("Cannot fingerprint {}: {}", file, e.getMessage());
            return false;
        }
    }

    // -- Analyze and generate -------------------------------------------------

    private void convertAll(Run run, List<PendingForm> pending) {
        if (pending.isEmpty()) {
            return;
        }
        int workers = parallelism(run, pending.size());
        if (workers <= 1) {
            for (PendingForm form : pending) {
                if (run.cancel.isCancelled()) {
                    return;
                }
                convertForm(run, form);
            }
            return;
        }

        log.info("Converting {} form(s) on {} worker(s)", pending.size(), workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "formshift-worker-" + WORKER_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        // a permit is taken before submitting, so no form ever waits in the executor queue
        var permits = new Semaphore(workers);
        var futures = new ArrayList<CompletableFuture<Void>>();
        try {
            for (PendingForm form : pending) {
                if (run.cancel.isCancelled()) {
                    log.info("Cancellation observed; not starting further forms");
                    break;
                }
                permits.acquire();
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        convertForm(run, form);
                    } finally {
                        permits.release();
                    }
                }, executor));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel.cancel();
        } finally {
            for (CompletableFuture<Void> future : futures) {
                try {
                    future.join();
                } catch (RuntimeException e) {
                    log.error("Unexpected error in form worker", e);
                }
            }
            executor.shutdown();
        }
    }

    private int parallelism(Run run, int forms) {
        if (!run.options.parallel()) {
            return 1;
        }
        int max = run.options.maxParallel() > 0
                ? run.options.maxParallel()
                : run.config.getParallel().getMaxDegreeOfParallelism();
        if (max <= 0) {
            max = Runtime.getRuntime().availableProcessors();
        }
        return Math.max(1, Math.min(max, forms));
    }

    private void convertForm(Run run, PendingForm form) {
        ControlNode root = form.root();
        String name = root.name();
        String key = form.file().toString();
        MdcContext.setForm(run.runId, name);
        long started = System.currentTimeMillis();
        try {
            synchronized (run.lock) {
                run.state.markInProgress(key);
                if (!run.formNames.add(name)) {
                    warnLocked(run, name, "Another form has the same name; its output files are overwritten");
                }
            }

            enterPhase(run, ConversionPhase.ANALYZE, name);
            LayoutAnalysisResult layout = layoutEngine.analyze(root, run.layoutContext);
            metrics.recordLayoutDecision(layout.kind());
            FormTally tally = FormStatistics.tally(root);
            NamingContext naming = NamingContext.of(run.config.getNaming(), name);

            List<String> generated = List.of();
            if (!run.options.dryRun()) {
                enterPhase(run, ConversionPhase.GENERATE, name);
                generated = emit(run, root, layout, naming);
                try {
                    run.tracker.update(form.file());
                } catch (IOException e) {
                    log.warn("Could not fingerprint {}: {}", form.file(), e.getMessage());
                }
            }

            long elapsed = System.currentTimeMillis() - started;
            synchronized (run.lock) {
                run.state.markCompleted(key);
                run.stats.addForm(tally);
                run.forms.add(FormReport.converted(name, key, layout, generated, tally,
                        FormStatistics.placeholders(root)));
                if (isWindow(root)) {
                    run.windows.put(key, naming);
                }
                run.processed++;
                run.sinceCheckpoint++;
            }
            metrics.recordFormDuration(layout.kind(), elapsed);
            log.info("Converted {} as {} ({}%) in {} ms", name, layout.kind(), layout.confidence(), elapsed);
            publish(run, ConversionEvent.FORM_CONVERTED, name, Map.of(
                    "layout", layout.kind().name(),
                    "confidence", layout.confidence(),
                    "files", generated.size()));
            reportProgress(run, "converted", name);
        } catch (IOException | RuntimeException e) {
            recordFailure(run, form.file(), name, "Generation failed: " + describe(e));
        } finally {
            maybeCheckpoint(run);
            MdcContext.clearForm();
        }
    }

    private List<String> emit(Run run, ControlNode root, LayoutAnalysisResult layout, NamingContext naming)
            throws IOException {
        List<String> generated = new ArrayList<>();
        for (ArtifactEmitter emitter : emitters) {
            for (GeneratedArtifact artifact : emitter.emit(root, layout, naming)) {
                Path target = resolveInOutput(run, artifact.relativePath());
                if (!artifact.overwrite() && Files.exists(target)) {
                    log.debug("Keeping existing {}", target);
                    continue;
                }
                write(run, target, artifact.content());
                generated.add(artifact.relativePath());
            }
        }
        return generated;
    }

    private static boolean isWindow(ControlNode root) {
        return ControlMappings.lookup(root.kind())
                .map(m -> "Window".equals(m.targetType()))
                .orElse(false);
    }

    // -- Per-form bookkeeping -------------------------------------------------

    private void skip(Run run, Path file, String name, FormStatus status) {
        synchronized (run.lock) {
            run.state.markCompleted(file.toString());
            if (status == FormStatus.UP_TO_DATE) {
                run.stats.incrementUpToDateForms();
            }
            run.forms.add(FormReport.skipped(name, file.toString(), status));
            run.processed++;
        }
        log.info("Skipping {}: {}", name, status == FormStatus.RESUMED ? "completed before resume" : "unchanged");
        publish(run, ConversionEvent.FORM_SKIPPED, name, Map.of("status", status.name()));
        reportProgress(run, "skip", name);
    }

    private void recordFailure(Run run, Path file, String name, String reason) {
        synchronized (run.lock) {
            run.state.markFailed(file.toString(), reason);
            run.stats.incrementFailedForms();
            run.forms.add(FormReport.failed(name, file.toString(), reason));
            run.errors.add(ReportMessage.error(name, reason));
            run.processed++;
            run.sinceCheckpoint++;
        }
        log.warn("Form {} failed: {}", name, reason);
        publish(run, ConversionEvent.FORM_FAILED, name, Map.of("reason", reason));
        reportProgress(run, "failed", name);
    }

    private void warn(Run run, String form, String message) {
        synchronized (run.lock) {
            warnLocked(run, form, message);
        }
    }

    private void warnLocked(Run run, String form, String message) {
        run.warnings.add(ReportMessage.warning(form, message));
        log.warn("{}{}", form == null ? "" : form + ": ", message);
    }

    // -- Writes ---------------------------------------------------------------

    private void write(Run run, Path target, String content) throws IOException {
        run.writer.writeString(target, content);
        synchronized (run.lock) {
            run.written.add(target.toAbsolutePath().normalize());
            run.state.recordGeneratedFile(target);
            run.stats.addFilesGenerated(1);
        }
    }

    private static Path resolveInOutput(Run run, String relativePath) {
        Path target = run.output.resolve(relativePath).normalize();
        if (!target.startsWith(run.output)) {
            throw new IllegalArgumentException("Generated path escapes the output directory: " + relativePath);
        }
        return target;
    }

    private void writeProjectFiles(Run run) throws IOException {
        NamingContext mainView;
        synchronized (run.lock) {
            boolean resumed = run.forms.stream().anyMatch(f -> f.status() == FormStatus.RESUMED);
            if (run.stats.getConvertedForms() == 0 && !resumed) {
                log.info("No form converted in this run; project files left unchanged");
                return;
            }
            mainView = run.windows.isEmpty() ? null : run.windows.values().iterator().next();
        }
        for (GeneratedArtifact artifact : projectFiles.generate(run.config.getNaming().getNamespace(), mainView)) {
            write(run, resolveInOutput(run, artifact.relativePath()), artifact.content());
        }
    }

    private void writeMigrationGuide(Run run, ConversionOutcome outcome) throws IOException {
        String guide = guideGenerator.generate(run.config.getNaming().getNamespace(), buildReport(run, outcome));
        write(run, resolveInOutput(run, run.config.getDocumentation().getOutputFileName()), guide);
    }

    private void writeReport(Run run, ConversionOutcome outcome) throws IOException {
        Path target = run.request.reportPath().toAbsolutePath().normalize();
        write(run, target, reportBuilder.render(buildReport(run, outcome), run.request.effectiveReportFormat()));
        log.info("Report written to {}", target);
    }

    private void saveCheckpoint(Run run) throws IOException {
        if (run.options.dryRun()) {
            return;
        }
        synchronized (run.lock) {
            run.stats.incrementCheckpointsSaved();
            run.state.setStatistics(run.stats.copy());
            run.state.setFingerprints(run.tracker.snapshot());
            run.checkpoints.save(run.state, run.writer);
            run.sinceCheckpoint = 0;
        }
    }

    private void maybeCheckpoint(Run run) {
        int frequency = Math.max(1, run.config.getIncremental().getCheckpointFrequency());
        synchronized (run.lock) {
            if (run.options.dryRun() || run.sinceCheckpoint < frequency || !run.guard.isOpen()) {
                return;
            }
            try {
                saveCheckpoint(run);
            } catch (IOException e) {
                log.warn("Could not save checkpoint: {}", e.getMessage());
            }
        }
    }

    private void persistFingerprints(Run run) {
        try {
            FileSink.replaceAtomically(run.tracker.cacheFile(), run.tracker.toJson());
        } catch (IOException e) {
            warn(run, null, "Could not save fingerprint cache: " + e.getMessage());
        }
    }

    private void clearCheckpoint(Run run) {
        try {
            run.checkpoints.clear();
        } catch (IOException e) {
            warn(run, null, "Could not remove checkpoint: " + e.getMessage());
        }
    }

    private void commitToGit(Run run) {
        if (!git.isRepository(run.output)) {
            warn(run, null, "Output directory is not inside a git repository; nothing committed");
            return;
        }
        try {
            if (run.config.getGit().isCreateBranch()) {
                git.createBranch(run.output, run.config.getGit().getBranchNamePattern());
            }
            List<Path> paths;
            synchronized (run.lock) {
                paths = new ArrayList<>(run.written);
            }
            git.stageAndCommit(run.output, paths, run.config.getGit().getCommitMessage());
        } catch (GitException e) {
            warn(run, null, "Git commit failed: " + e.getMessage());
        }
    }

    // -- Terminal outcomes ----------------------------------------------------

    private ConversionResult cancelled(Run run) {
        log.warn("Conversion {} cancelled; rolling back", run.runId);
        enterPhase(run, ConversionPhase.CANCELLING, null);
        RollbackReport rollback = rollbackIfOpen(run);
        enterPhase(run, ConversionPhase.ROLLED_BACK, null);

        ConversionReport report = buildReport(run, ConversionOutcome.CANCELLED);
        metrics.recordRunResult(ConversionOutcome.CANCELLED);
        publish(run, ConversionEvent.CONVERSION_CANCELLED, null, Map.of(
                "deleted", rollback == null ? 0 : rollback.deleted().size(),
                "restored", rollback == null ? 0 : rollback.restored().size()));
        String message = "Conversion cancelled" + (rollback == null ? "" : "; " + describe(rollback));
        return new ConversionResult(ConversionOutcome.CANCELLED, message, report, run.output, rollback);
    }

    private ConversionResult failed(Run run, Exception e) {
        log.error("Conversion {} failed: {}", run.runId, e.getMessage(), e);
        RollbackReport rollback = rollbackIfOpen(run);
        synchronized (run.lock) {
            run.errors.add(ReportMessage.error(null, describe(e)));
        }
        enterPhase(run, ConversionPhase.FAILED, null);

        ConversionReport report = buildReport(run, ConversionOutcome.FAILED);
        metrics.recordRunResult(ConversionOutcome.FAILED);
        publish(run, ConversionEvent.CONVERSION_FAILED, null, Map.of("error", describe(e)));
        String message = "Conversion failed: " + describe(e) + (rollback == null ? "" : "; " + describe(rollback));
        return new ConversionResult(ConversionOutcome.FAILED, message, report, run.output, rollback);
    }

    private ConversionResult failedBeforeStart(String runId, ConversionRequest request, String message) {
        log.error("Conversion {} not started: {}", runId, message);
        metrics.recordRunResult(ConversionOutcome.FAILED);
        eventBus.publish(ConversionEvent.of(ConversionEvent.CONVERSION_FAILED, runId, null, Map.of("error", message)));
        return new ConversionResult(ConversionOutcome.FAILED, message, null, request.outputPath(), null);
    }

    private RollbackReport rollbackIfOpen(Run run) {
        if (!run.guard.isOpen()) {
            return null;
        }
        RollbackReport rollback = run.guard.rollback();
        synchronized (run.lock) {
            run.stats.incrementRollbacksPerformed();
            rollback.failures().forEach(f -> warnLocked(run, null, "Rollback: " + f));
        }
        metrics.incrementRollbacks();
        return rollback;
    }

    private static ConversionOutcome outcomeOf(Run run) {
        synchronized (run.lock) {
            if (run.stats.getFailedForms() == 0) {
                return ConversionOutcome.SUCCESS;
            }
            boolean anySucceeded = run.forms.stream().anyMatch(f -> f.status() != FormStatus.FAILED);
            return anySucceeded ? ConversionOutcome.PARTIAL_SUCCESS : ConversionOutcome.FAILED;
        }
    }

    private ConversionReport buildReport(Run run, ConversionOutcome outcome) {
        synchronized (run.lock) {
            List<FormReport> forms = new ArrayList<>(run.forms);
            forms.sort(Comparator.comparing(FormReport::sourceFile));
            return new ConversionReport(run.source.toString(), run.output.toString(), run.startTime, Instant.now(),
                    outcome, run.stats.copy(), forms, run.warnings, run.errors);
        }
    }

    private static String summary(Run run, ConversionOutcome outcome) {
        synchronized (run.lock) {
            ConversionStatistics s = run.stats;
            StringBuilder sb = new StringBuilder();
            sb.append(run.options.dryRun() ? "Dry run: analyzed " : "Converted ")
                    .append(s.getConvertedForms()).append(" of ").append(s.getTotalForms()).append(" form(s)");
            if (s.getFailedForms() > 0) {
                sb.append(", ").append(s.getFailedForms()).append(" failed");
            }
            if (s.getUpToDateForms() > 0) {
                sb.append(", ").append(s.getUpToDateForms()).append(" up to date");
            }
            sb.append(" [").append(outcome).append(']');
            return sb.toString();
        }
    }

    private static String describe(RollbackReport rollback) {
        return "rolled back (" + rollback.deleted().size() + " removed, " + rollback.restored().size()
                + " restored" + (rollback.isClean() ? "" : ", " + rollback.failures().size() + " failure(s)") + ")";
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // -- Progress and events --------------------------------------------------

    private void enterPhase(Run run, ConversionPhase phase, String form) {
        boolean changed;
        synchronized (run.lock) {
            changed = run.phase != phase;
            run.phase = phase;
        }
        if (changed) {
            log.debug("Phase {}", phase);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("phase", phase.name());
            publish(run, ConversionEvent.PHASE_CHANGED, form, payload);
        }
        reportProgress(run, phase.name().toLowerCase(Locale.ROOT), form);
    }

    private void reportProgress(Run run, String subPhase, String form) {
        ConversionProgress progress;
        synchronized (run.lock) {
            progress = new ConversionProgress(run.phase, subPhase, run.processed, run.stats.getTotalForms(),
                    form == null ? "" : form, run.stats.copy(), run.warnings.size(), run.errors.size(),
                    Duration.between(run.startTime, Instant.now()));
        }
        run.progress.report(progress);
    }

    private void publish(Run run, String type, String form, Map<String, Object> payload) {
        eventBus.publish(ConversionEvent.of(type, run.runId, form, payload));
    }

    /** Form name for a source file before (or without) a successful parse. */
    static String formNameFor(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(DESIGNER_SUFFIX)) {
            return name.substring(0, name.length() - DESIGNER_SUFFIX.length());
        }
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
