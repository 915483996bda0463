package com.formshift.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.formshift.core.layout.LayoutAnalysisContext;
import com.formshift.core.layout.LayoutMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converter settings. Spring binds the {@code formshift.*} keys from {@code application.yml};
 * a project's {@code .formshiftconfig} JSON file is overlaid on top by
 * {@link ConfigurationLoader}.
 */
@Component
@ConfigurationProperties(prefix = "formshift")
public class ConverterConfig {

    private Layout layout = new Layout();
    private Incremental incremental = new Incremental();
    private Parallel parallel = new Parallel();
    private Naming naming = new Naming();
    private Documentation documentation = new Documentation();
    private Git git = new Git();
    private Progress progress = new Progress();
    private List<String> excludePatterns = new ArrayList<>();

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }
    public Incremental getIncremental() { return incremental; }
    public void setIncremental(Incremental incremental) { this.incremental = incremental; }
    public Parallel getParallel() { return parallel; }
    public void setParallel(Parallel parallel) { this.parallel = parallel; }
    public Naming getNaming() { return naming; }
    public void setNaming(Naming naming) { this.naming = naming; }
    public Documentation getDocumentation() { return documentation; }
    public void setDocumentation(Documentation documentation) { this.documentation = documentation; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Progress getProgress() { return progress; }
    public void setProgress(Progress progress) { this.progress = progress; }
    public List<String> getExcludePatterns() { return excludePatterns; }
    public void setExcludePatterns(List<String> excludePatterns) { this.excludePatterns = excludePatterns; }

    /**
     * Layout context for the configured tolerance, threshold and mode.
     *
     * @throws IllegalArgumentException if the configured mode or bounds are invalid
     */
    @JsonIgnore
    public LayoutAnalysisContext layoutContext() {
        return new LayoutAnalysisContext(layout.getAlignmentTolerance(), layout.getConfidenceThreshold(),
                LayoutMode.fromString(layout.getMode()));
    }

    public static class Layout {
        private int alignmentTolerance = LayoutAnalysisContext.DEFAULT_TOLERANCE;
        private int confidenceThreshold = LayoutAnalysisContext.DEFAULT_THRESHOLD;
        /** {@code auto} or {@code canvas}. */
        private String mode = "auto";

        public int getAlignmentTolerance() { return alignmentTolerance; }
        public void setAlignmentTolerance(int alignmentTolerance) { this.alignmentTolerance = alignmentTolerance; }
        public int getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(int confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
    }

    public static class Incremental {
        private boolean enabled = true;
        /** Completed forms between checkpoint saves. */
        private int checkpointFrequency = 10;
        private String cacheFileName = ".formshift-cache.json";
        private String checkpointFileName = ".formshift-checkpoint.json";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getCheckpointFrequency() { return checkpointFrequency; }
        public void setCheckpointFrequency(int checkpointFrequency) { this.checkpointFrequency = checkpointFrequency; }
        public String getCacheFileName() { return cacheFileName; }
        public void setCacheFileName(String cacheFileName) { this.cacheFileName = cacheFileName; }
        public String getCheckpointFileName() { return checkpointFileName; }
        public void setCheckpointFileName(String checkpointFileName) { this.checkpointFileName = checkpointFileName; }
    }

    public static class Parallel {
        private boolean enabled = true;
        /** 0 means one worker per available processor. */
        private int maxDegreeOfParallelism = 0;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxDegreeOfParallelism() { return maxDegreeOfParallelism; }
        public void setMaxDegreeOfParallelism(int maxDegreeOfParallelism) { this.maxDegreeOfParallelism = maxDegreeOfParallelism; }
    }

    public static class Naming {
        private String namespace = "ConvertedApp";
        private String viewSuffix = "";
        private String viewModelSuffix = "ViewModel";
        private String sourcePattern = "*.Designer.cs";

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }
        public String getViewSuffix() { return viewSuffix; }
        public void setViewSuffix(String viewSuffix) { this.viewSuffix = viewSuffix; }
        public String getViewModelSuffix() { return viewModelSuffix; }
        public void setViewModelSuffix(String viewModelSuffix) { this.viewModelSuffix = viewModelSuffix; }
        public String getSourcePattern() { return sourcePattern; }
        public void setSourcePattern(String sourcePattern) { this.sourcePattern = sourcePattern; }
    }

    public static class Documentation {
        private boolean enabled = true;
        private String outputFileName = "MIGRATION_GUIDE.md";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getOutputFileName() { return outputFileName; }
        public void setOutputFileName(String outputFileName) { this.outputFileName = outputFileName; }
    }

    public static class Git {
        private boolean enabled = false;
        private boolean createBranch = false;
        private String branchNamePattern = "feature/migration-{timestamp}";
        private String commitMessage = "Convert WinForms forms to Avalonia";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isCreateBranch() { return createBranch; }
        public void setCreateBranch(boolean createBranch) { this.createBranch = createBranch; }
        public String getBranchNamePattern() { return branchNamePattern; }
        public void setBranchNamePattern(String branchNamePattern) { this.branchNamePattern = branchNamePattern; }
        public String getCommitMessage() { return commitMessage; }
        public void setCommitMessage(String commitMessage) { this.commitMessage = commitMessage; }
    }

    public static class Progress {
        private long throttleMillis = 100;

        public long getThrottleMillis() { return throttleMillis; }
        public void setThrottleMillis(long throttleMillis) { this.throttleMillis = throttleMillis; }
    }
}
