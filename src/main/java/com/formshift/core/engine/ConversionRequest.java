package com.formshift.core.engine;

import com.formshift.core.config.ConverterConfig;
import com.formshift.core.model.ConversionOptions;
import com.formshift.core.report.ReportFormat;

import java.nio.file.Path;

/**
 * Inputs of one conversion run.
 *
 * @param sourcePath   root of the WinForms source tree
 * @param outputPath   directory receiving the generated project
 * @param config       effective configuration
 * @param options      behaviour flags for this run
 * @param reportPath   where to write the run report, {@code null} for none
 * @param reportFormat report format, {@code null} to infer it from the report file name
 */
public record ConversionRequest(
    Path sourcePath,
    Path outputPath,
    ConverterConfig config,
    ConversionOptions options,
    Path reportPath,
    ReportFormat reportFormat
) {

    public ConversionRequest {
        config = config == null ? new ConverterConfig() : config;
        options = options == null ? ConversionOptions.defaults() : options;
    }

    public ConversionRequest(Path sourcePath, Path outputPath, ConverterConfig config, ConversionOptions options) {
        this(sourcePath, outputPath, config, options, null, null);
    }

    public ReportFormat effectiveReportFormat() {
        if (reportFormat != null) {
            return reportFormat;
        }
        return reportPath == null ? ReportFormat.MARKDOWN : ReportFormat.forFileName(reportPath.getFileName().toString());
    }
}
