package com.formshift.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.model.ConversionReport;
import com.formshift.core.model.ConversionStatistics;
import com.formshift.core.model.FormReport;
import com.formshift.core.model.ReportMessage;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a {@link ConversionReport} as Markdown, JSON or CSV.
 */
@Service
public class ReportBuilder {

    private final ObjectMapper objectMapper;

    public ReportBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String render(ConversionReport report, ReportFormat format) {
        return switch (format) {
            case MARKDOWN -> markdown(report);
            case JSON -> json(report);
            case CSV -> csv(report);
        };
    }

    String markdown(ConversionReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Conversion Report\n\n");
        sb.append("**Source**: `").append(report.sourcePath()).append("`\n");
        sb.append("**Output**: `").append(report.outputPath()).append("`\n");
        if (report.startTime() != null) {
            sb.append("**Started**: ").append(DateTimeFormatter.ISO_INSTANT.format(report.startTime())).append('\n');
        }
        sb.append("**Duration**: ")
                .append(String.format(Locale.ROOT, "%.2fs", report.elapsed().toMillis() / 1000.0)).append('\n');
        sb.append("**Outcome**: ").append(report.outcome()).append("\n\n");

        ConversionStatistics stats = report.statistics();
        sb.append("## Statistics\n\n");
        sb.append("- Forms: ").append(stats.getConvertedForms()).append(" converted, ")
                .append(stats.getFailedForms()).append(" failed, ")
                .append(stats.getUpToDateForms()).append(" up to date, ")
                .append(stats.getTotalForms()).append(" total\n");
        sb.append("- Controls converted: ").append(stats.getConvertedControls()).append('\n');
        sb.append("- Placeholders: ").append(stats.getPlaceholderControls()).append('\n');
        sb.append("- Properties mapped: ").append(stats.getMappedProperties())
                .append('/').append(stats.getTotalProperties()).append('\n');
        sb.append("- Commands created: ").append(stats.getConvertedToCommands()).append('\n');
        sb.append("- Files generated: ").append(stats.getFilesGenerated()).append("\n\n");

        if (!report.forms().isEmpty()) {
            sb.append("## Forms\n\n");
            sb.append("| Form | Controls | Layout | Confidence | Status |\n");
            sb.append("|------|----------|--------|------------|--------|\n");
            for (FormReport form : report.forms()) {
                sb.append("| ").append(form.formName())
                        .append(" | ").append(controls(form))
                        .append(" | ").append(layout(form))
                        .append(" | ").append(form.layout() == null ? "-" : form.layout().confidence() + "%")
                        .append(" | ").append(form.status())
                        .append(" |\n");
            }
            sb.append('\n');
        }
        appendMessages(sb, "Warnings", report.warnings());
        appendMessages(sb, "Errors", report.errors());
        return sb.toString();
    }

    private static void appendMessages(StringBuilder sb, String title, List<ReportMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        sb.append("## ").append(title).append("\n\n");
        for (ReportMessage m : messages) {
            sb.append("- ");
            if (m.form() != null) {
                sb.append("**").append(m.form()).append("**: ");
            }
            sb.append(m.message()).append('\n');
        }
        sb.append('\n');
    }

    String json(ConversionReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize conversion report", e);
        }
    }

    String csv(ConversionReport report) {
        StringBuilder sb = new StringBuilder("Form,Controls,Layout,Confidence,Status,Warnings,Errors\n");
        for (FormReport form : report.forms()) {
            long warnings = report.warnings().stream().filter(m -> Objects.equals(m.form(), form.formName())).count();
            long errors = report.errors().stream().filter(m -> Objects.equals(m.form(), form.formName())).count();
            sb.append(quote(form.formName())).append(',')
                    .append(controls(form)).append(',')
                    .append(quote(layout(form))).append(',')
                    .append(form.layout() == null ? "" : String.valueOf(form.layout().confidence())).append(',')
                    .append(quote(form.status().name())).append(',')
                    .append(warnings).append(',')
                    .append(errors).append('\n');
        }
        return sb.toString();
    }

    private static String controls(FormReport form) {
        return form.tally() == null ? "" : String.valueOf(form.tally().controls());
    }

    private static String layout(FormReport form) {
        return form.layout() == null ? "" : form.layout().kind().name();
    }

    static String quote(String value) {
        return "\"" + (value == null ? "" : value.replace("\"", "\"\"")) + "\"";
    }
}
