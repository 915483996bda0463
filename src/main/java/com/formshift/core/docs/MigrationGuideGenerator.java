package com.formshift.core.docs;

import com.formshift.core.model.ConversionReport;
import com.formshift.core.model.ConversionStatistics;
import com.formshift.core.model.FormReport;
import com.formshift.core.model.FormStatus;
import com.formshift.core.model.LayoutAnalysisResult;
import com.formshift.core.model.ReportMessage;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Renders the Markdown migration guide written next to the converted project: summary
 * statistics, the layout decision taken for every converted form, and the follow-up work
 * that conversion could not do (failed forms, placeholder controls, run warnings).
 */
@Component
public class MigrationGuideGenerator {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public String generate(String projectName, ConversionReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Migration Guide: ").append(projectName).append("\n\n");
        if (report.endTime() != null) {
            sb.append("**Generated**: ").append(TIMESTAMP.format(report.endTime())).append("\n\n");
        }
        sb.append("---\n\n");

        writeSummary(sb, report.statistics());
        writeForms(sb, report.forms());
        writeLayoutDecisions(sb, report.formsWithStatus(FormStatus.CONVERTED));
        writeManualSteps(sb, report);
        writeNextSteps(sb);
        return sb.toString();
    }

    private void writeSummary(StringBuilder sb, ConversionStatistics stats) {
        sb.append("## Summary\n\n");
        sb.append("- **Forms converted**: ").append(stats.getConvertedForms())
                .append(" of ").append(stats.getTotalForms()).append('\n');
        sb.append("- **Forms failed**: ").append(stats.getFailedForms()).append('\n');
        sb.append("- **Forms up to date**: ").append(stats.getUpToDateForms()).append('\n');
        int controls = stats.getConvertedControls() + stats.getPlaceholderControls();
        sb.append("- **Controls converted**: ").append(stats.getConvertedControls())
                .append(" (").append(percent(stats.getConvertedControls(), controls)).append("%)\n");
        sb.append("- **Placeholders**: ").append(stats.getPlaceholderControls()).append('\n');
        sb.append("- **Properties mapped**: ").append(stats.getMappedProperties())
                .append('/').append(stats.getTotalProperties()).append('\n');
        sb.append("- **Events converted to commands**: ").append(stats.getConvertedToCommands())
                .append('/').append(stats.getTotalEvents()).append("\n\n");
    }

    private void writeForms(StringBuilder sb, List<FormReport> forms) {
        if (forms.isEmpty()) {
            return;
        }
        sb.append("## Forms\n\n");
        sb.append("| Form | Controls | Layout | Status |\n");
        sb.append("|------|----------|--------|--------|\n");
        for (FormReport form : forms) {
            sb.append("| ").append(form.formName())
                    .append(" | ").append(form.tally() == null ? "-" : String.valueOf(form.tally().controls()))
                    .append(" | ").append(form.layout() == null ? "-" : form.layout().kind().name())
                    .append(" | ").append(form.status().name())
                    .append(" |\n");
        }
        sb.append('\n');
    }

    private void writeLayoutDecisions(StringBuilder sb, List<FormReport> converted) {
        if (converted.isEmpty()) {
            return;
        }
        sb.append("## Layout Decisions\n\n");
        for (FormReport form : converted) {
            sb.append("### ").append(form.formName()).append("\n\n");
            writeDecision(sb, form.layout(), "");
            sb.append('\n');
        }
    }

    private void writeDecision(StringBuilder sb, LayoutAnalysisResult layout, String indent) {
        sb.append(indent).append("- **").append(layout.kind().name()).append("** (")
                .append(layout.confidence()).append("%): ").append(layout.justification()).append('\n');
        for (Map.Entry<String, LayoutAnalysisResult> child : layout.childLayouts().entrySet()) {
            sb.append(indent).append("  - `").append(child.getKey()).append("`\n");
            writeDecision(sb, child.getValue(), indent + "    ");
        }
    }

    private void writeManualSteps(StringBuilder sb, ConversionReport report) {
        List<FormReport> failed = report.formsWithStatus(FormStatus.FAILED);
        List<FormReport> withPlaceholders = report.forms().stream()
                .filter(f -> !f.placeholders().isEmpty())
                .toList();
        if (failed.isEmpty() && withPlaceholders.isEmpty() && report.warnings().isEmpty()) {
            return;
        }
        sb.append("## Manual Steps Required\n\n");
        for (FormReport form : failed) {
            sb.append("- [ ] Convert **").append(form.formName()).append("** by hand: ")
                    .append(form.failureReason()).append('\n');
        }
        for (FormReport form : withPlaceholders) {
            for (String placeholder : form.placeholders()) {
                sb.append("- [ ] Replace placeholder `").append(placeholder).append("` in **")
                        .append(form.formName()).append("**\n");
            }
        }
        for (ReportMessage warning : report.warnings()) {
            sb.append("- [ ] Review: ").append(warning).append('\n');
        }
        sb.append('\n');
    }

    private void writeNextSteps(StringBuilder sb) {
        sb.append("## Next Steps\n\n");
        sb.append("1. Build the generated project with `dotnet build` and fix compile errors.\n");
        sb.append("2. Move event handler logic into the generated view-model commands.\n");
        sb.append("3. Check forms laid out on a Canvas and replace them with panels where possible.\n");
    }

    static int percent(int part, int total) {
        return total == 0 ? 0 : part * 100 / total;
    }
}
