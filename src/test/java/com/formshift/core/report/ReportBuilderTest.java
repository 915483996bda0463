package com.formshift.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formshift.core.config.JsonSupport;
import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.ConversionReport;
import com.formshift.core.model.ConversionStatistics;
import com.formshift.core.model.FormReport;
import com.formshift.core.model.FormStatus;
import com.formshift.core.model.FormTally;
import com.formshift.core.model.LayoutAnalysisResult;
import com.formshift.core.model.LayoutKind;
import com.formshift.core.model.ReportMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportBuilderTest {

    private final ObjectMapper objectMapper = JsonSupport.objectMapper();
    private final ReportBuilder builder = new ReportBuilder(objectMapper);

    static ConversionReport sampleReport() {
        var stats = new ConversionStatistics();
        stats.setTotalForms(3);
        var tally = new FormTally(4, 1, 6, 5, 2, 1);
        stats.addForm(tally);
        stats.incrementFailedForms();
        stats.incrementUpToDateForms();
        stats.addFilesGenerated(4);

        var layout = new LayoutAnalysisResult(LayoutKind.LINEAR_STACK, 95, Map.of("orientation", "vertical"),
                "Children stack vertically");
        var forms = List.of(
                FormReport.converted("MainForm", "/src/MainForm.Designer.cs", layout,
                        List.of("Views/MainForm.axaml"), tally, List.of("FancyGauge gauge")),
                FormReport.failed("Broken, \"old\"", "/src/Broken.Designer.cs", "InitializeComponent method not found"),
                FormReport.skipped("About", "/src/About.Designer.cs", FormStatus.UP_TO_DATE));
        Instant start = Instant.parse("2026-01-05T10:00:00Z");
        return new ConversionReport("/src", "/out", start, start.plusMillis(1500), ConversionOutcome.PARTIAL_SUCCESS,
                stats, forms,
                List.of(ReportMessage.warning("MainForm", "Unmapped control FancyGauge")),
                List.of(ReportMessage.error("Broken, \"old\"", "InitializeComponent method not found")));
    }

    // -- Markdown -------------------------------------------------------------

    @Nested
    @DisplayName("markdown")
    class MarkdownTests {

        @Test
        @DisplayName("has the header, statistics and a row per form")
        void content() {
            String md = builder.render(sampleReport(), ReportFormat.MARKDOWN);
            assertTrue(md.startsWith("# Conversion Report\n"));
            assertTrue(md.contains("**Source**: `/src`"));
            assertTrue(md.contains("**Duration**: 1.50s"));
            assertTrue(md.contains("**Outcome**: PARTIAL_SUCCESS"));
            assertTrue(md.contains("- Forms: 1 converted, 1 failed, 1 up to date, 3 total"));
            assertTrue(md.contains("- Properties mapped: 5/6"));
            assertTrue(md.contains("| MainForm | 4 | LINEAR_STACK | 95% | CONVERTED |"));
            assertTrue(md.contains("| About |  | "));
        }

        @Test
        @DisplayName("lists warnings and errors scoped to their form")
        void messages() {
            String md = builder.render(sampleReport(), ReportFormat.MARKDOWN);
            assertTrue(md.contains("## Warnings\n\n- **MainForm**: Unmapped control FancyGauge"));
            assertTrue(md.contains("## Errors"));
        }
    }

    // -- JSON and CSV ---------------------------------------------------------

    @Test
    @DisplayName("json carries the report fields")
    void json() throws Exception {
        JsonNode root = objectMapper.readTree(builder.render(sampleReport(), ReportFormat.JSON));
        assertEquals("PARTIAL_SUCCESS", root.get("outcome").asText());
        assertEquals("/out", root.get("outputPath").asText());
        assertEquals(3, root.get("forms").size());
        assertEquals("LINEAR_STACK", root.get("forms").get(0).get("layout").get("kind").asText());
        assertEquals(1, root.get("statistics").get("convertedForms").asInt());
        assertEquals("2026-01-05T10:00:00Z", root.get("startTime").asText());
    }

    @Test
    @DisplayName("csv quotes text fields and counts messages per form")
    void csv() {
        List<String> lines = builder.render(sampleReport(), ReportFormat.CSV).lines().toList();
        assertEquals("Form,Controls,Layout,Confidence,Status,Warnings,Errors", lines.get(0));
        assertEquals("\"MainForm\",4,\"LINEAR_STACK\",95,\"CONVERTED\",1,0", lines.get(1));
        assertEquals("\"Broken, \"\"old\"\"\",,\"\",,\"FAILED\",0,1", lines.get(2));
        assertEquals(4, lines.size());
    }
}
