package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.LayoutAnalysisResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeBehindEmitterTest {

    private final CodeBehindEmitter emitter = new CodeBehindEmitter();

    @Test
    @DisplayName("stubs non-command handlers and skips commands")
    void handlerStubs() {
        var form = new ControlNode("Form", "MainForm");
        form.addEvent("Load", "MainForm_Load");
        var button = new ControlNode("Button", "go");
        button.addEvent("Click", "go_Click");
        button.addEvent("MouseEnter", "go_MouseEnter");
        var gauge = new ControlNode("FancyGauge", "gauge");
        gauge.addEvent("KeyDown", "gauge_KeyDown");
        form.addChild(button).addChild(gauge);

        var stubs = CodeBehindEmitter.handlerStubs(form);
        assertEquals(2, stubs.size());
        assertEquals("MainForm.Load -> Loaded", stubs.get("MainForm_Load"));
        assertEquals("go.MouseEnter -> PointerEntered", stubs.get("go_MouseEnter"));

        var naming = new NamingContext("App", "MainForm", "MainForm", "MainFormViewModel");
        var artifact = emitter.emit(form, LayoutAnalysisResult.freePositioned("test"), naming).get(0);
        assertEquals("Views/MainForm.axaml.cs", artifact.relativePath());
        assertTrue(artifact.content().contains("public partial class MainForm : Window"));
        assertTrue(artifact.content().contains("private void MainForm_Load(object? sender, RoutedEventArgs e)"));
        assertFalse(artifact.content().contains("go_Click"));
    }
}
