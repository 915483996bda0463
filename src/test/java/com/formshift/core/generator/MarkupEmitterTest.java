package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.DataBinding;
import com.formshift.core.model.LayoutAnalysisResult;
import com.formshift.core.model.LayoutKind;
import com.formshift.core.model.PropertyValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkupEmitterTest {

    private final MarkupEmitter emitter = new MarkupEmitter();
    private final NamingContext naming = new NamingContext("Shop", "CustomerForm", "CustomerForm", "CustomerFormViewModel");

    private ControlNode form;

    @BeforeEach
    void setUp() {
        form = new ControlNode("Form", "CustomerForm");
        form.setProperty("Text", PropertyValue.text("Customer"));
        form.setProperty("ClientSize", PropertyValue.opaque("new System.Drawing.Size(300, 120)"));
    }

    private static ControlNode control(String kind, String name, int x, int y) {
        var node = new ControlNode(kind, name);
        node.setProperty("Location", PropertyValue.opaque("new System.Drawing.Point(" + x + ", " + y + ")"));
        return node;
    }

    private static ControlNode docked(String kind, String name, String edge) {
        var node = new ControlNode(kind, name);
        node.setProperty("Dock", PropertyValue.opaque("System.Windows.Forms.DockStyle." + edge));
        return node;
    }

    @Test
    @DisplayName("emits one axaml file under Views")
    void artifactPath() {
        var artifacts = emitter.emit(form, LayoutAnalysisResult.freePositioned("test"), naming);
        assertEquals(1, artifacts.size());
        assertEquals("Views/CustomerForm.axaml", artifacts.get(0).relativePath());
        assertTrue(artifacts.get(0).overwrite());
    }

    // -- Root element ---------------------------------------------------------

    @Nested
    @DisplayName("root element")
    class RootElementTests {

        @Test
        @DisplayName("a form becomes a Window with class, data type and size")
        void window() {
            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("test"), naming);
            assertTrue(xml.startsWith("<Window xmlns=\"https://github.com/avaloniaui\""));
            assertTrue(xml.contains("x:Class=\"Shop.Views.CustomerForm\""));
            assertTrue(xml.contains("x:DataType=\"vm:CustomerFormViewModel\""));
            assertTrue(xml.contains("xmlns:vm=\"using:Shop.ViewModels\""));
            assertTrue(xml.contains("Width=\"300\""));
            assertTrue(xml.contains("Height=\"120\""));
            assertTrue(xml.contains("Title=\"Customer\""));
            assertTrue(xml.contains("<vm:CustomerFormViewModel/>"));
            assertTrue(xml.endsWith("</Window>\n"));
        }

        @Test
        @DisplayName("user controls and unknown roots become UserControl")
        void userControl() {
            assertEquals("UserControl", MarkupEmitter.rootElement(new ControlNode("UserControl", "Toolbar")));
            assertEquals("UserControl", MarkupEmitter.rootElement(new ControlNode("FancyForm", "Odd")));
            assertEquals("Window", MarkupEmitter.rootElement(form));
        }
    }

    // -- Controls -------------------------------------------------------------

    @Nested
    @DisplayName("controls")
    class ControlTests {

        @Test
        @DisplayName("a positioned button keeps its coordinates on a Canvas")
        void canvasPlacement() {
            var ok = control("Button", "ok", 10, 20);
            ok.setProperty("Size", PropertyValue.opaque("new System.Drawing.Size(75, 23)"));
            ok.setProperty("Text", PropertyValue.text("OK"));
            ok.addEvent("Click", "ok_Click");
            form.addChild(ok);

            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("Kept absolute positions"), naming);

            assertTrue(xml.contains("<Canvas>"));
            assertTrue(xml.contains("<Button Name=\"ok\" Canvas.Left=\"10\" Canvas.Top=\"20\" Width=\"75\" Height=\"23\""
                    + " Content=\"OK\" Command=\"{Binding OkClickCommand}\" />"), xml);
            assertTrue(xml.contains("<!-- Layout: Canvas (100%) Kept absolute positions -->"));
        }

        @Test
        @DisplayName("unmapped controls become placeholder comments")
        void unmapped() {
            form.addChild(control("FancyGauge", "gauge", 0, 0));
            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("test"), naming);
            assertTrue(xml.contains("<!-- Unmapped control: FancyGauge (gauge) -->"));
            assertFalse(xml.contains("<FancyGauge"));
        }

        @Test
        @DisplayName("non-visual components are listed, not placed")
        void components() {
            form.addChild(new ControlNode("Timer", "refresh"));
            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("test"), naming);
            assertTrue(xml.contains("<!-- Non-visual component: Timer refresh -->"));
            assertFalse(xml.contains("<DispatcherTimer"));
        }

        @Test
        @DisplayName("attribute values are escaped")
        void escaping() {
            var label = control("Label", "caption", 0, 0);
            label.setProperty("Text", PropertyValue.text("a < b & \"c\""));
            form.addChild(label);
            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("test"), naming);
            assertTrue(xml.contains("<TextBlock Name=\"caption\""));
            assertTrue(xml.contains("Text=\"a &lt; b &amp; &quot;c&quot;\""));
        }

        @Test
        @DisplayName("data bindings become binding expressions")
        void bindings() {
            var name = control("TextBox", "nameBox", 0, 0);
            name.addDataBinding(new DataBinding("Text", "customerSource", "Name", null, false));
            form.addChild(name);
            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("test"), naming);
            assertTrue(xml.contains("Text=\"{Binding Name}\""));
        }

        @Test
        @DisplayName("non-command events keep a handler attribute")
        void handlerEvents() {
            var name = control("TextBox", "nameBox", 0, 0);
            name.addEvent("TextChanged", "nameBox_TextChanged");
            form.addChild(name);
            String xml = emitter.render(form, LayoutAnalysisResult.freePositioned("test"), naming);
            assertTrue(xml.contains("TextChanged=\"nameBox_TextChanged\""));
        }

        @Test
        @DisplayName("nested containers use their own layout result")
        void nestedContainer() {
            var panel = control("Panel", "details", 0, 0);
            panel.addChild(control("Button", "inner", 5, 5));
            form.addChild(panel);
            var nested = new LayoutAnalysisResult(LayoutKind.LINEAR_STACK, 90,
                    Map.of("orientation", "vertical"), "stacked");
            var layout = LayoutAnalysisResult.freePositioned("root").withChildLayouts(Map.of("details", nested));

            String xml = emitter.render(form, layout, naming);
            assertTrue(xml.contains("<Panel Name=\"details\""));
            assertTrue(xml.contains("<StackPanel Orientation=\"Vertical\">"));
            assertTrue(xml.contains("<Button Name=\"inner\" />"));
            assertTrue(xml.contains("</Panel>"));
        }
    }

    // -- Panels ---------------------------------------------------------------

    @Nested
    @DisplayName("panels")
    class PanelTests {

        @Test
        @DisplayName("grid layout assigns rows and columns from the clustered lines")
        void grid() {
            form.addChild(control("Label", "a", 10, 10));
            form.addChild(control("TextBox", "b", 100, 40));
            var layout = new LayoutAnalysisResult(LayoutKind.GRID, 100,
                    Map.of("rows", 2, "columns", 2, "rowLines", List.of(10, 40), "columnLines", List.of(10, 100)),
                    "aligned");

            String xml = emitter.render(form, layout, naming);
            assertTrue(xml.contains("<Grid RowDefinitions=\"Auto,Auto\" ColumnDefinitions=\"Auto,Auto\">"));
            assertTrue(xml.contains("<TextBlock Name=\"a\" Grid.Row=\"0\" Grid.Column=\"0\""));
            assertTrue(xml.contains("<TextBox Name=\"b\" Grid.Row=\"1\" Grid.Column=\"1\""));
        }

        @Test
        @DisplayName("horizontal stacks order children left to right")
        void horizontalStack() {
            form.addChild(control("Button", "right", 200, 10));
            form.addChild(control("Button", "left", 10, 10));
            var layout = new LayoutAnalysisResult(LayoutKind.LINEAR_STACK, 95,
                    Map.of("orientation", "horizontal"), "row");

            String xml = emitter.render(form, layout, naming);
            assertTrue(xml.contains("<StackPanel Orientation=\"Horizontal\">"));
            assertTrue(xml.indexOf("Name=\"left\"") < xml.indexOf("Name=\"right\""));
            assertFalse(xml.contains("Canvas.Left"));
        }

        @Test
        @DisplayName("docked layout puts the filling child last")
        void docked() {
            form.addChild(MarkupEmitterTest.docked("Panel", "body", "Fill"));
            form.addChild(MarkupEmitterTest.docked("MenuStrip", "menu", "Top"));
            var layout = new LayoutAnalysisResult(LayoutKind.EDGE_DOCKED, 100, Map.of(), "docked");

            String xml = emitter.render(form, layout, naming);
            assertTrue(xml.contains("<DockPanel LastChildFill=\"True\">"));
            assertTrue(xml.contains("<Menu Name=\"menu\" DockPanel.Dock=\"Top\" />"));
            assertTrue(xml.contains("<Panel Name=\"body\" />"));
            assertTrue(xml.indexOf("Name=\"menu\"") < xml.indexOf("Name=\"body\""));
        }
    }

    // -- Attribute values -----------------------------------------------------

    @Test
    @DisplayName("opaque expressions with no markup form are dropped")
    void attributeValues() {
        assertEquals("True", MarkupEmitter.attributeValue(PropertyValue.bool(true)).orElseThrow());
        assertEquals("12", MarkupEmitter.attributeValue(PropertyValue.infer("12")).orElseThrow());
        assertEquals("Red", MarkupEmitter.attributeValue(PropertyValue.opaque("System.Drawing.Color.Red")).orElseThrow());
        assertTrue(MarkupEmitter.attributeValue(PropertyValue.opaque("new System.Drawing.Font(\"Arial\", 9F)")).isEmpty());
        assertTrue(MarkupEmitter.attributeValue(PropertyValue.opaque("resources.GetObject(\"icon\")")).isEmpty());
    }
}
