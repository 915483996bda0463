package com.formshift.core.generator;

import com.formshift.core.generator.ControlMappings.ControlMapping;
import com.formshift.core.generator.PropertyMappings.PropertyMapping;
import com.formshift.core.layout.ControlGeometry;
import com.formshift.core.layout.ControlGeometry.Point;
import com.formshift.core.model.ControlNode;
import com.formshift.core.model.DataBinding;
import com.formshift.core.model.LayoutAnalysisResult;
import com.formshift.core.model.LayoutKind;
import com.formshift.core.model.PropertyValue;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Emits the Avalonia view markup ({@code Views/<View>.axaml}) for a form.
 * <p>
 * Each container becomes the panel its layout result names: {@code Canvas} with
 * {@code Canvas.Left/Top}, {@code Grid} with row and column definitions and
 * {@code Grid.Row/Column}, {@code StackPanel} with an orientation, or {@code DockPanel}
 * with {@code DockPanel.Dock}. Unmapped controls become placeholder comments and unmapped
 * properties are skipped.
 */
@Component
@Order(1)
public class MarkupEmitter implements ArtifactEmitter {

    private static final String INDENT = "    ";
    private static final Set<String> DOCK_EDGES = Set.of("Top", "Bottom", "Left", "Right");

    @Override
    public List<GeneratedArtifact> emit(ControlNode root, LayoutAnalysisResult layout, NamingContext naming) {
        return List.of(GeneratedArtifact.of("Views/" + naming.viewName() + ".axaml", render(root, layout, naming)));
    }

    String render(ControlNode root, LayoutAnalysisResult layout, NamingContext naming) {
        String rootElement = rootElement(root);
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("xmlns", "https://github.com/avaloniaui");
        attrs.put("xmlns:x", "http://schemas.microsoft.com/winfx/2006/xaml");
        attrs.put("xmlns:vm", "using:" + naming.viewModelNamespace());
        attrs.put("x:Class", naming.viewNamespace() + "." + naming.viewName());
        attrs.put("x:DataType", "vm:" + naming.viewModelName());
        ControlGeometry.pair(root, "ClientSize").or(() -> ControlGeometry.pair(root, "Size")).ifPresent(size -> {
            attrs.put("Width", String.valueOf(size.x()));
            attrs.put("Height", String.valueOf(size.y()));
        });
        addProperties(attrs, root);

        StringBuilder sb = new StringBuilder();
        sb.append("<").append(rootElement);
        boolean first = true;
        for (Map.Entry<String, String> a : attrs.entrySet()) {
            sb.append(first ? " " : "\n" + " ".repeat(rootElement.length() + 2));
            sb.append(a.getKey()).append("=\"").append(escape(a.getValue())).append('"');
            first = false;
        }
        sb.append(">\n\n");
        sb.append(INDENT).append("<Design.DataContext>\n");
        sb.append(INDENT).append(INDENT).append("<vm:").append(naming.viewModelName()).append("/>\n");
        sb.append(INDENT).append("</Design.DataContext>\n\n");
        writeContainer(sb, root, layout, INDENT);
        sb.append("</").append(rootElement).append(">\n");
        return sb.toString();
    }

    private void writeContainer(StringBuilder sb, ControlNode container, LayoutAnalysisResult layout, String indent) {
        sb.append(indent).append("<!-- ").append(escapeComment(describe(layout))).append(" -->\n");
        String panel = panelElement(layout);
        sb.append(indent).append(panelOpenTag(panel, layout)).append("\n");
        for (ControlNode child : orderedChildren(container, layout)) {
            if (!ControlGeometry.isLayoutEligible(child)) {
                sb.append(indent).append(INDENT).append("<!-- Non-visual component: ")
                        .append(escapeComment(child.kind() + " " + child.name())).append(" -->\n");
                continue;
            }
            writeControl(sb, child, layout, indent + INDENT);
        }
        sb.append(indent).append("</").append(panel).append(">\n");
    }

    private void writeControl(StringBuilder sb, ControlNode control, LayoutAnalysisResult parentLayout, String indent) {
        Optional<ControlMapping> mapping = ControlMappings.lookup(control.kind());
        if (mapping.isEmpty()) {
            sb.append(indent).append("<!-- Unmapped control: ")
                    .append(escapeComment(control.kind() + " (" + control.name() + ")")).append(" -->\n");
            return;
        }
        String element = mapping.get().targetType();

        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("Name", control.name());
        addPlacement(attrs, control, parentLayout);
        if (parentLayout.kind() != LayoutKind.EDGE_DOCKED) {
            ControlGeometry.pair(control, "Size").ifPresent(size -> {
                attrs.put("Width", String.valueOf(size.x()));
                attrs.put("Height", String.valueOf(size.y()));
            });
        }
        addProperties(attrs, control);
        addBindings(attrs, control);
        addEvents(attrs, control);

        sb.append(indent).append("<").append(element);
        attrs.forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(escape(v)).append('"'));

        boolean hasVisualChildren = control.children().stream().anyMatch(ControlGeometry::isLayoutEligible);
        if (!hasVisualChildren) {
            sb.append(" />\n");
            return;
        }
        sb.append(">\n");
        LayoutAnalysisResult childLayout = parentLayout.childLayout(control.name())
                .orElseGet(() -> LayoutAnalysisResult.freePositioned("Not analyzed; positions kept"));
        writeContainer(sb, control, childLayout, indent + INDENT);
        sb.append(indent).append("</").append(element).append(">\n");
    }

    private static void addPlacement(Map<String, String> attrs, ControlNode control, LayoutAnalysisResult layout) {
        Optional<Point> location = ControlGeometry.location(control);
        switch (layout.kind()) {
            case FREE_POSITIONED -> location.ifPresent(p -> {
                attrs.put("Canvas.Left", String.valueOf(p.x()));
                attrs.put("Canvas.Top", String.valueOf(p.y()));
            });
            case GRID -> {
                Point p = location.orElse(new Point(0, 0));
                attrs.put("Grid.Row", String.valueOf(ControlGeometry.nearestLine(p.y(), lines(layout, "rowLines"))));
                attrs.put("Grid.Column", String.valueOf(ControlGeometry.nearestLine(p.x(), lines(layout, "columnLines"))));
            }
            case EDGE_DOCKED -> ControlGeometry.dockEdge(control)
                    .filter(DOCK_EDGES::contains)
                    .ifPresent(edge -> attrs.put("DockPanel.Dock", edge));
            case LINEAR_STACK -> {
            }
        }
    }

    private static void addProperties(Map<String, String> attrs, ControlNode control) {
        for (Map.Entry<String, PropertyValue> property : control.properties().entrySet()) {
            Optional<PropertyMapping> mapping = PropertyMappings.lookup(property.getKey(), control.kind());
            if (mapping.isEmpty() || !mapping.get().direct()) {
                continue;
            }
            attributeValue(property.getValue())
                    .ifPresent(v -> attrs.putIfAbsent(mapping.get().targetProperty(), v));
        }
    }

    private static void addBindings(Map<String, String> attrs, ControlNode control) {
        for (DataBinding binding : control.dataBindings()) {
            PropertyMappings.lookup(binding.propertyName(), control.kind())
                    .filter(PropertyMapping::direct)
                    .ifPresent(m -> attrs.put(m.targetProperty(), "{Binding " + binding.dataMember() + "}"));
        }
    }

    private static void addEvents(Map<String, String> attrs, ControlNode control) {
        control.events().forEach((event, handler) -> EventMappings.lookup(event).ifPresent(m -> {
            if (m.command()) {
                attrs.putIfAbsent("Command", "{Binding " + EventMappings.commandMethodName(handler) + "Command}");
            } else {
                attrs.putIfAbsent(m.targetEvent(), handler);
            }
        }));
    }

    private static List<ControlNode> orderedChildren(ControlNode container, LayoutAnalysisResult layout) {
        List<ControlNode> children = new ArrayList<>(container.children());
        if (layout.kind() == LayoutKind.LINEAR_STACK) {
            boolean vertical = "vertical".equals(layout.stringMetadata("orientation", "vertical"));
            Comparator<ControlNode> order = Comparator.comparing(
                    (ControlNode n) -> ControlGeometry.location(n).orElse(new Point(0, 0)),
                    vertical ? Comparator.comparingInt(Point::y).thenComparingInt(Point::x)
                             : Comparator.comparingInt(Point::x).thenComparingInt(Point::y));
            children.sort(order);
        } else if (layout.kind() == LayoutKind.EDGE_DOCKED) {
            // the filling child must come last for DockPanel.LastChildFill
            children.sort(Comparator.comparingInt(n -> ControlGeometry.dockEdge(n)
                    .filter(DOCK_EDGES::contains).isPresent() ? 0 : 1));
        }
        return children;
    }

    private static String panelElement(LayoutAnalysisResult layout) {
        return switch (layout.kind()) {
            case FREE_POSITIONED -> "Canvas";
            case GRID -> "Grid";
            case LINEAR_STACK -> "StackPanel";
            case EDGE_DOCKED -> "DockPanel";
        };
    }

    private static String panelOpenTag(String panel, LayoutAnalysisResult layout) {
        return switch (layout.kind()) {
            case GRID -> "<Grid RowDefinitions=\"" + definitions(layout.intMetadata("rows", 1))
                    + "\" ColumnDefinitions=\"" + definitions(layout.intMetadata("columns", 1)) + "\">";
            case LINEAR_STACK -> "<StackPanel Orientation=\""
                    + ("horizontal".equals(layout.stringMetadata("orientation", "vertical")) ? "Horizontal" : "Vertical")
                    + "\">";
            case EDGE_DOCKED -> "<DockPanel LastChildFill=\"True\">";
            case FREE_POSITIONED -> "<" + panel + ">";
        };
    }

    private static String definitions(int count) {
        return String.join(",", Collections.nCopies(Math.max(1, count), "Auto"));
    }

    @SuppressWarnings("unchecked")
    private static List<Integer> lines(LayoutAnalysisResult layout, String key) {
        Object value = layout.metadata().get(key);
        return value instanceof List<?> list ? (List<Integer>) list : List.of();
    }

    private static String describe(LayoutAnalysisResult layout) {
        return "Layout: " + panelElement(layout) + " (" + layout.confidence() + "%) " + layout.justification();
    }

    static String rootElement(ControlNode root) {
        return ControlMappings.lookup(root.kind())
                .map(ControlMapping::targetType)
                .filter(t -> t.equals("Window") || t.equals("UserControl"))
                .orElse("UserControl");
    }

    /** Attribute text for a property value, or empty when the expression has no markup form. */
    static Optional<String> attributeValue(PropertyValue value) {
        return switch (value.type()) {
            case TEXT, NUMBER -> Optional.of(value.raw());
            case BOOLEAN -> Optional.of(value.asBoolean() ? "True" : "False");
            case OPAQUE -> {
                String raw = value.raw();
                if (raw.isEmpty() || raw.contains("(") || raw.startsWith("new ") || raw.contains("resources.")) {
                    yield Optional.empty();
                }
                yield Optional.of(value.simpleName());
            }
        };
    }

    static String escape(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String escapeComment(String text) {
        return text.replace("--", "- -");
    }
}
