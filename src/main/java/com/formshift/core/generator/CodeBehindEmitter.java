package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.LayoutAnalysisResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits the view code-behind ({@code Views/<View>.axaml.cs}). Events that stay events in the
 * markup get an empty handler stub so the view compiles; command events live on the view model.
 */
@Component
@Order(2)
public class CodeBehindEmitter implements ArtifactEmitter {

    @Override
    public List<GeneratedArtifact> emit(ControlNode root, LayoutAnalysisResult layout, NamingContext naming) {
        StringBuilder sb = new StringBuilder();
        sb.append("using Avalonia.Controls;\n");
        sb.append("using Avalonia.Interactivity;\n\n");
        sb.append("namespace ").append(naming.viewNamespace()).append(";\n\n");
        sb.append("public partial class ").append(naming.viewName())
                .append(" : ").append(MarkupEmitter.rootElement(root)).append("\n{\n");
        sb.append("    public ").append(naming.viewName()).append("()\n    {\n");
        sb.append("        InitializeComponent();\n    }\n");

        for (Map.Entry<String, String> handler : handlerStubs(root).entrySet()) {
            sb.append("\n    // ").append(handler.getValue()).append("\n");
            sb.append("    private void ").append(handler.getKey()).append("(object? sender, RoutedEventArgs e)\n");
            sb.append("    {\n    }\n");
        }
        sb.append("}\n");
        return List.of(GeneratedArtifact.of("Views/" + naming.viewName() + ".axaml.cs", sb.toString()));
    }

    /** Handler name to a short origin note, first subscription wins. */
    static Map<String, String> handlerStubs(ControlNode root) {
        Map<String, String> stubs = new LinkedHashMap<>();
        for (ControlNode node : root.depthFirst()) {
            if (!ControlMappings.isMapped(node.kind())) {
                continue;
            }
            node.events().forEach((event, handler) -> EventMappings.lookup(event)
                    .filter(m -> !m.command())
                    .ifPresent(m -> stubs.putIfAbsent(handler,
                            node.name() + "." + event + " -> " + m.targetEvent())));
        }
        return stubs;
    }
}
