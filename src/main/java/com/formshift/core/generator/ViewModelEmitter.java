package com.formshift.core.generator;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.DataBinding;
import com.formshift.core.model.LayoutAnalysisResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits the view model as a CommunityToolkit.Mvvm partial class pair.
 * <p>
 * {@code ViewModels/<VM>.g.cs} is regenerated every run and holds one
 * {@code [ObservableProperty]} per bound data member and one {@code [RelayCommand]} per
 * command event. {@code ViewModels/<VM>.cs} is user-owned and only written when absent.
 */
@Component
@Order(3)
public class ViewModelEmitter implements ArtifactEmitter {

    record BoundProperty(String member, String type, String defaultValue) {}

    record Command(String methodName, String origin) {}

    @Override
    public List<GeneratedArtifact> emit(ControlNode root, LayoutAnalysisResult layout, NamingContext naming) {
        return List.of(
                GeneratedArtifact.of("ViewModels/" + naming.viewModelName() + ".g.cs", generated(root, naming)),
                GeneratedArtifact.userOwned("ViewModels/" + naming.viewModelName() + ".cs", userPart(naming)));
    }

    String generated(ControlNode root, NamingContext naming) {
        StringBuilder sb = new StringBuilder();
        sb.append("using CommunityToolkit.Mvvm.ComponentModel;\n");
        sb.append("using CommunityToolkit.Mvvm.Input;\n");
        sb.append("using System.Collections.ObjectModel;\n\n");
        sb.append("namespace ").append(naming.viewModelNamespace()).append(";\n\n");
        sb.append("/// <summary>\n/// View model for ").append(naming.formName()).append(" (generated).\n/// </summary>\n");
        sb.append("public partial class ").append(naming.viewModelName()).append(" : ObservableObject\n{\n");

        for (BoundProperty property : boundProperties(root)) {
            sb.append("    [ObservableProperty]\n");
            sb.append("    private ").append(property.type()).append(' ').append(camelCase(property.member()))
                    .append(" = ").append(property.defaultValue()).append(";\n\n");
        }
        for (Command command : commands(root)) {
            sb.append("    [RelayCommand]\n");
            sb.append("    private void ").append(command.methodName()).append("()\n");
            sb.append("    {\n");
            sb.append("        // TODO: port ").append(command.origin()).append('\n');
            sb.append("    }\n\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String userPart(NamingContext naming) {
        return "namespace " + naming.viewModelNamespace() + ";\n\n"
                + "/// <summary>\n"
                + "/// View model for " + naming.formName() + " (user code, never regenerated).\n"
                + "/// </summary>\n"
                + "public partial class " + naming.viewModelName() + "\n{\n}\n";
    }

    /** One entry per distinct data member, in tree order. */
    static List<BoundProperty> boundProperties(ControlNode root) {
        Map<String, BoundProperty> byMember = new LinkedHashMap<>();
        for (ControlNode node : root.depthFirst()) {
            for (DataBinding binding : node.dataBindings()) {
                String member = binding.dataMember();
                if (member == null || member.isBlank()) {
                    continue;
                }
                String type = typeFor(binding.propertyName());
                byMember.putIfAbsent(member, new BoundProperty(member, type, defaultFor(type)));
            }
        }
        return new ArrayList<>(byMember.values());
    }

    /** One command per distinct handler of a command event, in tree order. */
    static List<Command> commands(ControlNode root) {
        Map<String, Command> byMethod = new LinkedHashMap<>();
        for (ControlNode node : root.depthFirst()) {
            node.events().forEach((event, handler) -> {
                if (EventMappings.isCommand(event)) {
                    String method = EventMappings.commandMethodName(handler);
                    byMethod.putIfAbsent(method, new Command(method, node.name() + "." + event));
                }
            });
        }
        return new ArrayList<>(byMethod.values());
    }

    private static String typeFor(String boundProperty) {
        return switch (boundProperty) {
            case "Checked", "Visible", "Enabled" -> "bool";
            case "Value", "SelectedIndex" -> "int";
            case "Items", "DataSource" -> "ObservableCollection<object>";
            default -> "string";
        };
    }

    private static String defaultFor(String type) {
        return switch (type) {
            case "bool" -> "false";
            case "int" -> "0";
            case "string" -> "string.Empty";
            default -> "new()";
        };
    }

    private static String camelCase(String name) {
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
