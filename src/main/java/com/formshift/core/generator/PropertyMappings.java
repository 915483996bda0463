package com.formshift.core.generator;

import java.util.Map;
import java.util.Optional;

/**
 * Built-in WinForms to Avalonia property table. Control-specific entries win over common ones.
 * Properties marked as layout-handled are consumed by the markup layout code rather than
 * copied as attributes.
 */
public final class PropertyMappings {

    /**
     * @param targetProperty Avalonia attribute name
     * @param direct         value can be copied as-is
     * @param layoutHandled  consumed by layout emission (position, size, docking)
     */
    public record PropertyMapping(String targetProperty, boolean direct, boolean layoutHandled) {

        static PropertyMapping direct(String target) {
            return new PropertyMapping(target, true, false);
        }

        static PropertyMapping layout(String target) {
            return new PropertyMapping(target, false, true);
        }

        static PropertyMapping custom(String target) {
            return new PropertyMapping(target, false, false);
        }
    }

    private static final Map<String, PropertyMapping> COMMON = Map.ofEntries(
            Map.entry("Text", PropertyMapping.direct("Content")),
            Map.entry("Width", PropertyMapping.direct("Width")),
            Map.entry("Height", PropertyMapping.direct("Height")),
            Map.entry("Size", PropertyMapping.layout("Width,Height")),
            Map.entry("ClientSize", PropertyMapping.layout("Width,Height")),
            Map.entry("Location", PropertyMapping.layout("Canvas.Left,Canvas.Top")),
            Map.entry("Dock", PropertyMapping.layout("DockPanel.Dock")),
            Map.entry("Anchor", PropertyMapping.custom("HorizontalAlignment,VerticalAlignment")),
            Map.entry("Visible", PropertyMapping.direct("IsVisible")),
            Map.entry("Enabled", PropertyMapping.direct("IsEnabled")),
            Map.entry("ReadOnly", PropertyMapping.direct("IsReadOnly")),
            Map.entry("TabIndex", PropertyMapping.direct("TabIndex")),
            Map.entry("TabStop", PropertyMapping.direct("IsTabStop")),
            Map.entry("Checked", PropertyMapping.direct("IsChecked")),
            Map.entry("MaxLength", PropertyMapping.direct("MaxLength")),
            Map.entry("Multiline", PropertyMapping.direct("AcceptsReturn")),
            Map.entry("SelectedIndex", PropertyMapping.direct("SelectedIndex")),
            Map.entry("Minimum", PropertyMapping.direct("Minimum")),
            Map.entry("Maximum", PropertyMapping.direct("Maximum")),
            Map.entry("Value", PropertyMapping.direct("Value")),
            Map.entry("BackColor", PropertyMapping.direct("Background")),
            Map.entry("ForeColor", PropertyMapping.direct("Foreground")),
            Map.entry("Font", PropertyMapping.custom("FontFamily,FontSize,FontWeight")),
            Map.entry("Padding", PropertyMapping.custom("Padding")),
            Map.entry("Margin", PropertyMapping.custom("Margin")),
            Map.entry("Image", PropertyMapping.custom("Source"))
    );

    private static final Map<String, Map<String, PropertyMapping>> CONTROL_SPECIFIC = Map.of(
            "Form", Map.of(
                    "Text", PropertyMapping.direct("Title"),
                    "TopMost", PropertyMapping.direct("Topmost"),
                    "ShowInTaskbar", PropertyMapping.direct("ShowInTaskbar")),
            "Label", Map.of("Text", PropertyMapping.direct("Text")),
            "TextBox", Map.of("Text", PropertyMapping.direct("Text")),
            "GroupBox", Map.of("Text", PropertyMapping.direct("Header")),
            "TabPage", Map.of("Text", PropertyMapping.direct("Header")),
            "ToolStripMenuItem", Map.of("Text", PropertyMapping.direct("Header")),
            "ProgressBar", Map.of("Style", PropertyMapping.custom("IsIndeterminate"))
    );

    private PropertyMappings() {}

    public static Optional<PropertyMapping> lookup(String property, String controlKind) {
        Map<String, PropertyMapping> specific = CONTROL_SPECIFIC.get(controlKind);
        if (specific != null && specific.containsKey(property)) {
            return Optional.of(specific.get(property));
        }
        return Optional.ofNullable(COMMON.get(property));
    }
}
