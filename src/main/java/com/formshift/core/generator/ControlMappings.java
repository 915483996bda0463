package com.formshift.core.generator;

import java.util.Map;
import java.util.Optional;

/**
 * Built-in WinForms to Avalonia control type table. Unknown kinds have no mapping and are
 * emitted as placeholders.
 */
public final class ControlMappings {

    /**
     * @param targetType Avalonia element name
     * @param component  non-visual component, never placed in a layout panel
     * @param notes      follow-up hint for the migration guide, may be empty
     */
    public record ControlMapping(String targetType, boolean component, String notes) {

        static ControlMapping of(String targetType) {
            return new ControlMapping(targetType, false, "");
        }

        static ControlMapping withNotes(String targetType, String notes) {
            return new ControlMapping(targetType, false, notes);
        }

        static ControlMapping component(String targetType) {
            return new ControlMapping(targetType, true, "");
        }
    }

    private static final Map<String, ControlMapping> MAPPINGS = Map.ofEntries(
            Map.entry("Form", ControlMapping.of("Window")),
            Map.entry("UserControl", ControlMapping.of("UserControl")),
            Map.entry("Panel", ControlMapping.of("Panel")),
            Map.entry("GroupBox", ControlMapping.of("HeaderedContentControl")),
            Map.entry("TabControl", ControlMapping.of("TabControl")),
            Map.entry("TabPage", ControlMapping.of("TabItem")),
            Map.entry("FlowLayoutPanel", ControlMapping.of("WrapPanel")),
            Map.entry("TableLayoutPanel", ControlMapping.withNotes("Grid", "Row and column styles need manual conversion")),
            Map.entry("SplitContainer", ControlMapping.withNotes("Grid", "Rebuild with a GridSplitter")),
            Map.entry("Button", ControlMapping.of("Button")),
            Map.entry("TextBox", ControlMapping.of("TextBox")),
            Map.entry("MaskedTextBox", ControlMapping.withNotes("TextBox", "Masking logic needs reimplementation")),
            Map.entry("RichTextBox", ControlMapping.withNotes("TextBox", "Limited rich text support")),
            Map.entry("Label", ControlMapping.of("TextBlock")),
            Map.entry("LinkLabel", ControlMapping.of("HyperlinkButton")),
            Map.entry("CheckBox", ControlMapping.of("CheckBox")),
            Map.entry("RadioButton", ControlMapping.of("RadioButton")),
            Map.entry("ComboBox", ControlMapping.of("ComboBox")),
            Map.entry("ListBox", ControlMapping.of("ListBox")),
            Map.entry("ListView", ControlMapping.withNotes("ListBox", "Columns and views need an item template")),
            Map.entry("DataGridView", ControlMapping.of("DataGrid")),
            Map.entry("TreeView", ControlMapping.of("TreeView")),
            Map.entry("PictureBox", ControlMapping.of("Image")),
            Map.entry("ProgressBar", ControlMapping.of("ProgressBar")),
            Map.entry("TrackBar", ControlMapping.of("Slider")),
            Map.entry("NumericUpDown", ControlMapping.of("NumericUpDown")),
            Map.entry("DateTimePicker", ControlMapping.of("DatePicker")),
            Map.entry("MonthCalendar", ControlMapping.of("Calendar")),
            Map.entry("MenuStrip", ControlMapping.of("Menu")),
            Map.entry("ToolStripMenuItem", ControlMapping.of("MenuItem")),
            Map.entry("ToolStrip", ControlMapping.withNotes("StackPanel", "Toolbar items need restyling")),
            Map.entry("StatusStrip", ControlMapping.withNotes("StackPanel", "Status bar items need restyling")),
            Map.entry("Timer", ControlMapping.component("DispatcherTimer")),
            Map.entry("ToolTip", ControlMapping.component("ToolTip")),
            Map.entry("ContextMenuStrip", ControlMapping.component("ContextMenu")),
            Map.entry("NotifyIcon", ControlMapping.component("TrayIcon"))
    );

    private ControlMappings() {}

    public static Optional<ControlMapping> lookup(String kind) {
        int dot = kind.lastIndexOf('.');
        return Optional.ofNullable(MAPPINGS.get(dot >= 0 ? kind.substring(dot + 1) : kind));
    }

    public static boolean isMapped(String kind) {
        return lookup(kind).isPresent();
    }
}
