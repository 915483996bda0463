package com.formshift.core.generator;

import java.util.Map;
import java.util.Optional;

/**
 * Built-in WinForms to Avalonia event table. Command events become relay commands on the
 * view model; the rest keep a code-behind handler under the target event name.
 */
public final class EventMappings {

    public record EventMapping(String targetEvent, boolean command) {}

    private static final Map<String, EventMapping> MAPPINGS = Map.ofEntries(
            Map.entry("Click", new EventMapping("Click", true)),
            Map.entry("DoubleClick", new EventMapping("DoubleTapped", true)),
            Map.entry("SelectedIndexChanged", new EventMapping("SelectionChanged", true)),
            Map.entry("CellClick", new EventMapping("CellPointerPressed", true)),
            Map.entry("MouseDown", new EventMapping("PointerPressed", false)),
            Map.entry("MouseUp", new EventMapping("PointerReleased", false)),
            Map.entry("MouseMove", new EventMapping("PointerMoved", false)),
            Map.entry("MouseEnter", new EventMapping("PointerEntered", false)),
            Map.entry("MouseLeave", new EventMapping("PointerExited", false)),
            Map.entry("KeyDown", new EventMapping("KeyDown", false)),
            Map.entry("KeyUp", new EventMapping("KeyUp", false)),
            Map.entry("KeyPress", new EventMapping("TextInput", false)),
            Map.entry("GotFocus", new EventMapping("GotFocus", false)),
            Map.entry("LostFocus", new EventMapping("LostFocus", false)),
            Map.entry("Enter", new EventMapping("GotFocus", false)),
            Map.entry("Leave", new EventMapping("LostFocus", false)),
            Map.entry("TextChanged", new EventMapping("TextChanged", false)),
            Map.entry("Load", new EventMapping("Loaded", false)),
            Map.entry("FormClosing", new EventMapping("Closing", false)),
            Map.entry("FormClosed", new EventMapping("Closed", false)),
            Map.entry("Resize", new EventMapping("SizeChanged", false)),
            Map.entry("Tick", new EventMapping("Tick", false))
    );

    private EventMappings() {}

    public static Optional<EventMapping> lookup(String event) {
        return Optional.ofNullable(MAPPINGS.get(event));
    }

    public static boolean isCommand(String event) {
        return lookup(event).map(EventMapping::command).orElse(false);
    }

    /** View-model method name for a handler; the generated command is this name plus {@code Command}. */
    public static String commandMethodName(String handler) {
        String name = handler.replace("_", "");
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
