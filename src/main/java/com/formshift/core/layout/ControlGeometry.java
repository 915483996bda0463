package com.formshift.core.layout;

import com.formshift.core.model.ControlNode;
import com.formshift.core.model.PropertyValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Positional and docking facts read from a control's properties.
 * Shared by the inference engine and the markup emitter so both agree on coordinates.
 */
public final class ControlGeometry {

    public static final String LOCATION = "Location";
    public static final String DOCK = "Dock";

    private static final List<String> NON_VISUAL_MARKERS = List.of("Component", "ContextMenu", "Timer");

    private ControlGeometry() {}

    /** A control's top-left corner in source coordinate units. */
    public record Point(int x, int y) {}

    /** Non-visual components (timers, menus, tool-tip providers, ...) never take part in layout. */
    public static boolean isLayoutEligible(ControlNode node) {
        String kind = node.kind();
        for (String marker : NON_VISUAL_MARKERS) {
            if (kind.contains(marker)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isDocked(ControlNode node) {
        return node.property(DOCK)
                .map(PropertyValue::simpleName)
                .map(String::trim)
                .filter(edge -> !edge.isEmpty() && !"none".equals(edge.toLowerCase(Locale.ROOT)))
                .isPresent();
    }

    public static Optional<String> dockEdge(ControlNode node) {
        return isDocked(node) ? node.property(DOCK).map(PropertyValue::simpleName) : Optional.empty();
    }

    /**
     * Parses the {@code Location} property. Accepts {@code new Point(x, y)},
     * {@code new System.Drawing.Point(x, y)} and bare {@code x, y}; a component that is
     * not an integer reads as 0.
     */
    public static Optional<Point> location(ControlNode node) {
        return pair(node, LOCATION);
    }

    /** Reads any two-component property ({@code Size}, {@code ClientSize}, ...) the same way. */
    public static Optional<Point> pair(ControlNode node, String property) {
        return node.property(property).map(v -> parsePoint(v.raw()));
    }

    static Point parsePoint(String raw) {
        String text = raw;
        int open = text.indexOf('(');
        int close = text.lastIndexOf(')');
        if (open >= 0 && close > open) {
            text = text.substring(open + 1, close);
        }
        String[] parts = text.split(",");
        int x = parts.length > 0 ? parseCoordinate(parts[0]) : 0;
        int y = parts.length > 1 ? parseCoordinate(parts[1]) : 0;
        return new Point(x, y);
    }

    private static int parseCoordinate(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Index of the line closest to {@code value}. Lines come from
     * {@link LayoutInferenceEngine#clusterLines(List, int)}.
     */
    public static int nearestLine(int value, List<Integer> lines) {
        int best = 0;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < lines.size(); i++) {
            int d = Math.abs(lines.get(i) - value);
            if (d < bestDistance) {
                best = i;
                bestDistance = d;
            }
        }
        return best;
    }
}
