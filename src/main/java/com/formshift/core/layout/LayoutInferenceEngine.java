package com.formshift.core.layout;

import com.formshift.core.layout.ControlGeometry.Point;
import com.formshift.core.model.ControlNode;
import com.formshift.core.model.LayoutAnalysisResult;
import com.formshift.core.model.LayoutKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the direct children of a container as free-positioned, grid, linear-stack or
 * edge-docked, then recurses into child containers.
 * <p>
 * Three candidates are scored independently (edge-docked, grid, linear-stack, which is also
 * the tie-break order). The best candidate is kept only when its confidence reaches the
 * context's threshold; otherwise the container falls back to free positioning. All
 * confidences are integer percentages obtained by truncating division.
 * <p>
 * Stateless and safe to share across threads.
 */
@Service
public class LayoutInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(LayoutInferenceEngine.class);

    static final Comparator<Point> BY_Y_THEN_X =
            Comparator.comparingInt(Point::y).thenComparingInt(Point::x);
    static final Comparator<Point> BY_X_THEN_Y =
            Comparator.comparingInt(Point::x).thenComparingInt(Point::y);

    /**
     * Analyzes {@code container} and, when a structured layout is accepted, every eligible
     * child that itself has children.
     */
    public LayoutAnalysisResult analyze(ControlNode container, LayoutAnalysisContext context) {
        if (context.mode() == LayoutMode.FREE_POSITIONED) {
            return LayoutAnalysisResult.freePositioned("Free positioning forced by layout mode");
        }

        List<ControlNode> eligible = container.children().stream()
                .filter(ControlGeometry::isLayoutEligible)
                .toList();
        if (eligible.isEmpty()) {
            return LayoutAnalysisResult.freePositioned("No eligible children");
        }

        int tolerance = context.alignmentTolerance();
        LayoutAnalysisResult best = select(
                scoreEdgeDocked(eligible),
                scoreGrid(eligible, tolerance),
                scoreLinearStack(eligible, tolerance));

        if (best.confidence() < context.confidenceThreshold()) {
            log.debug("{}: best candidate {} at {}% rejected (threshold {}%)",
                    container.name(), best.kind(), best.confidence(), context.confidenceThreshold());
            return new LayoutAnalysisResult(LayoutKind.FREE_POSITIONED, 100,
                    Map.of("rejectedKind", best.kind().name(), "rejectedConfidence", best.confidence()),
                    "Best match was " + label(best.kind()) + " (" + best.confidence() + "%), below threshold "
                            + context.confidenceThreshold() + "%");
        }

        Map<String, LayoutAnalysisResult> nested = new LinkedHashMap<>();
        for (ControlNode child : eligible) {
            if (child.hasChildren()) {
                nested.put(child.name(), analyze(child, context));
            }
        }
        log.debug("{}: {} at {}% ({} nested)", container.name(), best.kind(), best.confidence(), nested.size());
        return nested.isEmpty() ? best : best.withChildLayouts(nested);
    }

    /**
     * Highest confidence wins; equal confidences keep the earlier candidate. A grid that is
     * a single row or column describes a line, so it yields to a stack scoring at least as high.
     */
    static LayoutAnalysisResult select(LayoutAnalysisResult dock, LayoutAnalysisResult grid,
                                       LayoutAnalysisResult stack) {
        LayoutAnalysisResult best = dock;
        if (grid.confidence() > best.confidence()) {
            best = grid;
        }
        if (stack.confidence() > best.confidence()) {
            best = stack;
        }
        if (best == grid && isDegenerateGrid(grid) && stack.confidence() >= grid.confidence()) {
            best = stack;
        }
        return best;
    }

    private static boolean isDegenerateGrid(LayoutAnalysisResult grid) {
        return grid.intMetadata("rows", 0) <= 1 || grid.intMetadata("columns", 0) <= 1;
    }

    LayoutAnalysisResult scoreEdgeDocked(List<ControlNode> eligible) {
        int docked = (int) eligible.stream().filter(ControlGeometry::isDocked).count();
        int confidence = docked * 100 / eligible.size();
        return new LayoutAnalysisResult(LayoutKind.EDGE_DOCKED, confidence,
                Map.of("dockedCount", docked),
                docked + " of " + eligible.size() + " children are docked");
    }

    LayoutAnalysisResult scoreGrid(List<ControlNode> eligible, int tolerance) {
        List<Point> points = positions(eligible);
        if (points.size() < 2) {
            return new LayoutAnalysisResult(LayoutKind.GRID, 0, Map.of(), "Fewer than two positioned children");
        }
        List<Integer> rows = clusterLines(points.stream().map(Point::y).toList(), tolerance);
        List<Integer> columns = clusterLines(points.stream().map(Point::x).toList(), tolerance);

        int aligned = 0;
        for (Point p : points) {
            if (onLine(p.x(), columns, tolerance) && onLine(p.y(), rows, tolerance)) {
                aligned++;
            }
        }
        int confidence = aligned * 100 / points.size();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rows", rows.size());
        metadata.put("columns", columns.size());
        metadata.put("rowLines", rows);
        metadata.put("columnLines", columns);
        metadata.put("alignedCount", aligned);
        return new LayoutAnalysisResult(LayoutKind.GRID, confidence, metadata,
                rows.size() + "x" + columns.size() + " grid, " + aligned + " of " + points.size()
                        + " positioned children aligned");
    }

    LayoutAnalysisResult scoreLinearStack(List<ControlNode> eligible, int tolerance) {
        List<Point> points = positions(eligible);
        if (points.size() < 2) {
            return new LayoutAnalysisResult(LayoutKind.LINEAR_STACK, 0, Map.of(), "Fewer than two positioned children");
        }

        List<Point> byRow = new ArrayList<>(points);
        byRow.sort(BY_Y_THEN_X);
        int vertical = 0;
        for (int i = 1; i < byRow.size(); i++) {
            if (Math.abs(byRow.get(i).x() - byRow.get(i - 1).x()) <= tolerance) {
                vertical++;
            }
        }

        List<Point> byColumn = new ArrayList<>(points);
        byColumn.sort(BY_X_THEN_Y);
        int horizontal = 0;
        for (int i = 1; i < byColumn.size(); i++) {
            if (Math.abs(byColumn.get(i).y() - byColumn.get(i - 1).y()) <= tolerance) {
                horizontal++;
            }
        }

        boolean isVertical = vertical >= horizontal;
        int aligned = Math.max(vertical, horizontal);
        int pairs = points.size() - 1;
        int confidence = aligned * 100 / pairs;
        String orientation = isVertical ? "vertical" : "horizontal";
        return new LayoutAnalysisResult(LayoutKind.LINEAR_STACK, confidence,
                Map.of("orientation", orientation, "alignedCount", aligned),
                capitalize(orientation) + " stack, " + aligned + " of " + pairs + " adjacent pairs aligned");
    }

    /**
     * Greedy tolerance clustering: values are visited in ascending order and each one starts
     * a new line unless it lies within {@code tolerance} of a line already found. Lines are
     * returned ascending and are pairwise further apart than {@code tolerance}, so clustering
     * the result again returns it unchanged.
     */
    public static List<Integer> clusterLines(List<Integer> values, int tolerance) {
        List<Integer> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());
        List<Integer> lines = new ArrayList<>();
        for (int v : sorted) {
            if (!onLine(v, lines, tolerance)) {
                lines.add(v);
            }
        }
        return List.copyOf(lines);
    }

    private static boolean onLine(int value, List<Integer> lines, int tolerance) {
        for (int line : lines) {
            if (Math.abs(value - line) <= tolerance) {
                return true;
            }
        }
        return false;
    }

    private static List<Point> positions(List<ControlNode> nodes) {
        List<Point> points = new ArrayList<>();
        for (ControlNode n : nodes) {
            ControlGeometry.location(n).ifPresent(points::add);
        }
        return points;
    }

    static String label(LayoutKind kind) {
        return switch (kind) {
            case FREE_POSITIONED -> "Canvas";
            case GRID -> "Grid";
            case LINEAR_STACK -> "StackPanel";
            case EDGE_DOCKED -> "DockPanel";
        };
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
