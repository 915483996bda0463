package com.formshift.core.layout;

import java.util.Objects;

/**
 * Tuning knobs for one layout analysis.
 *
 * @param alignmentTolerance  max coordinate distance treated as the same line
 * @param confidenceThreshold minimum confidence (0-100) for a structured layout to be kept
 * @param mode                forced-mode override
 */
public record LayoutAnalysisContext(
    int alignmentTolerance,
    int confidenceThreshold,
    LayoutMode mode
) {

    public static final int DEFAULT_TOLERANCE = 5;
    public static final int DEFAULT_THRESHOLD = 70;

    public LayoutAnalysisContext {
        if (alignmentTolerance < 0) {
            throw new IllegalArgumentException("alignmentTolerance must not be negative");
        }
        if (confidenceThreshold < 0 || confidenceThreshold > 100) {
            throw new IllegalArgumentException("confidenceThreshold must be within 0..100");
        }
        Objects.requireNonNull(mode, "mode");
    }

    public static LayoutAnalysisContext defaults() {
        return new LayoutAnalysisContext(DEFAULT_TOLERANCE, DEFAULT_THRESHOLD, LayoutMode.AUTO);
    }

    public LayoutAnalysisContext withMode(LayoutMode newMode) {
        return new LayoutAnalysisContext(alignmentTolerance, confidenceThreshold, newMode);
    }
}
