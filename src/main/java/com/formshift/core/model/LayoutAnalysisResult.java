package com.formshift.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Layout classification for one container's direct children.
 *
 * @param kind          chosen layout strategy
 * @param confidence    heuristic certainty, always within [0, 100]
 * @param metadata      strategy-specific details (row/column counts, orientation, ...)
 * @param justification human-readable reason for the choice
 * @param childLayouts  nested results keyed by child name, for children that are containers
 */
public record LayoutAnalysisResult(
    LayoutKind kind,
    int confidence,
    Map<String, Object> metadata,
    String justification,
    Map<String, LayoutAnalysisResult> childLayouts
) {

    public LayoutAnalysisResult {
        Objects.requireNonNull(kind, "kind");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        justification = justification == null ? "" : justification;
        childLayouts = childLayouts == null ? Map.of() : Map.copyOf(childLayouts);
    }

    public LayoutAnalysisResult(LayoutKind kind, int confidence, Map<String, Object> metadata, String justification) {
        this(kind, confidence, metadata, justification, Map.of());
    }

    public static LayoutAnalysisResult freePositioned(String justification) {
        return new LayoutAnalysisResult(LayoutKind.FREE_POSITIONED, 100, Map.of(), justification);
    }

    public LayoutAnalysisResult withChildLayouts(Map<String, LayoutAnalysisResult> children) {
        var merged = new LinkedHashMap<>(childLayouts);
        merged.putAll(children);
        return new LayoutAnalysisResult(kind, confidence, metadata, justification, merged);
    }

    public Optional<LayoutAnalysisResult> childLayout(String childName) {
        return Optional.ofNullable(childLayouts.get(childName));
    }

    public int intMetadata(String key, int fallback) {
        Object v = metadata.get(key);
        return v instanceof Number n ? n.intValue() : fallback;
    }

    public String stringMetadata(String key, String fallback) {
        Object v = metadata.get(key);
        return v != null ? v.toString() : fallback;
    }
}
