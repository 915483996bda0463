package com.formshift.core.layout;

import java.util.Locale;

/**
 * Whether layout is inferred or forced to free positioning.
 */
public enum LayoutMode {
    AUTO,
    FREE_POSITIONED;

    /**
     * Parses a user-facing mode name. {@code canvas}, {@code free} and {@code absolute}
     * all select {@link #FREE_POSITIONED}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static LayoutMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "canvas", "free", "free_positioned", "absolute" -> FREE_POSITIONED;
            default -> throw new IllegalArgumentException("Unknown layout mode: " + value);
        };
    }
}
