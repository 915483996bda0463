package com.formshift.core.model;

/**
 * Layout strategy inferred for a container's children.
 */
public enum LayoutKind {
    FREE_POSITIONED,
    GRID,
    LINEAR_STACK,
    EDGE_DOCKED
}
