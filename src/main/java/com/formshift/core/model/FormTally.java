package com.formshift.core.model;

/**
 * Per-form counts collected at the emission boundary.
 *
 * @param controls         controls in the form, root included
 * @param placeholders     controls with no target mapping
 * @param properties       properties declared across all controls
 * @param mappedProperties properties with a target mapping
 * @param events           event subscriptions
 * @param commands         event subscriptions turned into commands
 */
public record FormTally(
    int controls,
    int placeholders,
    int properties,
    int mappedProperties,
    int events,
    int commands
) {}
