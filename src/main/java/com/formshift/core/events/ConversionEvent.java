package com.formshift.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a conversion runs.
 *
 * @param eventType one of the {@code conversion.*}, {@code phase.*} or {@code form.*} types
 * @param runId     the run this event belongs to
 * @param form      the form this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ConversionEvent(
    String eventType,
    String runId,
    String form,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String CONVERSION_STARTED = "conversion.started";
    public static final String PHASE_CHANGED = "phase.changed";
    public static final String FORM_CONVERTED = "form.converted";
    public static final String FORM_FAILED = "form.failed";
    public static final String FORM_SKIPPED = "form.skipped";
    public static final String CONVERSION_COMPLETED = "conversion.completed";
    public static final String CONVERSION_CANCELLED = "conversion.cancelled";
    public static final String CONVERSION_FAILED = "conversion.failed";

    public static ConversionEvent of(String eventType, String runId, String form, Map<String, Object> payload) {
        return new ConversionEvent(eventType, runId, form, payload == null ? Map.of() : Map.copyOf(payload), Instant.now());
    }
}
