package com.formshift.core.metrics;

import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.LayoutKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for conversion runs.
 */
@Service
public class ConversionMetrics {

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(ConversionOutcome outcome) {
        Counter.builder("formshift.runs.total")
                .tag("status", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Time spent converting one form, tagged with the root layout chosen for it.
     */
    public void recordFormDuration(LayoutKind layout, long ms) {
        Timer.builder("formshift.forms.duration")
                .tag("layout", layout.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLayoutDecision(LayoutKind kind) {
        Counter.builder("formshift.layout.decisions")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementRollbacks() {
        Counter.builder("formshift.rollbacks.total")
                .description("Guard transactions rolled back on cancellation or failure")
                .register(registry)
                .increment();
    }
}
