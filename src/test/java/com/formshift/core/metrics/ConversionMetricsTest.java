package com.formshift.core.metrics;

import com.formshift.core.model.ConversionOutcome;
import com.formshift.core.model.LayoutKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversionMetricsTest {

    private SimpleMeterRegistry registry;
    private ConversionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ConversionMetrics(registry);
    }

    @Test
    @DisplayName("recordRunResult increments by status tag")
    void recordRunResult() {
        metrics.recordRunResult(ConversionOutcome.SUCCESS);
        metrics.recordRunResult(ConversionOutcome.SUCCESS);
        metrics.recordRunResult(ConversionOutcome.CANCELLED);

        var success = registry.find("formshift.runs.total").tag("status", "success").counter();
        var cancelled = registry.find("formshift.runs.total").tag("status", "cancelled").counter();

        assertNotNull(success);
        assertNotNull(cancelled);
        assertEquals(2.0, success.count());
        assertEquals(1.0, cancelled.count());
    }

    @Test
    @DisplayName("recordFormDuration records by layout tag")
    void recordFormDuration() {
        metrics.recordFormDuration(LayoutKind.GRID, 120);
        metrics.recordFormDuration(LayoutKind.LINEAR_STACK, 80);

        var grid = registry.find("formshift.forms.duration").tag("layout", "grid").timer();
        var stack = registry.find("formshift.forms.duration").tag("layout", "linear_stack").timer();

        assertNotNull(grid);
        assertNotNull(stack);
        assertEquals(1, grid.count());
        assertEquals(1, stack.count());
    }

    @Test
    @DisplayName("recordLayoutDecision counts each kind")
    void recordLayoutDecision() {
        metrics.recordLayoutDecision(LayoutKind.EDGE_DOCKED);
        metrics.recordLayoutDecision(LayoutKind.EDGE_DOCKED);

        var docked = registry.find("formshift.layout.decisions").tag("kind", "edge_docked").counter();
        assertNotNull(docked);
        assertEquals(2.0, docked.count());
    }

    @Test
    @DisplayName("incrementRollbacks creates a counter")
    void incrementRollbacks() {
        metrics.incrementRollbacks();
        var counter = registry.find("formshift.rollbacks.total").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
