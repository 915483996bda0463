package com.formshift.core.engine;

import com.formshift.core.model.ConversionPhase;
import com.formshift.core.model.ConversionProgress;
import com.formshift.core.model.ConversionStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ProgressReporterTest {

    private final AtomicLong now = new AtomicLong(1_000);
    private final List<ConversionProgress> seen = new ArrayList<>();

    private static ConversionProgress progress(ConversionPhase phase, int processed) {
        return new ConversionProgress(phase, "", processed, 10, "", new ConversionStatistics(), 0, 0, Duration.ZERO);
    }

    @Test
    @DisplayName("snapshots inside the window are dropped")
    void throttles() {
        var reporter = new ProgressReporter(seen::add, 100, now::get);

        assertTrue(reporter.report(progress(ConversionPhase.PARSE, 0)));
        now.addAndGet(50);
        assertFalse(reporter.report(progress(ConversionPhase.PARSE, 1)));
        now.addAndGet(50);
        assertTrue(reporter.report(progress(ConversionPhase.PARSE, 2)));

        assertEquals(2, reporter.deliveredCount());
        assertEquals(List.of(0, 2), seen.stream().map(ConversionProgress::formsProcessed).toList());
    }

    @Test
    @DisplayName("a phase change is always delivered")
    void phaseChange() {
        var reporter = new ProgressReporter(seen::add, 1_000, now::get);
        reporter.report(progress(ConversionPhase.PARSE, 0));
        assertTrue(reporter.report(progress(ConversionPhase.ANALYZE, 0)));
        assertFalse(reporter.report(progress(ConversionPhase.ANALYZE, 1)));
        assertEquals(2, seen.size());
    }

    @Test
    @DisplayName("a zero window delivers everything")
    void zeroWindow() {
        var reporter = new ProgressReporter(seen::add, 0, now::get);
        for (int i = 0; i < 5; i++) {
            reporter.report(progress(ConversionPhase.GENERATE, i));
        }
        assertEquals(5, seen.size());
    }

    @Test
    @DisplayName("a failing observer does not break reporting")
    void failingObserver() {
        var reporter = new ProgressReporter(p -> { throw new IllegalStateException("boom"); }, 0, now::get);
        assertTrue(reporter.report(progress(ConversionPhase.PARSE, 0)));
        assertEquals(1, reporter.deliveredCount());
    }

    @Test
    void negativeWindowRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProgressReporter(seen::add, -1, now::get));
    }

    @Test
    void percentComplete() {
        assertEquals(30, progress(ConversionPhase.GENERATE, 3).percentComplete());
        assertEquals(100, new ConversionProgress(ConversionPhase.COMPLETE, "", 0, 0, "", new ConversionStatistics(),
                0, 0, Duration.ZERO).percentComplete());
    }
}
