package com.formshift.core.engine;

import com.formshift.core.model.ConversionPhase;
import com.formshift.core.model.ConversionProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Throttles progress snapshots to one per window, except that the first snapshot of a new
 * phase is always delivered. An observer that throws is logged and otherwise ignored.
 */
public class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressObserver observer;
    private final long throttleMillis;
    private final LongSupplier clock;

    private ConversionPhase lastPhase;
    private long lastDeliveredAt;
    private int delivered;

    public ProgressReporter(ProgressObserver observer, long throttleMillis) {
        this(observer, throttleMillis, System::currentTimeMillis);
    }

    /**
     * @param clock current time in milliseconds
     */
    public ProgressReporter(ProgressObserver observer, long throttleMillis, LongSupplier clock) {
        if (throttleMillis < 0) {
            throw new IllegalArgumentException("throttleMillis must not be negative: " + throttleMillis);
        }
        this.observer = observer == null ? ProgressObserver.NONE : observer;
        this.throttleMillis = throttleMillis;
        this.clock = clock;
    }

    /**
     * Delivers {@code progress} unless an earlier snapshot of the same phase was delivered
     * less than the throttle window ago.
     *
     * @return whether the observer was called
     */
    public synchronized boolean report(ConversionProgress progress) {
        long now = clock.getAsLong();
        boolean phaseChanged = progress.phase() != lastPhase;
        if (!phaseChanged && now - lastDeliveredAt < throttleMillis) {
            return false;
        }
        lastPhase = progress.phase();
        lastDeliveredAt = now;
        delivered++;
        try {
            observer.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress observer failed: {}", e.getMessage(), e);
        }
        return true;
    }

    public synchronized int deliveredCount() {
        return delivered;
    }
}
