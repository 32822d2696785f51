package com.neutrala.steps;

import com.neutrala.platform.PlatformAdapter;

/**
 * Timestamp source for one conversion. Each call returns a value strictly greater than the
 * previous one; when the platform clock has not advanced the previous value is bumped by one.
 */
final class StepClock {

    private final PlatformAdapter platformAdapter;
    private long counter;
    private long last = Long.MIN_VALUE;

    StepClock(PlatformAdapter platformAdapter) {
        this.platformAdapter = platformAdapter;
    }

    long next() {
        counter++;
        long candidate = platformAdapter.timestamp(counter);
        last = candidate > last ? candidate : last + 1;
        return last;
    }
}
