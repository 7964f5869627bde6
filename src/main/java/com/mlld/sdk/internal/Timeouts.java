package com.mlld.sdk.internal;

import java.time.Duration;

/**
 * Duration arithmetic for request deadlines.
 */
public final class Timeouts {

    private Timeouts() {
    }

    /**
     * Nanoseconds in the duration, saturated to {@link Long#MAX_VALUE} for durations
     * too long to represent (about 292 years), which behave as unbounded waits.
     * Negative durations count as zero.
     */
    public static long toNanos(Duration duration) {
        if (duration.isNegative()) {
            return 0;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
