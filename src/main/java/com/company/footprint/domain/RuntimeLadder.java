package com.company.footprint.domain;

/**
 * Upper bounds (inclusive, in seconds) of the runtime distribution buckets.
 * Runtimes longer than a week land in the trailing overflow bucket.
 */
public final class RuntimeLadder {

    private static final long[] THRESHOLDS = {
            60,
            10 * 60,
            3600,
            3 * 3600,
            6 * 3600,
            12 * 3600,
            24 * 3600,
            48 * 3600,
            72 * 3600,
            7 * 24 * 3600
    };

    private RuntimeLadder() {
    }

    public static int size() {
        return THRESHOLDS.length + 1;
    }

    public static int indexOf(double runtimeSeconds) {
        for (int i = 0; i < THRESHOLDS.length; i++) {
            if (runtimeSeconds <= THRESHOLDS[i]) {
                return i;
            }
        }
        return THRESHOLDS.length;
    }
}
