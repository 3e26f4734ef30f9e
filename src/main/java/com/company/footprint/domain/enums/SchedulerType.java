package com.company.footprint.domain.enums;

import com.company.footprint.exception.UnsupportedSchedulerException;

import java.util.Locale;

/**
 * Scheduler backends whose terminal status vocabulary is known.
 * The table is closed: an unknown terminal status is an error, never a guess.
 */
public enum SchedulerType {
    LSF("lsf", "done", "exit");

    private final String tag;
    private final String successStatus;
    private final String failureStatus;

    SchedulerType(String tag, String successStatus, String failureStatus) {
        this.tag = tag;
        this.successStatus = successStatus;
        this.failureStatus = failureStatus;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Classify a terminal status.
     *
     * @return true for successful completion, false for failure
     * @throws UnsupportedSchedulerException if the status is not in the table
     */
    public boolean isSuccessful(String status) {
        String normalized = status == null ? "" : status.toLowerCase(Locale.ROOT);
        if (successStatus.equals(normalized)) {
            return true;
        }
        if (failureStatus.equals(normalized)) {
            return false;
        }
        throw new UnsupportedSchedulerException(tag, status);
    }

    public static SchedulerType fromTag(String tag) {
        for (SchedulerType type : values()) {
            if (type.tag.equalsIgnoreCase(tag)) {
                return type;
            }
        }
        throw new UnsupportedSchedulerException(tag);
    }
}
