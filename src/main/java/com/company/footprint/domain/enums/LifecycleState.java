package com.company.footprint.domain.enums;

public enum LifecycleState {
    PENDING("Job is queued and has not started"),
    RUNNING("Job has started and not finished"),
    TERMINAL("Job has finished");

    private final String description;

    LifecycleState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isOpen() {
        return this != TERMINAL;
    }
}
