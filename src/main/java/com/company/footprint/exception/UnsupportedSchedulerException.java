package com.company.footprint.exception;

public class UnsupportedSchedulerException extends RuntimeException {
    public UnsupportedSchedulerException(String scheduler) {
        super("Unsupported scheduler: " + scheduler);
    }

    public UnsupportedSchedulerException(String scheduler, String status) {
        super("Unsupported terminal status '" + status + "' for scheduler " + scheduler);
    }
}
