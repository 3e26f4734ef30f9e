package com.company.footprint.exception;

import java.time.LocalDate;

public class UsageProcessingException extends RuntimeException {
    public UsageProcessingException(LocalDate day, Throwable cause) {
        super("Failed to process usage for " + day + ": " + cause.getMessage(), cause);
    }

    public UsageProcessingException(String message) {
        super(message);
    }
}
