package com.company.footprint.exception;

public class UsageStoreException extends RuntimeException {
    public UsageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
