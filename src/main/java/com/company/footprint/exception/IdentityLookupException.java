package com.company.footprint.exception;

public class IdentityLookupException extends RuntimeException {
    public IdentityLookupException(String login, Throwable cause) {
        super("Identity lookup failed for " + login, cause);
    }
}
