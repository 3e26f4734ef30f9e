package com.company.footprint.exception;

public class JobRecordRejectedException extends RuntimeException {
    public JobRecordRejectedException(String scheduler, long jobId, int jobIndex, String reason) {
        super("Rejected job " + scheduler + ":" + jobId + "[" + jobIndex + "]: " + reason);
    }
}
