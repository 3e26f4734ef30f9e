package com.company.footprint.exception;

import java.time.YearMonth;

public class ReportNotFoundException extends RuntimeException {
    public ReportNotFoundException(YearMonth month) {
        super("No report for " + month);
    }
}
