package com.company.footprint.aggregation;

import com.company.footprint.domain.UsageReportRow;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Rows produced for one day of a tracking run, handed from a worker to the writer.
 */
@Value
public class SubWindowResult {
    LocalDate day;
    List<UsageReportRow> rows;
    long jobsProcessed;
    long jobsSkipped;
}
