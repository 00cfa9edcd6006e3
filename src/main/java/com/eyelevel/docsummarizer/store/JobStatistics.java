package com.eyelevel.docsummarizer.store;

import com.eyelevel.docsummarizer.model.JobStatus;

import java.util.Map;

/**
 * Point-in-time job counts. Every status is present in {@code byStatus}, with zero where no job has it.
 */
public record JobStatistics(long totalJobs, Map<JobStatus, Long> byStatus) {
}
