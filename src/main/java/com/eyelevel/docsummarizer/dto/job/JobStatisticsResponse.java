package com.eyelevel.docsummarizer.dto.job;

import com.eyelevel.docsummarizer.model.JobStatus;

import java.util.Map;

public record JobStatisticsResponse(long totalJobs, Map<JobStatus, Long> byStatus, int activeRuns) {
}
