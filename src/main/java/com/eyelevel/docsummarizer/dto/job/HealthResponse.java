package com.eyelevel.docsummarizer.dto.job;

import java.util.List;
import java.util.Map;

public record HealthResponse(String status, List<Map<String, Object>> backends, long totalJobs) {
}
