package com.eyelevel.docsummarizer.pipeline.stage;

import com.eyelevel.docsummarizer.model.LlmBackend;

/**
 * @param summaryText The generated summary.
 * @param backend     The backend that produced it.
 * @param model       The model identifier reported by the backend.
 */
public record SummaryOutput(String summaryText, LlmBackend backend, String model) {
}
