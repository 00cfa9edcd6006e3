package com.eyelevel.docsummarizer.summarization;

import com.eyelevel.docsummarizer.exception.SummarizationException;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;

import java.util.Map;

/**
 * A service able to condense document text into a summary in one of the {@link SummaryMode}s.
 */
public interface SummarizationBackend {

    LlmBackend backend();

    /**
     * @return The model identifier reported in job results.
     */
    String modelName();

    /**
     * @param text The document text, not blank.
     * @param mode The summary style.
     * @return The summary text.
     * @throws SummarizationException if no summary can be produced.
     */
    String summarize(String text, SummaryMode mode);

    /**
     * @return Descriptive information about the backend for diagnostics endpoints.
     */
    default Map<String, Object> modelInfo() {
        return Map.of("backend", backend().getValue(), "model", modelName());
    }
}
