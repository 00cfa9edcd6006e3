package com.eyelevel.docsummarizer.dto.huggingface;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload for a Hugging Face inference summarization call.
 */
public record SummarizationRequest(String inputs, Parameters parameters) {

    public record Parameters(@JsonProperty("min_length") int minLength,
                             @JsonProperty("max_length") int maxLength,
                             @JsonProperty("do_sample") boolean doSample) {
    }
}
