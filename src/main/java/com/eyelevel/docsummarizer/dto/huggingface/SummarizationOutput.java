package com.eyelevel.docsummarizer.dto.huggingface;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SummarizationOutput(@JsonProperty("summary_text") String summaryText) {
}
