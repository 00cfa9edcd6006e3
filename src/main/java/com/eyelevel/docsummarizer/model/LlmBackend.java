package com.eyelevel.docsummarizer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * The summarization backend a job is bound to.
 */
@Getter
@RequiredArgsConstructor
public enum LlmBackend {
    /**
     * OpenAI chat completions API.
     */
    OPENAI("openai"),
    /**
     * Hugging Face inference API running a BART-style summarization model.
     */
    HUGGINGFACE("hf"),
    /**
     * In-process extractive summarizer; needs no network access.
     */
    LOCAL("local");

    @JsonValue
    private final String value;

    @JsonCreator
    public static LlmBackend fromValue(final String text) {
        return Arrays.stream(values())
                .filter(backend -> backend.value.equalsIgnoreCase(text.trim())
                        || backend.name().equalsIgnoreCase(text.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown LLM backend: " + text));
    }
}
