package com.eyelevel.docsummarizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Options fixed when a job is submitted. The orchestration core passes them to the stages unchanged.
 */
@Value
@Builder(toBuilder = true)
public class JobConfig {

    @Builder.Default
    SummaryMode summaryMode = SummaryMode.BRIEF;

    @Builder.Default
    LlmBackend llmBackend = LlmBackend.LOCAL;

    @Builder.Default
    boolean extractEntities = true;

    @Builder.Default
    boolean extractTables = true;

    /**
     * Entity types to extract. Empty means all types.
     */
    @Singular
    Set<EntityType> entityTypes;

    @Builder.Default
    int maxPages = 3;
}
