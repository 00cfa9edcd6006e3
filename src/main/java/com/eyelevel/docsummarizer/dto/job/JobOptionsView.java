package com.eyelevel.docsummarizer.dto.job;

import com.eyelevel.docsummarizer.model.EntityType;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;

import java.util.Set;

public record JobOptionsView(SummaryMode summaryMode, LlmBackend llmBackend, boolean extractEntities,
                             boolean extractTables, Set<EntityType> entityTypes, int maxPages) {
}
