package com.eyelevel.docsummarizer.service.job;

import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.DocumentValidationException;
import com.eyelevel.docsummarizer.model.EntityType;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import com.eyelevel.docsummarizer.summarization.SummarizationBackendFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * Turns optional client options into a complete {@link JobConfig}, filling gaps from configuration.
 */
@Component
@RequiredArgsConstructor
public class JobConfigResolver {

    private final SummarizerProperties properties;
    private final SummarizationBackendFactory backendFactory;

    /**
     * @throws DocumentValidationException if {@code maxPages} is out of range or the backend is not available.
     */
    public JobConfig resolve(final SummaryMode summaryMode, final LlmBackend llmBackend, final Boolean extractEntities,
                             final Boolean extractTables, final Collection<EntityType> entityTypes,
                             final Integer maxPages) {
        final int pages = Optional.ofNullable(maxPages).orElse(properties.getDefaultMaxPages());
        if (pages < 1 || pages > properties.getMaxPagesLimit()) {
            throw new DocumentValidationException(
                    String.format("maxPages must be between 1 and %d", properties.getMaxPagesLimit()));
        }
        final LlmBackend backend = Optional.ofNullable(llmBackend).orElse(properties.getDefaultLlmBackend());
        if (backendFactory.getBackend(backend).isEmpty()) {
            throw new DocumentValidationException("Summarization backend not available: " + backend.getValue());
        }

        final JobConfig.JobConfigBuilder builder = JobConfig.builder()
                .summaryMode(Optional.ofNullable(summaryMode).orElse(properties.getDefaultSummaryMode()))
                .llmBackend(backend)
                .extractEntities(Optional.ofNullable(extractEntities).orElse(properties.isEntityExtractionEnabled()))
                .extractTables(Optional.ofNullable(extractTables).orElse(properties.isTableExtractionEnabled()))
                .maxPages(pages);
        if (entityTypes != null) {
            builder.entityTypes(entityTypes);
        }
        return builder.build();
    }
}
