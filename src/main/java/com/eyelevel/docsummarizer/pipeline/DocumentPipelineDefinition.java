package com.eyelevel.docsummarizer.pipeline;

import com.eyelevel.docsummarizer.entity.EntityExtractionResult;
import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.extraction.ExtractedDocument;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobResult;
import com.eyelevel.docsummarizer.pipeline.stage.EntityExtractionStage;
import com.eyelevel.docsummarizer.pipeline.stage.StageNames;
import com.eyelevel.docsummarizer.pipeline.stage.SummarizationStage;
import com.eyelevel.docsummarizer.pipeline.stage.SummaryOutput;
import com.eyelevel.docsummarizer.pipeline.stage.TextExtractionStage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * extract, then extractEntities (when enabled), then summarize.
 */
@Component
@RequiredArgsConstructor
public class DocumentPipelineDefinition implements PipelineDefinition {

    private final TextExtractionStage textExtractionStage;
    private final EntityExtractionStage entityExtractionStage;
    private final SummarizationStage summarizationStage;

    @Override
    public List<PipelineStage<?>> stages(final JobConfig config) {
        final List<PipelineStage<?>> stages = new ArrayList<>();
        stages.add(textExtractionStage);
        if (config.isExtractEntities()) {
            stages.add(entityExtractionStage);
        }
        stages.add(summarizationStage);
        return List.copyOf(stages);
    }

    @Override
    public JobResult assembleResult(final Map<String, Object> outputs, final JobConfig config)
            throws StageExecutionException {
        final ExtractedDocument document = require(outputs, StageNames.EXTRACT, ExtractedDocument.class);
        final SummaryOutput summary = require(outputs, StageNames.SUMMARIZE, SummaryOutput.class);
        final EntityExtractionResult entities = outputs.get(StageNames.EXTRACT_ENTITIES) instanceof EntityExtractionResult result
                ? result
                : new EntityExtractionResult(List.of());

        return JobResult.builder()
                        .summary(summary.summaryText())
                        .entities(entities.entities())
                        .metadataEntry("model", summary.model())
                        .metadataEntry("backend", summary.backend().getValue())
                        .metadataEntry("summaryMode", config.getSummaryMode().getValue())
                        .metadataEntry("entityCount", entities.entities().size())
                        .metadataEntry("textLength", document.text().length())
                        .metadataEntry("pagesProcessed", document.pagesProcessed())
                        .metadataEntry("totalPages", document.pageCount())
                        .metadataEntry("tablesExtracted", document.tables().size())
                        .metadataEntry("document", document.metadata())
                        .build();
    }

    private static <T> T require(final Map<String, Object> outputs, final String stage, final Class<T> type)
            throws StageExecutionException {
        final Object output = outputs.get(stage);
        if (!type.isInstance(output)) {
            throw new StageExecutionException("Missing output of stage '" + stage + "'");
        }
        return type.cast(output);
    }
}
