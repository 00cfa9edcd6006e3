package com.eyelevel.docsummarizer.pipeline.stage;

import com.eyelevel.docsummarizer.entity.EntityExtractionResult;
import com.eyelevel.docsummarizer.entity.EntityExtractor;
import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.extraction.ExtractedDocument;
import com.eyelevel.docsummarizer.pipeline.PipelineStage;
import com.eyelevel.docsummarizer.pipeline.StageContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EntityExtractionStage implements PipelineStage<EntityExtractionResult> {

    private final EntityExtractor entityExtractor;

    @Override
    public String name() {
        return StageNames.EXTRACT_ENTITIES;
    }

    @Override
    public String description() {
        return "Extracting entities";
    }

    @Override
    public EntityExtractionResult execute(final StageContext context) throws StageExecutionException {
        final ExtractedDocument document = context.requireOutput(StageNames.EXTRACT, ExtractedDocument.class);
        return entityExtractor.extract(document.text(), context.getConfig().getEntityTypes());
    }
}
