package com.eyelevel.docsummarizer.pipeline.stage;

import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.exception.SummarizationException;
import com.eyelevel.docsummarizer.extraction.ExtractedDocument;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.pipeline.PipelineStage;
import com.eyelevel.docsummarizer.pipeline.StageContext;
import com.eyelevel.docsummarizer.summarization.SummarizationBackend;
import com.eyelevel.docsummarizer.summarization.SummarizationBackendFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SummarizationStage implements PipelineStage<SummaryOutput> {

    private final SummarizationBackendFactory backendFactory;

    @Override
    public String name() {
        return StageNames.SUMMARIZE;
    }

    @Override
    public String description() {
        return "Generating summary";
    }

    @Override
    public SummaryOutput execute(final StageContext context) throws StageExecutionException {
        final ExtractedDocument document = context.requireOutput(StageNames.EXTRACT, ExtractedDocument.class);
        final JobConfig config = context.getConfig();
        final SummarizationBackend backend = backendFactory.getBackend(config.getLlmBackend())
                .orElseThrow(() -> new StageExecutionException(
                        "Unknown summarization backend: " + config.getLlmBackend().getValue()));
        try {
            final String summary = backend.summarize(document.text(), config.getSummaryMode());
            log.info("[JobId: {}] {} produced a {} summary of {} characters.", context.getJobId(),
                     backend.modelName(), config.getSummaryMode(), summary.length());
            return new SummaryOutput(summary, backend.backend(), backend.modelName());
        } catch (SummarizationException e) {
            throw new StageExecutionException(e.getMessage(), e);
        }
    }
}
