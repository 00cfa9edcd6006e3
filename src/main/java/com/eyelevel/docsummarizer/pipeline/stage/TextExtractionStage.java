package com.eyelevel.docsummarizer.pipeline.stage;

import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.extraction.ExtractedDocument;
import com.eyelevel.docsummarizer.extraction.ExtractedTable;
import com.eyelevel.docsummarizer.extraction.PdfTableExtractor;
import com.eyelevel.docsummarizer.extraction.PdfTextExtractor;
import com.eyelevel.docsummarizer.pipeline.PipelineStage;
import com.eyelevel.docsummarizer.pipeline.StageContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Pulls text, and tables when the job asks for them, from the first {@code maxPages} pages of the job's
 * PDF. The page limit is clamped to the configured maximum here, so jobs created by any caller obey it.
 * A table extraction failure is logged and leaves the document without tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextExtractionStage implements PipelineStage<ExtractedDocument> {

    private final PdfTextExtractor pdfTextExtractor;
    private final PdfTableExtractor pdfTableExtractor;
    private final SummarizerProperties properties;

    @Override
    public String name() {
        return StageNames.EXTRACT;
    }

    @Override
    public String description() {
        return "Extracting text from PDF";
    }

    @Override
    public ExtractedDocument execute(final StageContext context) throws StageExecutionException {
        if (context.getInput() == null || context.getInput().getLocation() == null) {
            throw new StageExecutionException("Job has no input document");
        }
        final int maxPages = Math.max(1, Math.min(context.getConfig().getMaxPages(), properties.getMaxPagesLimit()));
        final Path pdfPath = Path.of(context.getInput().getLocation());
        final ExtractedDocument text;
        try {
            text = pdfTextExtractor.extract(pdfPath, maxPages);
        } catch (IOException e) {
            throw new StageExecutionException("Failed to extract PDF: " + e.getMessage(), e);
        }
        if (text.text().replaceAll("=== Page \\d+ ===", "").isBlank()) {
            throw new StageExecutionException("No extractable text found in the first " + maxPages + " page(s)");
        }
        final ExtractedDocument document = context.getConfig().isExtractTables()
                ? text.withTables(extractTables(context.getJobId(), pdfPath, maxPages))
                : text;
        log.info("[JobId: {}] Extracted {} characters and {} table(s) from {} of {} pages.", context.getJobId(),
                 document.text().length(), document.tables().size(), document.pagesProcessed(),
                 document.pageCount());
        return document;
    }

    private List<ExtractedTable> extractTables(final String jobId, final Path pdfPath, final int maxPages) {
        try {
            return pdfTableExtractor.extract(pdfPath, maxPages);
        } catch (IOException | RuntimeException e) {
            log.warn("[JobId: {}] Table extraction failed, continuing without tables: {}", jobId, e.getMessage());
            return List.of();
        }
    }
}
