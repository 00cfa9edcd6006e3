package com.eyelevel.docsummarizer.extraction;

import java.util.List;
import java.util.Map;

/**
 * Text pulled from the first pages of a PDF.
 *
 * @param text           Page texts, each preceded by a {@code === Page n ===} marker line.
 * @param pageCount      Total number of pages in the document.
 * @param pagesProcessed Number of pages whose text was extracted.
 * @param metadata       Document information entries that were present (title, author, subject,
 *                       creator, producer, creationDate).
 * @param tables         Tables found on the processed pages; empty when table extraction was off or failed.
 */
public record ExtractedDocument(String text, int pageCount, int pagesProcessed, Map<String, String> metadata,
                                List<ExtractedTable> tables) {

    public ExtractedDocument(final String text, final int pageCount, final int pagesProcessed,
                             final Map<String, String> metadata) {
        this(text, pageCount, pagesProcessed, metadata, List.of());
    }

    public ExtractedDocument withTables(final List<ExtractedTable> extractedTables) {
        return new ExtractedDocument(text, pageCount, pagesProcessed, metadata, List.copyOf(extractedTables));
    }
}
