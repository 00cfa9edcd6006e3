package com.eyelevel.docsummarizer.extraction;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts plain text and document information from a PDF using Apache PDFBox.
 */
@Slf4j
@Component
public class PdfTextExtractor {

    static final String PAGE_MARKER_FORMAT = "=== Page %d ===";

    /**
     * Reads the text of at most {@code maxPages} pages.
     *
     * @param pdfPath  The PDF on local disk.
     * @param maxPages The page limit, at least 1.
     * @return The extracted text and metadata.
     * @throws IOException if the file is missing, encrypted or not a readable PDF.
     */
    public ExtractedDocument extract(final Path pdfPath, final int maxPages) throws IOException {
        if (!Files.isRegularFile(pdfPath)) {
            throw new IOException("PDF file not found: " + pdfPath);
        }
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            final int totalPages = document.getNumberOfPages();
            final int pagesToProcess = Math.min(totalPages, Math.max(1, maxPages));
            log.debug("Extracting {} of {} pages from {}", pagesToProcess, totalPages, pdfPath.getFileName());

            final PDFTextStripper stripper = new PDFTextStripper();
            final StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pagesToProcess; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                if (page > 1) {
                    text.append('\n');
                }
                text.append(String.format(PAGE_MARKER_FORMAT, page)).append('\n').append(stripper.getText(document));
            }
            return new ExtractedDocument(text.toString(), totalPages, pagesToProcess, readMetadata(document));
        }
    }

    /**
     * Counts pages without extracting any text.
     *
     * @throws IOException if the file is not a readable PDF.
     */
    public int countPages(final File pdfFile) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            return document.getNumberOfPages();
        }
    }

    private Map<String, String> readMetadata(final PDDocument document) {
        final PDDocumentInformation info = document.getDocumentInformation();
        final Map<String, String> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "title", info.getTitle());
        putIfPresent(metadata, "author", info.getAuthor());
        putIfPresent(metadata, "subject", info.getSubject());
        putIfPresent(metadata, "creator", info.getCreator());
        putIfPresent(metadata, "producer", info.getProducer());
        final Calendar created = info.getCreationDate();
        if (created != null) {
            metadata.put("creationDate", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                    created.toInstant().atZone(created.getTimeZone().toZoneId())));
        }
        return Collections.unmodifiableMap(metadata);
    }

    private static void putIfPresent(final Map<String, String> metadata, final String key, final String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value.trim());
        }
    }
}
