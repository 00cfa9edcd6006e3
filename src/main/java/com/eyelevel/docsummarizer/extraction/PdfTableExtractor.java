package com.eyelevel.docsummarizer.extraction;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Detects text tables from glyph positions reported by PDFBox. Glyphs sharing a baseline form a line,
 * and a horizontal gap wider than {@value #COLUMN_GAP_FACTOR} average glyph widths splits a line into
 * cells. Two or more consecutive lines with the same number of cells (at least two) make a table.
 * Ruling lines are not inspected, so borderless tables are found as well.
 */
@Slf4j
@Component
public class PdfTableExtractor {

    static final float COLUMN_GAP_FACTOR = 2.0f;
    private static final float WORD_GAP_FACTOR = 0.3f;
    private static final float BASELINE_TOLERANCE = 2.0f;
    private static final int MIN_ROWS = 2;
    private static final int MIN_COLUMNS = 2;

    /**
     * Finds the tables on the first {@code maxPages} pages.
     *
     * @throws IOException if the file is missing or not a readable PDF.
     */
    public List<ExtractedTable> extract(final Path pdfPath, final int maxPages) throws IOException {
        if (!Files.isRegularFile(pdfPath)) {
            throw new IOException("PDF file not found: " + pdfPath);
        }
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            final int pagesToProcess = Math.min(document.getNumberOfPages(), Math.max(1, maxPages));
            final List<ExtractedTable> tables = new ArrayList<>();
            for (int page = 1; page <= pagesToProcess; page++) {
                final List<List<List<String>>> pageTables = findTables(readLines(document, page));
                for (int index = 0; index < pageTables.size(); index++) {
                    tables.add(ExtractedTable.of(page, index, pageTables.get(index)));
                }
            }
            log.debug("Found {} table(s) in {} page(s) of {}", tables.size(), pagesToProcess, pdfPath.getFileName());
            return tables;
        }
    }

    private List<List<String>> readLines(final PDDocument document, final int page) throws IOException {
        final GlyphCollector collector = new GlyphCollector();
        collector.setSortByPosition(true);
        collector.setStartPage(page);
        collector.setEndPage(page);
        collector.writeText(document, new StringWriter());

        final List<TextPosition> glyphs = collector.glyphs;
        glyphs.sort(Comparator.comparingDouble(TextPosition::getYDirAdj).thenComparingDouble(TextPosition::getXDirAdj));
        final List<List<String>> lines = new ArrayList<>();
        List<TextPosition> line = new ArrayList<>();
        for (final TextPosition glyph : glyphs) {
            if (!line.isEmpty() && Math.abs(glyph.getYDirAdj() - line.get(0).getYDirAdj()) > BASELINE_TOLERANCE) {
                lines.add(toCells(line));
                line = new ArrayList<>();
            }
            line.add(glyph);
        }
        if (!line.isEmpty()) {
            lines.add(toCells(line));
        }
        return lines;
    }

    static List<String> toCells(final List<TextPosition> line) {
        line.sort(Comparator.comparingDouble(TextPosition::getXDirAdj));
        final double averageWidth = line.stream().mapToDouble(TextPosition::getWidthDirAdj).average().orElse(0);
        final List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        TextPosition previous = null;
        for (final TextPosition glyph : line) {
            if (previous != null) {
                final double gap = glyph.getXDirAdj() - (previous.getXDirAdj() + previous.getWidthDirAdj());
                if (gap > COLUMN_GAP_FACTOR * averageWidth) {
                    cells.add(cell.toString());
                    cell = new StringBuilder();
                } else if (gap > WORD_GAP_FACTOR * averageWidth) {
                    cell.append(' ');
                }
            }
            cell.append(glyph.getUnicode());
            previous = glyph;
        }
        cells.add(cell.toString());
        return cells;
    }

    static List<List<List<String>>> findTables(final List<List<String>> lines) {
        final List<List<List<String>>> tables = new ArrayList<>();
        List<List<String>> current = new ArrayList<>();
        for (final List<String> line : lines) {
            final boolean continues = line.size() >= MIN_COLUMNS
                                      && (current.isEmpty() || current.get(0).size() == line.size());
            if (!continues) {
                closeTable(tables, current);
                current = new ArrayList<>();
            }
            if (line.size() >= MIN_COLUMNS) {
                current.add(line);
            }
        }
        closeTable(tables, current);
        return tables;
    }

    private static void closeTable(final List<List<List<String>>> tables, final List<List<String>> rows) {
        if (rows.size() >= MIN_ROWS) {
            tables.add(rows);
        }
    }

    /**
     * Keeps every visible glyph of the page instead of writing text.
     */
    private static final class GlyphCollector extends PDFTextStripper {
        private final List<TextPosition> glyphs = new ArrayList<>();

        private GlyphCollector() throws IOException {
            super();
        }

        @Override
        protected void writeString(final String text, final List<TextPosition> textPositions) {
            for (final TextPosition position : textPositions) {
                if (position.getUnicode() != null && !position.getUnicode().isBlank()) {
                    glyphs.add(position);
                }
            }
        }
    }
}
