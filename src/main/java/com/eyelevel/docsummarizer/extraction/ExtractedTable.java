package com.eyelevel.docsummarizer.extraction;

import java.util.List;

/**
 * A table found on one page.
 *
 * @param page        1-based page number.
 * @param tableIndex  0-based position of the table on its page, top to bottom.
 * @param data        Cell texts, row by row. Every row has {@code columnCount} cells.
 * @param rowCount    Number of rows.
 * @param columnCount Number of columns.
 */
public record ExtractedTable(int page, int tableIndex, List<List<String>> data, int rowCount, int columnCount) {

    public static ExtractedTable of(final int page, final int tableIndex, final List<List<String>> rows) {
        final List<List<String>> data = rows.stream().map(List::copyOf).toList();
        return new ExtractedTable(page, tableIndex, data, data.size(), data.isEmpty() ? 0 : data.get(0).size());
    }
}
