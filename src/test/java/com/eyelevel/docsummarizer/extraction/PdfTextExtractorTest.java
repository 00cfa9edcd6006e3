package com.eyelevel.docsummarizer.extraction;

import com.eyelevel.docsummarizer.support.TestPdfs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfTextExtractorTest {

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Only the first maxPages pages are extracted, each behind a page marker")
    void extractsLimitedPages() throws IOException {
        // given
        final Path pdf = TestPdfs.write(tempDir.resolve("report.pdf"), "Quarterly Report",
                                        "Revenue grew strongly.", "Costs were stable.", "Appendix text.");

        // when
        final ExtractedDocument document = extractor.extract(pdf, 2);

        // then
        assertThat(document.pageCount()).isEqualTo(3);
        assertThat(document.pagesProcessed()).isEqualTo(2);
        assertThat(document.text()).startsWith("=== Page 1 ===\n")
                                   .contains("Revenue grew strongly.", "=== Page 2 ===", "Costs were stable.")
                                   .doesNotContain("Appendix text.");
        assertThat(document.metadata()).containsEntry("title", "Quarterly Report")
                                       .containsEntry("author", "Test Author");
    }

    @Test
    @DisplayName("A page limit above the page count reads the whole document")
    void limitAbovePageCount() throws IOException {
        final Path pdf = TestPdfs.write(tempDir.resolve("short.pdf"), "Short", "Only page.");

        final ExtractedDocument document = extractor.extract(pdf, 10);

        assertThat(document.pagesProcessed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Missing and corrupt files are reported as IO failures")
    void unreadableFiles() throws IOException {
        final Path corrupt = Files.writeString(tempDir.resolve("corrupt.pdf"), "this is not a pdf");

        assertThatThrownBy(() -> extractor.extract(tempDir.resolve("missing.pdf"), 1))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("PDF file not found");
        assertThatThrownBy(() -> extractor.extract(corrupt, 1)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> extractor.countPages(corrupt.toFile())).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Pages are counted without extracting text")
    void countPages() throws IOException {
        final Path pdf = TestPdfs.write(tempDir.resolve("three.pdf"), "Three", "a", "b", "c");

        assertThat(extractor.countPages(pdf.toFile())).isEqualTo(3);
    }
}
