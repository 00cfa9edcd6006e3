package com.eyelevel.docsummarizer.service.storage;

import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.DocumentValidationException;
import com.eyelevel.docsummarizer.extraction.PdfTextExtractor;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.support.TestPdfs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentStorageServiceTest {

    @TempDir
    Path uploadDir;

    private DocumentStorageService storageService;

    @BeforeEach
    void setUp() {
        final SummarizerProperties properties = new SummarizerProperties();
        properties.getStorage().setUploadDir(uploadDir.toString());
        properties.getStorage().setMaxFileSizeBytes(64 * 1024);
        storageService = new DocumentStorageService(properties, new PdfTextExtractor());
    }

    private static MockMultipartFile upload(final String name, final byte[] content) {
        return new MockMultipartFile("file", name, MediaType.APPLICATION_PDF_VALUE, content);
    }

    @Test
    @DisplayName("A valid PDF is stored under a unique name and its pages are counted")
    void storesPdf() throws Exception {
        // given
        final byte[] pdf = TestPdfs.create("Report", "Page one.", "Page two.");

        // when
        final InputHandle handle = storageService.store(upload("my report.pdf", pdf));

        // then
        final Path stored = Path.of(handle.getLocation());
        assertThat(stored).exists();
        assertThat(stored.getParent()).isEqualTo(uploadDir.toAbsolutePath());
        assertThat(stored.getFileName().toString()).endsWith("_my_report.pdf");
        assertThat(handle.getOriginalFilename()).isEqualTo("my report.pdf");
        assertThat(handle.getSizeBytes()).isEqualTo(pdf.length);
        assertThat(handle.getPageCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Discarding removes the stored file and tolerates repeats")
    void discard() throws Exception {
        final InputHandle handle = storageService.store(upload("a.pdf", TestPdfs.create("A", "Text.")));

        storageService.discard(handle);
        storageService.discard(handle);
        storageService.discard(null);

        assertThat(Path.of(handle.getLocation())).doesNotExist();
    }

    @Test
    @DisplayName("Empty uploads are rejected")
    void emptyUpload() {
        assertThatThrownBy(() -> storageService.store(upload("a.pdf", new byte[0])))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("Uploaded file is empty");
    }

    @Test
    @DisplayName("Only .pdf files are accepted")
    void wrongExtension() {
        assertThatThrownBy(() -> storageService.store(upload("notes.txt", "hello".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("Only PDF files are supported");
    }

    @Test
    @DisplayName("Files above the size limit are rejected")
    void tooLarge() {
        assertThatThrownBy(() -> storageService.store(upload("big.pdf", new byte[64 * 1024 + 1])))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessageContaining("above the 65536 byte limit");
    }

    @Test
    @DisplayName("Unreadable PDFs are rejected and not kept on disk")
    void unreadablePdf() throws Exception {
        assertThatThrownBy(() -> storageService.store(upload("fake.pdf",
                                                             "not really a pdf".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(DocumentValidationException.class)
                .hasMessage("Invalid or unreadable PDF file: fake.pdf");
        try (Stream<Path> files = Files.list(uploadDir)) {
            assertThat(files).isEmpty();
        }
    }
}
