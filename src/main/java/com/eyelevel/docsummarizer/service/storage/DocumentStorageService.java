package com.eyelevel.docsummarizer.service.storage;

import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.DocumentProcessingException;
import com.eyelevel.docsummarizer.exception.DocumentValidationException;
import com.eyelevel.docsummarizer.extraction.PdfTextExtractor;
import com.eyelevel.docsummarizer.model.InputHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Accepts uploaded PDFs into the local upload directory and hands out the {@link InputHandle} a job
 * refers to. Documents are checked before a job exists: extension, size and that PDFBox can open them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentStorageService {

    private static final String PDF_EXTENSION = "pdf";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SummarizerProperties properties;
    private final PdfTextExtractor pdfTextExtractor;

    /**
     * Validates and saves an uploaded PDF.
     *
     * @param file The multipart upload.
     * @return A handle to the stored document.
     * @throws DocumentValidationException if the upload is not an acceptable PDF.
     */
    public InputHandle store(final MultipartFile file) {
        final String originalFilename = FilenameUtils.getName(file.getOriginalFilename());
        validateUpload(file, originalFilename);

        final Path target = resolveTarget(originalFilename);
        try (InputStream inputStream = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new DocumentProcessingException("Failed to store uploaded file '" + originalFilename + "'", e);
        }

        final int pageCount;
        try {
            pageCount = pdfTextExtractor.countPages(target.toFile());
        } catch (IOException e) {
            discard(target);
            log.warn("Rejected unreadable PDF '{}': {}", originalFilename, e.getMessage());
            throw new DocumentValidationException("Invalid or unreadable PDF file: " + originalFilename);
        }

        log.info("Stored '{}' ({} bytes, {} pages) at {}", originalFilename, file.getSize(), pageCount, target);
        return InputHandle.builder()
                          .location(target.toAbsolutePath().toString())
                          .originalFilename(originalFilename)
                          .sizeBytes(file.getSize())
                          .pageCount(pageCount)
                          .build();
    }

    /**
     * Removes the stored document behind a handle, if it still exists.
     */
    public void discard(final InputHandle input) {
        if (input != null && input.getLocation() != null) {
            discard(Path.of(input.getLocation()));
        }
    }

    private void discard(final Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted stored document {}", path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete stored document {}: {}", path, e.getMessage());
        }
    }

    private void validateUpload(final MultipartFile file, final String originalFilename) {
        if (file.isEmpty() || originalFilename == null || originalFilename.isBlank()) {
            throw new DocumentValidationException("Uploaded file is empty");
        }
        if (!PDF_EXTENSION.equalsIgnoreCase(FilenameUtils.getExtension(originalFilename))) {
            throw new DocumentValidationException("Only PDF files are supported");
        }
        final long maxSize = properties.getStorage().getMaxFileSizeBytes();
        if (file.getSize() > maxSize) {
            throw new DocumentValidationException(
                    String.format("File '%s' is %d bytes, above the %d byte limit", originalFilename, file.getSize(),
                                  maxSize));
        }
    }

    private Path resolveTarget(final String originalFilename) {
        final String safeName = originalFilename.replaceAll("[^A-Za-z0-9._-]", "_");
        final String storedName = TIMESTAMP.format(LocalDateTime.now()) + "_"
                                  + UUID.randomUUID().toString().substring(0, 8) + "_" + safeName;
        return Path.of(properties.getStorage().getUploadDir()).resolve(storedName);
    }
}
