package com.eyelevel.docsummarizer.controller;

import com.eyelevel.docsummarizer.dto.common.ApiResponse;
import com.eyelevel.docsummarizer.dto.job.DocumentUploadResponse;
import com.eyelevel.docsummarizer.dto.job.HealthResponse;
import com.eyelevel.docsummarizer.dto.job.JobStatisticsResponse;
import com.eyelevel.docsummarizer.dto.job.JobStatusResponse;
import com.eyelevel.docsummarizer.dto.job.JobSummaryResponse;
import com.eyelevel.docsummarizer.model.EntityType;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobStatus;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import com.eyelevel.docsummarizer.service.job.JobConfigResolver;
import com.eyelevel.docsummarizer.service.job.JobOrchestrationService;
import com.eyelevel.docsummarizer.service.job.JobStatusProjector;
import com.eyelevel.docsummarizer.service.storage.DocumentStorageService;
import com.eyelevel.docsummarizer.summarization.SummarizationBackend;
import com.eyelevel.docsummarizer.summarization.SummarizationBackendFactory;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Optional;

/**
 * REST controller for document upload, synchronous summarization and job lifecycle management.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class DocumentSummarizerController implements DocumentSummarizerApi {

    private final JobOrchestrationService jobOrchestrationService;
    private final DocumentStorageService documentStorageService;
    private final JobConfigResolver jobConfigResolver;
    private final SummarizationBackendFactory backendFactory;
    private final JobStatusProjector projector;

    // --- 1. DOCUMENT ENDPOINTS ---

    @Override
    @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<DocumentUploadResponse>> uploadDocument(
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "summaryMode", required = false) final SummaryMode summaryMode,
            @RequestParam(value = "llmBackend", required = false) final LlmBackend llmBackend,
            @RequestParam(value = "extractEntities", required = false) final Boolean extractEntities,
            @RequestParam(value = "extractTables", required = false) final Boolean extractTables,
            @RequestParam(value = "entityTypes", required = false) final List<EntityType> entityTypes,
            @RequestParam(value = "maxPages", required = false) final Integer maxPages) {

        log.info("Received upload '{}' ({} bytes), mode: {}, backend: {}, maxPages: {}", file.getOriginalFilename(),
                 file.getSize(), summaryMode, llmBackend, maxPages);

        final JobConfig config = jobConfigResolver.resolve(summaryMode, llmBackend, extractEntities, extractTables,
                                                           entityTypes, maxPages);
        final InputHandle input = documentStorageService.store(file);
        final String jobId;
        try {
            jobId = jobOrchestrationService.submit(input, config);
        } catch (RuntimeException e) {
            log.warn("Job creation failed for '{}', removing the stored upload.", input.getOriginalFilename());
            documentStorageService.discard(input);
            throw e;
        }

        final DocumentUploadResponse responseData = new DocumentUploadResponse(jobId, JobStatus.PENDING,
                input.getOriginalFilename(), input.getSizeBytes(), input.getPageCount(), projector.toOptions(config));
        final ApiResponse<DocumentUploadResponse> response = ApiResponse.<DocumentUploadResponse>builder()
                .response(responseData)
                .displayMessage("Document uploaded successfully. Start the job to begin processing.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping(value = "/documents/summarize-sync", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<JobStatusResponse>> summarizeSync(
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "summaryMode", required = false) final SummaryMode summaryMode,
            @RequestParam(value = "llmBackend", required = false) final LlmBackend llmBackend,
            @RequestParam(value = "extractEntities", required = false) final Boolean extractEntities,
            @RequestParam(value = "extractTables", required = false) final Boolean extractTables,
            @RequestParam(value = "entityTypes", required = false) final List<EntityType> entityTypes,
            @RequestParam(value = "maxPages", required = false) final Integer maxPages) {

        log.info("Received synchronous summarization request for '{}'", file.getOriginalFilename());

        final JobConfig config = jobConfigResolver.resolve(summaryMode, llmBackend, extractEntities, extractTables,
                                                           entityTypes, maxPages);
        final InputHandle input = documentStorageService.store(file);
        final JobStatusResponse responseData = jobOrchestrationService.runSynchronously(input, config);

        final ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(responseData)
                .displayMessage(responseData.status() == JobStatus.COMPLETED
                        ? "Document summarized successfully."
                        : "Document processing did not complete: " + responseData.message())
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    // --- 2. JOB LIFECYCLE ENDPOINTS ---

    @Override
    @PostMapping("/jobs/{jobId}/start")
    public ResponseEntity<ApiResponse<JobStatusResponse>> startJob(
            @PathVariable("jobId") @NotBlank(message = "Job id cannot be blank.") final String jobId) {
        final JobStatusResponse responseData = jobOrchestrationService.start(jobId);
        final ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(responseData)
                .displayMessage("Job accepted for processing.")
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @Override
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(@PathVariable("jobId") final String jobId) {
        final ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(jobOrchestrationService.status(jobId))
                .displayMessage("Job status retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/jobs")
    public ResponseEntity<ApiResponse<List<JobSummaryResponse>>> listJobs() {
        final List<JobSummaryResponse> jobs = jobOrchestrationService.listJobs();
        final ApiResponse<List<JobSummaryResponse>> response = ApiResponse.<List<JobSummaryResponse>>builder()
                .response(jobs)
                .displayMessage(String.format("Found %d job(s).", jobs.size()))
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<ApiResponse<JobStatusResponse>> cancelJob(@PathVariable("jobId") final String jobId) {
        log.info("[JobId: {}] Received cancellation request.", jobId);
        final ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(jobOrchestrationService.cancelJob(jobId))
                .displayMessage("Job cancelled.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<ApiResponse<Void>> deleteJob(@PathVariable("jobId") final String jobId) {
        log.info("[JobId: {}] Received delete request.", jobId);
        jobOrchestrationService.deleteJob(jobId);
        final ApiResponse<Void> response = ApiResponse.<Void>builder()
                .displayMessage("Job " + jobId + " deleted.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    // --- 3. MONITORING ENDPOINTS ---

    @Override
    @GetMapping("/jobs/statistics")
    public ResponseEntity<ApiResponse<JobStatisticsResponse>> getStatistics() {
        final ApiResponse<JobStatisticsResponse> response = ApiResponse.<JobStatisticsResponse>builder()
                .response(jobOrchestrationService.statistics())
                .displayMessage("Job statistics retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthResponse>> health() {
        final HealthResponse health = new HealthResponse("healthy",
                backendFactory.availableBackends().stream()
                              .map(backendFactory::getBackend)
                              .flatMap(Optional::stream)
                              .map(SummarizationBackend::modelInfo)
                              .toList(),
                jobOrchestrationService.statistics().totalJobs());
        final ApiResponse<HealthResponse> response = ApiResponse.<HealthResponse>builder()
                .response(health)
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }
}
