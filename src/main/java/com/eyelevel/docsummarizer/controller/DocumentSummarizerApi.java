package com.eyelevel.docsummarizer.controller;

import com.eyelevel.docsummarizer.dto.common.ApiResponse;
import com.eyelevel.docsummarizer.dto.job.DocumentUploadResponse;
import com.eyelevel.docsummarizer.dto.job.HealthResponse;
import com.eyelevel.docsummarizer.dto.job.JobStatisticsResponse;
import com.eyelevel.docsummarizer.dto.job.JobStatusResponse;
import com.eyelevel.docsummarizer.dto.job.JobSummaryResponse;
import com.eyelevel.docsummarizer.model.EntityType;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Document Summarization", description = "Upload PDFs, run the summarization pipeline and track job progress.")
public interface DocumentSummarizerApi {

    @Operation(summary = "Upload Document",
            description = "Validates and stores a PDF and creates a PENDING job with the given options. Processing starts with the start endpoint.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Document stored and job created.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Document uploaded successfully. Start the job to begin processing.",
                                        "response": {
                                            "jobId": "job_3f9a1c2b7d4e",
                                            "status": "PENDING",
                                            "documentName": "invoice.pdf",
                                            "sizeBytes": 48213,
                                            "totalPages": 4,
                                            "options": {
                                                "summaryMode": "brief",
                                                "llmBackend": "local",
                                                "extractEntities": true,
                                                "extractTables": true,
                                                "entityTypes": [],
                                                "maxPages": 3
                                            }
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Not a PDF, unreadable, too large or invalid options.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentUploadResponse>> uploadDocument(
            @Parameter(description = "The PDF document.", required = true) MultipartFile file,
            @Parameter(description = "Summary style: brief, detailed or bullets.", example = "brief") SummaryMode summaryMode,
            @Parameter(description = "Summarization backend: openai, hf or local.", example = "local") LlmBackend llmBackend,
            @Parameter(description = "Whether to run entity extraction.") Boolean extractEntities,
            @Parameter(description = "Whether to detect tables in the processed pages.") Boolean extractTables,
            @Parameter(description = "Entity types to extract; all when omitted.") List<EntityType> entityTypes,
            @Parameter(description = "Number of pages to process, from 1 to the configured limit.", example = "3") Integer maxPages);

    @Operation(summary = "Summarize Synchronously",
            description = "Uploads a PDF and runs the full pipeline before responding. The response is the terminal job record; a failed pipeline is reported in the record, not as an HTTP error.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Pipeline finished; see status for the outcome.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid document or options.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> summarizeSync(
            @Parameter(description = "The PDF document.", required = true) MultipartFile file,
            @Parameter(description = "Summary style: brief, detailed or bullets.") SummaryMode summaryMode,
            @Parameter(description = "Summarization backend: openai, hf or local.") LlmBackend llmBackend,
            @Parameter(description = "Whether to run entity extraction.") Boolean extractEntities,
            @Parameter(description = "Whether to detect tables in the processed pages.") Boolean extractTables,
            @Parameter(description = "Entity types to extract; all when omitted.") List<EntityType> entityTypes,
            @Parameter(description = "Number of pages to process.") Integer maxPages);

    @Operation(summary = "Start Job", description = "Starts a PENDING job on the background worker pool and returns immediately.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job accepted for processing.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job is running or already finished.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service Unavailable - Worker pool is saturated.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> startJob(
            @Parameter(description = "The job id.", required = true, example = "job_3f9a1c2b7d4e") String jobId);

    @Operation(summary = "Get Job Status", description = "Returns status, progress, stage checkpoints and, once finished, the result or error of a job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Failed job", value = """
                                    {
                                        "displayMessage": "Job status retrieved successfully.",
                                        "response": {
                                            "jobId": "job_3f9a1c2b7d4e",
                                            "status": "FAILED",
                                            "message": "Processing failed at stage 'extractEntities'",
                                            "progress": 33,
                                            "stages": [
                                                {"stage": "extract", "outcome": "SUCCEEDED"},
                                                {"stage": "extractEntities", "outcome": "FAILED"}
                                            ],
                                            "error": {"stage": "extractEntities", "message": "bad-encoding"}
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @Parameter(description = "The job id.", required = true) String jobId);

    @Operation(summary = "List Jobs", description = "Lists all jobs, most recently created first.")
    ResponseEntity<ApiResponse<List<JobSummaryResponse>>> listJobs();

    @Operation(summary = "Cancel Job", description = "Cancels a PENDING or RUNNING job. A running pipeline stops before its next stage.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job cancelled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job already finished.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> cancelJob(
            @Parameter(description = "The job id.", required = true) String jobId);

    @Operation(summary = "Delete Job", description = "Deletes a job and its stored document. Running jobs must be cancelled first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job deleted.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The job is running.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> deleteJob(
            @Parameter(description = "The job id.", required = true) String jobId);

    @Operation(summary = "Job Statistics", description = "Counts jobs in total and per status.")
    ResponseEntity<ApiResponse<JobStatisticsResponse>> getStatistics();

    @Operation(summary = "Health", description = "Reports service status and the configured summarization backends.")
    ResponseEntity<ApiResponse<HealthResponse>> health();
}
