package com.eyelevel.docsummarizer.service.job;

import com.eyelevel.docsummarizer.dto.job.JobStatusResponse;
import com.eyelevel.docsummarizer.dto.job.JobSummaryResponse;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobError;
import com.eyelevel.docsummarizer.model.JobResult;
import com.eyelevel.docsummarizer.model.JobStatus;
import com.eyelevel.docsummarizer.model.SummaryMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusProjectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final JobStatusProjector projector = new JobStatusProjector();

    private Job pending() {
        return Job.pending("job_abc", 1, JobConfig.builder().summaryMode(SummaryMode.DETAILED).build(),
                           InputHandle.builder().location("/tmp/x.pdf").originalFilename("x.pdf").sizeBytes(42)
                                      .pageCount(7).build(),
                           T0);
    }

    @Test
    @DisplayName("A PENDING job shows its options but no stages, result or error")
    void pendingView() {
        final JobStatusResponse view = projector.toStatus(pending());

        assertThat(view.jobId()).isEqualTo("job_abc");
        assertThat(view.status()).isEqualTo(JobStatus.PENDING);
        assertThat(view.documentName()).isEqualTo("x.pdf");
        assertThat(view.totalPages()).isEqualTo(7);
        assertThat(view.options().summaryMode()).isEqualTo(SummaryMode.DETAILED);
        assertThat(view.stages()).isNull();
        assertThat(view.result()).isNull();
        assertThat(view.error()).isNull();
        assertThat(view.processingTimeSeconds()).isNull();
    }

    @Test
    @DisplayName("A completed job exposes its result and processing time")
    void completedView() {
        final Job completed = pending().startRun(List.of("extract"), T0.plusSeconds(1))
                                       .withStageStarted("extract", "Extracting", T0.plusSeconds(1))
                                       .withStageCompleted("extract", "text", T0.plusSeconds(2))
                                       .complete(JobResult.builder().summary("done").build(), T0.plusMillis(3500));

        final JobStatusResponse view = projector.toStatus(completed);

        assertThat(view.progress()).isEqualTo(100);
        assertThat(view.result().getSummary()).isEqualTo("done");
        assertThat(view.error()).isNull();
        assertThat(view.stages()).hasSize(1);
        assertThat(view.processingTimeSeconds()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("A failed job exposes its error and hides any result")
    void failedView() {
        final Job failed = pending().startRun(List.of("extract"), T0)
                                    .fail(new JobError("extract", "Failed to extract PDF: bad"), T0.plusSeconds(1));

        final JobStatusResponse view = projector.toStatus(failed);

        assertThat(view.error().stage()).isEqualTo("extract");
        assertThat(view.result()).isNull();
        assertThat(view.message()).isEqualTo("Processing failed at stage 'extract'");
    }

    @Test
    @DisplayName("Listing entries carry the document name and progress")
    void summaryView() {
        final JobSummaryResponse summary = projector.toSummary(pending());

        assertThat(summary.jobId()).isEqualTo("job_abc");
        assertThat(summary.documentName()).isEqualTo("x.pdf");
        assertThat(summary.progress()).isZero();
    }
}
