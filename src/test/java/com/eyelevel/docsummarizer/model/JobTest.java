package com.eyelevel.docsummarizer.model;

import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private Job runningJob() {
        return Job.pending("job_1", 1, JobConfig.builder().build(), null, T0)
                  .startRun(List.of("extract", "extractEntities", "summarize"), T0.plusSeconds(1));
    }

    @Test
    @DisplayName("A new job is PENDING with no progress")
    void pendingJob() {
        final Job job = Job.pending("job_1", 1, JobConfig.builder().build(), null, T0);

        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getCreatedAt()).isEqualTo(T0);
        assertThat(job.getProgress()).isEmpty();
        assertThat(job.getPartialResults()).isEmpty();
        assertThat(job.progressPercent()).isZero();
        assertThat(job.processingTime()).isEmpty();
    }

    @Test
    @DisplayName("Completed stages are recorded in order and drive the progress percentage")
    void stageProgress() {
        // given
        Job job = runningJob();

        // when
        job = job.withStageStarted("extract", "Extracting text from PDF", T0.plusSeconds(2));
        job = job.withStageCompleted("extract", "text", T0.plusSeconds(3));
        job = job.withStageStarted("extractEntities", "Extracting entities", T0.plusSeconds(3));

        // then
        assertThat(job.getMessage()).isEqualTo("Extracting entities");
        assertThat(job.getProgress()).extracting(StageCheckpoint::getStageName)
                                     .containsExactly("extract", "extractEntities");
        assertThat(job.getProgress().get(0).getOutcome()).isEqualTo(StageOutcome.SUCCEEDED);
        assertThat(job.getProgress().get(1).isFinished()).isFalse();
        assertThat(job.getPartialResults()).containsOnlyKeys("extract");
        assertThat(job.progressPercent()).isEqualTo(33);
    }

    @Test
    @DisplayName("A stage output can be written only once")
    void stageOutputIsWriteOnce() {
        final Job job = runningJob().withStageStarted("extract", "x", T0)
                                    .withStageCompleted("extract", "first", T0);

        assertThatThrownBy(() -> job.withStageCompleted("extract", "second", T0))
                .isInstanceOf(JobStateConflictException.class);
        assertThat(job.getPartialResults().get("extract")).isEqualTo("first");
    }

    @Test
    @DisplayName("Failing closes the open checkpoint as FAILED and names the stage")
    void failClosesCheckpoint() {
        final Job failed = runningJob().withStageStarted("extract", "x", T0.plusSeconds(2))
                                       .fail(new JobError("extract", "Failed to extract PDF: broken"),
                                             T0.plusSeconds(5));

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getError().stage()).isEqualTo("extract");
        assertThat(failed.getMessage()).isEqualTo("Processing failed at stage 'extract'");
        assertThat(failed.getProgress().get(0).getOutcome()).isEqualTo(StageOutcome.FAILED);
        assertThat(failed.processingTime()).contains(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Cancelling closes unfinished checkpoints and keeps finished ones")
    void cancelClosesOpenCheckpoints() {
        final Job cancelled = runningJob().withStageStarted("extract", "x", T0)
                                          .withStageCompleted("extract", "text", T0)
                                          .withStageStarted("summarize", "y", T0)
                                          .cancel(T0.plusSeconds(9));

        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.getProgress()).extracting(StageCheckpoint::getOutcome)
                                           .containsExactly(StageOutcome.SUCCEEDED, StageOutcome.CANCELLED);
        assertThat(cancelled.getFinishedAt()).isEqualTo(T0.plusSeconds(9));
    }

    @Test
    @DisplayName("A completed job always reports 100 percent")
    void completedReportsFullProgress() {
        final Job completed = runningJob().complete(JobResult.builder().summary("s").build(), T0.plusSeconds(4));

        assertThat(completed.progressPercent()).isEqualTo(100);
        assertThat(completed.getResult().getSummary()).isEqualTo("s");
    }
}
