package com.eyelevel.docsummarizer.model;

import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a summarization job. Every change produces a new snapshot through one of
 * the {@code with*}/terminal methods, which the job store applies atomically. Readers therefore
 * always see a fully-applied record.
 */
@Value
@Builder(toBuilder = true)
public class Job {

    String id;
    /**
     * Creation order assigned by the store; breaks ties between jobs created in the same instant.
     */
    long sequence;
    JobStatus status;
    Instant createdAt;
    Instant updatedAt;
    Instant startedAt;
    Instant finishedAt;
    String message;

    @Builder.Default
    List<String> plannedStages = List.of();

    @Builder.Default
    List<StageCheckpoint> progress = List.of();

    InputHandle input;

    /**
     * Stage name to stage output, in completion order. Entries are never replaced or removed.
     */
    @Builder.Default
    Map<String, Object> partialResults = Map.of();

    JobResult result;
    JobError error;
    JobConfig config;

    public static Job pending(final String id, final long sequence, final JobConfig config, final InputHandle input,
                              final Instant now) {
        return Job.builder()
                .id(id)
                .sequence(sequence)
                .status(JobStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .message("Job created, waiting to start")
                .config(config)
                .input(input)
                .build();
    }

    public Job startRun(final List<String> stages, final Instant now) {
        return toBuilder()
                .status(JobStatus.RUNNING)
                .plannedStages(List.copyOf(stages))
                .startedAt(now)
                .message("Processing started")
                .build();
    }

    public Job withStageStarted(final String stageName, final String activity, final Instant now) {
        final List<StageCheckpoint> checkpoints = new ArrayList<>(progress);
        checkpoints.add(StageCheckpoint.builder().stageName(stageName).startedAt(now).build());
        return toBuilder()
                .progress(Collections.unmodifiableList(checkpoints))
                .message(activity)
                .build();
    }

    /**
     * Records a stage's output and closes its checkpoint.
     *
     * @throws JobStateConflictException if an output for the stage is already recorded.
     */
    public Job withStageCompleted(final String stageName, final Object output, final Instant now) {
        if (partialResults.containsKey(stageName)) {
            throw new JobStateConflictException(
                    String.format("Job '%s' already holds an output for stage '%s'.", id, stageName));
        }
        final Map<String, Object> outputs = new LinkedHashMap<>(partialResults);
        outputs.put(stageName, output);
        return toBuilder()
                .progress(closeCheckpoint(stageName, StageOutcome.SUCCEEDED, now))
                .partialResults(Collections.unmodifiableMap(outputs))
                .build();
    }

    public Job complete(final JobResult jobResult, final Instant now) {
        return toBuilder()
                .status(JobStatus.COMPLETED)
                .result(jobResult)
                .finishedAt(now)
                .message("Processing completed successfully")
                .build();
    }

    public Job fail(final JobError jobError, final Instant now) {
        return toBuilder()
                .status(JobStatus.FAILED)
                .progress(closeCheckpoint(jobError.stage(), StageOutcome.FAILED, now))
                .error(jobError)
                .finishedAt(now)
                .message("Processing failed at stage '" + jobError.stage() + "'")
                .build();
    }

    public Job cancel(final Instant now) {
        final List<StageCheckpoint> checkpoints = progress.stream()
                .map(checkpoint -> checkpoint.isFinished() ? checkpoint : checkpoint.finish(StageOutcome.CANCELLED, now))
                .toList();
        return toBuilder()
                .status(JobStatus.CANCELLED)
                .progress(checkpoints)
                .finishedAt(now)
                .message("Job cancelled")
                .build();
    }

    /**
     * Percentage of planned stages that finished successfully. A completed job always reports 100.
     */
    public int progressPercent() {
        if (status == JobStatus.COMPLETED) {
            return 100;
        }
        if (plannedStages.isEmpty()) {
            return 0;
        }
        final long succeeded = progress.stream()
                .filter(checkpoint -> checkpoint.getOutcome() == StageOutcome.SUCCEEDED)
                .count();
        return (int) (succeeded * 100 / plannedStages.size());
    }

    /**
     * Wall-clock time between the start of the run and its terminal transition.
     */
    public Optional<Duration> processingTime() {
        if (startedAt == null || finishedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, finishedAt));
    }

    private List<StageCheckpoint> closeCheckpoint(final String stageName, final StageOutcome outcome, final Instant now) {
        final List<StageCheckpoint> checkpoints = new ArrayList<>(progress);
        for (int i = checkpoints.size() - 1; i >= 0; i--) {
            final StageCheckpoint checkpoint = checkpoints.get(i);
            if (checkpoint.getStageName().equals(stageName) && !checkpoint.isFinished()) {
                checkpoints.set(i, checkpoint.finish(outcome, now));
                return Collections.unmodifiableList(checkpoints);
            }
        }
        return progress;
    }
}
