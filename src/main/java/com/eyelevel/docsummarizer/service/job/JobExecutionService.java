package com.eyelevel.docsummarizer.service.job;

import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.docsummarizer.exception.job.JobAlreadyRunningException;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobError;
import com.eyelevel.docsummarizer.model.JobResult;
import com.eyelevel.docsummarizer.pipeline.PipelineDefinition;
import com.eyelevel.docsummarizer.pipeline.PipelineListener;
import com.eyelevel.docsummarizer.pipeline.PipelineResult;
import com.eyelevel.docsummarizer.pipeline.PipelineRunner;
import com.eyelevel.docsummarizer.pipeline.PipelineStage;
import com.eyelevel.docsummarizer.pipeline.StageContext;
import com.eyelevel.docsummarizer.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dispatches pipeline runs onto the job worker pool or the caller's thread and writes their progress
 * back through the {@link JobLifecycleManager}. At most one run per job is active at a time; active
 * runs can be asked to stop at their next stage boundary.
 */
@Slf4j
@Service
public class JobExecutionService {

    static final String DISPATCH_STAGE = "dispatch";
    static final String ASSEMBLE_STAGE = "assemble";
    static final String PIPELINE_STAGE = "pipeline";

    private final JobStore jobStore;
    private final JobLifecycleManager lifecycleManager;
    private final PipelineRunner pipelineRunner;
    private final PipelineDefinition pipelineDefinition;
    private final AsyncTaskExecutor taskExecutor;
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public JobExecutionService(final JobStore jobStore, final JobLifecycleManager lifecycleManager,
                               final PipelineRunner pipelineRunner, final PipelineDefinition pipelineDefinition,
                               @Qualifier("jobTaskExecutor") final AsyncTaskExecutor taskExecutor) {
        this.jobStore = jobStore;
        this.lifecycleManager = lifecycleManager;
        this.pipelineRunner = pipelineRunner;
        this.pipelineDefinition = pipelineDefinition;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Moves the job to RUNNING and hands its pipeline to the worker pool.
     *
     * @return The RUNNING snapshot.
     * @throws JobAlreadyRunningException   if the job already has an active run.
     * @throws ServiceUnavailableException if the worker pool rejects the run; the job is then FAILED.
     */
    public Job submitAsync(final String jobId) {
        final Job job = jobStore.get(jobId);
        final List<PipelineStage<?>> stages = pipelineDefinition.stages(job.getConfig());
        final RunHandle handle = register(jobId);
        final Job running = beginRun(jobId, stages, handle);

        try {
            taskExecutor.execute(() -> execute(running, stages, handle));
            log.info("[JobId: {}] Dispatched to the job worker pool.", jobId);
        } catch (TaskRejectedException e) {
            activeRuns.remove(jobId, handle);
            log.error("[JobId: {}] Worker pool rejected the job.", jobId, e);
            lifecycleManager.fail(jobId, new JobError(DISPATCH_STAGE, "Job worker pool is saturated"));
            throw new ServiceUnavailableException("Job worker pool is saturated; try again later.");
        }
        return running;
    }

    /**
     * Creates a job and runs its whole pipeline on the calling thread.
     *
     * @return The terminal snapshot.
     */
    public Job runSync(final JobConfig config, final InputHandle input) {
        final Job created = jobStore.create(config, input);
        final List<PipelineStage<?>> stages = pipelineDefinition.stages(config);
        final RunHandle handle = register(created.getId());
        final Job running = beginRun(created.getId(), stages, handle);
        log.info("[JobId: {}] Running synchronously on the calling thread.", created.getId());
        execute(running, stages, handle);
        return jobStore.get(created.getId());
    }

    /**
     * Asks an active run to stop before its next stage. Has no effect when the job has no active run.
     *
     * @return {@code true} if an active run was signalled.
     */
    public boolean requestCancellation(final String jobId) {
        final RunHandle handle = activeRuns.get(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.info("[JobId: {}] Cancellation signalled to the active run.", jobId);
        return true;
    }

    public boolean isActive(final String jobId) {
        return activeRuns.containsKey(jobId);
    }

    public int activeRunCount() {
        return activeRuns.size();
    }

    private RunHandle register(final String jobId) {
        final RunHandle handle = new RunHandle();
        if (activeRuns.putIfAbsent(jobId, handle) != null) {
            log.warn("[JobId: {}] Start rejected, a run is already active.", jobId);
            throw new JobAlreadyRunningException(jobId);
        }
        return handle;
    }

    private Job beginRun(final String jobId, final List<PipelineStage<?>> stages, final RunHandle handle) {
        try {
            return lifecycleManager.startRun(jobId, stages.stream().map(PipelineStage::name).toList());
        } catch (RuntimeException e) {
            activeRuns.remove(jobId, handle);
            throw e;
        }
    }

    private void execute(final Job job, final List<PipelineStage<?>> stages, final RunHandle handle) {
        final String jobId = job.getId();
        try {
            final StageContext context = StageContext.builder()
                                                     .jobId(jobId)
                                                     .input(job.getInput())
                                                     .config(job.getConfig())
                                                     .priorOutputs(job.getPartialResults())
                                                     .build();
            final PipelineResult result = pipelineRunner.run(stages, context, new StoreListener(jobId, handle),
                                                             handle::isCancelled);
            finish(job, result);
        } catch (RuntimeException | Error e) {
            log.error("[JobId: {}] Unexpected error while running the pipeline.", jobId, e);
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            lifecycleManager.fail(jobId, new JobError(PIPELINE_STAGE, message));
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        } finally {
            activeRuns.remove(jobId, handle);
        }
    }

    private void finish(final Job job, final PipelineResult result) {
        switch (result.outcome()) {
            case SUCCEEDED -> {
                final JobResult jobResult;
                try {
                    jobResult = pipelineDefinition.assembleResult(result.outputs(), job.getConfig());
                } catch (StageExecutionException e) {
                    lifecycleManager.fail(job.getId(), new JobError(ASSEMBLE_STAGE, e.getMessage()));
                    return;
                }
                lifecycleManager.complete(job.getId(), jobResult);
            }
            case FAILED -> lifecycleManager.fail(job.getId(),
                                                 new JobError(result.failedStage(), result.failureMessage()));
            case CANCELLED -> log.info("[JobId: {}] Run stopped after {} stage(s).", job.getId(),
                                       result.outputs().size());
        }
    }

    /**
     * Cancellation flag of one active run.
     */
    static final class RunHandle {
        private final AtomicBoolean cancelled = new AtomicBoolean();

        void cancel() {
            cancelled.set(true);
        }

        boolean isCancelled() {
            return cancelled.get();
        }
    }

    private final class StoreListener implements PipelineListener {
        private final String jobId;
        private final RunHandle handle;

        private StoreListener(final String jobId, final RunHandle handle) {
            this.jobId = jobId;
            this.handle = handle;
        }

        @Override
        public boolean onStageStarted(final String stageName, final String description) {
            return !handle.isCancelled() && lifecycleManager.recordStageStarted(jobId, stageName, description);
        }

        @Override
        public boolean onStageCompleted(final String stageName, final Object output) {
            return lifecycleManager.recordStageCompleted(jobId, stageName, output) && !handle.isCancelled();
        }
    }
}
