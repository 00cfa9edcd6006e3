package com.eyelevel.docsummarizer.store;

import com.eyelevel.docsummarizer.exception.job.JobNotFoundException;
import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Concurrency-safe registry of job records. Reads return immutable snapshots and never block;
 * writes to one job are serialized while writes to different jobs proceed independently.
 */
public interface JobStore {

    /**
     * Registers a new PENDING job under a freshly generated id.
     */
    Job create(JobConfig config, InputHandle input);

    /**
     * @throws JobNotFoundException if no job has the id.
     */
    Job get(String jobId);

    Optional<Job> find(String jobId);

    /**
     * Atomically replaces a job with the result of {@code mutation}. The mutation runs under the job's
     * exclusive lock and may be invoked at most once; it must not block or call back into the store.
     * Either the full result is stored or nothing changes.
     *
     * @throws JobNotFoundException      if no job has the id.
     * @throws JobStateConflictException if the job is terminal or the mutation makes an illegal status transition.
     */
    Job update(String jobId, UnaryOperator<Job> mutation);

    /**
     * @return All jobs, most recently created first.
     */
    List<Job> list();

    /**
     * Removes a job and returns its last snapshot.
     *
     * @throws JobNotFoundException      if no job has the id.
     * @throws JobStateConflictException if the job is RUNNING.
     */
    Job delete(String jobId);

    JobStatistics statistics();
}
