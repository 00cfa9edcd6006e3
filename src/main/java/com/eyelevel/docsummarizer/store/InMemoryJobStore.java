package com.eyelevel.docsummarizer.store;

import com.eyelevel.docsummarizer.exception.job.ConcurrencyFaultException;
import com.eyelevel.docsummarizer.exception.job.JobNotFoundException;
import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link JobStore} backed by a {@link ConcurrentHashMap}. Per-job atomicity comes from the map's
 * per-key {@code compute} operations; snapshots are immutable, so reads go straight to the map.
 * Contents are lost on restart.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> MOST_RECENT_FIRST = Comparator.comparing(Job::getCreatedAt)
                                                                       .thenComparingLong(Job::getSequence)
                                                                       .reversed();

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final int maxIdAttempts;

    public InMemoryJobStore(final Clock clock, final Supplier<String> idGenerator, final int maxIdAttempts) {
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.maxIdAttempts = maxIdAttempts;
    }

    @Override
    public Job create(final JobConfig config, final InputHandle input) {
        for (int attempt = 1; attempt <= maxIdAttempts; attempt++) {
            final String candidate = idGenerator.get();
            final AtomicReference<Job> created = new AtomicReference<>();
            jobs.computeIfAbsent(candidate, id -> {
                final Job job = Job.pending(id, sequence.incrementAndGet(), config, input, clock.instant());
                created.set(job);
                return job;
            });
            if (created.get() != null) {
                log.info("[JobId: {}] Created job for document '{}'.", candidate,
                         input != null ? input.getOriginalFilename() : null);
                return created.get();
            }
            log.warn("Generated job id {} collided with an existing job (attempt {}/{}).", candidate, attempt,
                     maxIdAttempts);
        }
        throw new ConcurrencyFaultException("Unable to allocate a unique job id after " + maxIdAttempts + " attempts.");
    }

    @Override
    public Job get(final String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public Optional<Job> find(final String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Job update(final String jobId, final UnaryOperator<Job> mutation) {
        final Job updated = jobs.computeIfPresent(jobId, (id, current) -> applyMutation(current, mutation));
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return updated;
    }

    private Job applyMutation(final Job current, final UnaryOperator<Job> mutation) {
        if (current.getStatus().isTerminal()) {
            throw new JobStateConflictException(
                    String.format("Job '%s' is %s and can no longer be modified.", current.getId(), current.getStatus()));
        }
        final Job next = mutation.apply(current);
        if (next == null || !current.getId().equals(next.getId()) || current.getSequence() != next.getSequence()) {
            throw new ConcurrencyFaultException("Mutation of job '" + current.getId() + "' replaced its identity.");
        }
        if (next.getStatus() != current.getStatus() && !current.getStatus().canTransitionTo(next.getStatus())) {
            throw new JobStateConflictException(
                    String.format("Job '%s' cannot move from %s to %s.", current.getId(), current.getStatus(),
                                  next.getStatus()));
        }
        final Instant now = clock.instant();
        final Instant updatedAt = now.isAfter(current.getUpdatedAt()) ? now : current.getUpdatedAt();
        return next.toBuilder().updatedAt(updatedAt).build();
    }

    @Override
    public List<Job> list() {
        return jobs.values().stream().sorted(MOST_RECENT_FIRST).toList();
    }

    @Override
    public Job delete(final String jobId) {
        final AtomicReference<Job> removed = new AtomicReference<>();
        jobs.compute(jobId, (id, current) -> {
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }
            if (current.getStatus() == JobStatus.RUNNING) {
                throw new JobStateConflictException(
                        String.format("Job '%s' is running; cancel it before deleting.", jobId));
            }
            removed.set(current);
            return null;
        });
        log.info("[JobId: {}] Deleted job in status {}.", jobId, removed.get().getStatus());
        return removed.get();
    }

    @Override
    public JobStatistics statistics() {
        final Map<JobStatus, Long> counts = jobs.values().stream()
                                                .collect(Collectors.groupingBy(Job::getStatus, Collectors.counting()));
        final Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (final JobStatus status : JobStatus.values()) {
            byStatus.put(status, counts.getOrDefault(status, 0L));
        }
        final long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new JobStatistics(total, byStatus);
    }

    /**
     * Store size, used by tests and diagnostics.
     */
    public int size() {
        return jobs.size();
    }
}
