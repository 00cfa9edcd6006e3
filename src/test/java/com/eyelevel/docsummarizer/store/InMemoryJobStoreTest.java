package com.eyelevel.docsummarizer.store;

import com.eyelevel.docsummarizer.exception.job.ConcurrencyFaultException;
import com.eyelevel.docsummarizer.exception.job.JobNotFoundException;
import com.eyelevel.docsummarizer.exception.job.JobStateConflictException;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.Job;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobError;
import com.eyelevel.docsummarizer.model.JobStatus;
import com.eyelevel.docsummarizer.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        final AtomicInteger counter = new AtomicInteger();
        store = new InMemoryJobStore(clock, () -> "job_" + counter.incrementAndGet(), 3);
    }

    private Job createJob(final String documentName) {
        return store.create(JobConfig.builder().build(),
                            InputHandle.builder().location("/tmp/" + documentName).originalFilename(documentName)
                                       .sizeBytes(10).pageCount(1).build());
    }

    @Test
    @DisplayName("Created jobs are PENDING and readable by id")
    void createAndGet() {
        // when
        final Job job = createJob("a.pdf");

        // then
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(store.get(job.getId())).isEqualTo(job);
        assertThat(store.find("job_missing")).isEmpty();
        assertThatThrownBy(() -> store.get("job_missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Id collisions are retried and give up after the configured attempts")
    void idCollisions() {
        final InMemoryJobStore fixedIds = new InMemoryJobStore(clock, () -> "job_same", 3);
        fixedIds.create(JobConfig.builder().build(), null);

        assertThatThrownBy(() -> fixedIds.create(JobConfig.builder().build(), null))
                .isInstanceOf(ConcurrencyFaultException.class);
        assertThat(fixedIds.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Listing is most recent first, with the creation sequence breaking ties")
    void listOrdering() {
        // given
        final Job a = createJob("a.pdf");
        clock.advance(Duration.ofSeconds(1));
        final Job b = createJob("b.pdf");
        final Job c = createJob("c.pdf");

        // when
        final List<Job> jobs = store.list();

        // then
        assertThat(jobs).extracting(Job::getId).containsExactly(c.getId(), b.getId(), a.getId());
    }

    @Test
    @DisplayName("Updates never move updatedAt backwards")
    void updatedAtIsMonotonic() {
        final Job job = createJob("a.pdf");
        clock.advance(Duration.ofSeconds(5));
        store.update(job.getId(), current -> current.startRun(List.of("extract"), clock.instant()));

        clock.set(T0.minusSeconds(60));
        final Job updated = store.update(job.getId(),
                                         current -> current.withStageStarted("extract", "x", clock.instant()));

        assertThat(updated.getUpdatedAt()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    @DisplayName("Terminal jobs reject further updates and keep their state")
    void terminalJobsAreFrozen() {
        // given
        final Job job = createJob("a.pdf");
        store.update(job.getId(), current -> current.startRun(List.of("extract"), clock.instant()));
        store.update(job.getId(), current -> current.fail(new JobError("extract", "boom"), clock.instant()));

        // when / then
        assertThatThrownBy(() -> store.update(job.getId(), current -> current.cancel(clock.instant())))
                .isInstanceOf(JobStateConflictException.class);
        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(store.get(job.getId()).getError().message()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Illegal transitions and identity changes leave the job untouched")
    void invalidMutationsAreRejected() {
        final Job job = createJob("a.pdf");

        assertThatThrownBy(() -> store.update(job.getId(),
                                              current -> current.toBuilder().status(JobStatus.COMPLETED).build()))
                .isInstanceOf(JobStateConflictException.class);
        assertThatThrownBy(() -> store.update(job.getId(), current -> current.toBuilder().id("job_other").build()))
                .isInstanceOf(ConcurrencyFaultException.class);
        assertThatThrownBy(() -> store.update(job.getId(), current -> null))
                .isInstanceOf(ConcurrencyFaultException.class);

        assertThat(store.get(job.getId())).isEqualTo(job);
    }

    @Test
    @DisplayName("Updating or deleting an unknown job raises not found")
    void unknownJob() {
        assertThatThrownBy(() -> store.update("job_missing", current -> current))
                .isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.delete("job_missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    @DisplayName("Deleting twice reports not found the second time")
    void deleteTwice() {
        final Job job = createJob("a.pdf");

        final Job removed = store.delete(job.getId());

        assertThat(removed.getId()).isEqualTo(job.getId());
        assertThatThrownBy(() -> store.delete(job.getId())).isInstanceOf(JobNotFoundException.class);
        assertThat(store.find(job.getId())).isEmpty();
    }

    @Test
    @DisplayName("A RUNNING job cannot be deleted")
    void deleteRunningJob() {
        final Job job = createJob("a.pdf");
        store.update(job.getId(), current -> current.startRun(List.of("extract"), clock.instant()));

        assertThatThrownBy(() -> store.delete(job.getId())).isInstanceOf(JobStateConflictException.class);
        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    @DisplayName("Statistics count every status, including empty ones")
    void statistics() {
        final Job a = createJob("a.pdf");
        createJob("b.pdf");
        store.update(a.getId(), current -> current.cancel(clock.instant()));

        final JobStatistics statistics = store.statistics();

        assertThat(statistics.totalJobs()).isEqualTo(2);
        assertThat(statistics.byStatus()).containsOnlyKeys(JobStatus.values());
        assertThat(statistics.byStatus().get(JobStatus.PENDING)).isEqualTo(1L);
        assertThat(statistics.byStatus().get(JobStatus.CANCELLED)).isEqualTo(1L);
        assertThat(statistics.byStatus().get(JobStatus.RUNNING)).isZero();
    }

    @Test
    @DisplayName("Concurrent stage writes to one job are all applied exactly once")
    void concurrentUpdates() throws Exception {
        // given
        final Job job = createJob("a.pdf");
        final int stageCount = 50;
        final List<String> stages = new ArrayList<>();
        for (int i = 0; i < stageCount; i++) {
            stages.add("stage-" + i);
        }
        store.update(job.getId(), current -> current.startRun(stages, clock.instant()));

        final ExecutorService pool = Executors.newFixedThreadPool(8);
        final CountDownLatch go = new CountDownLatch(1);
        final List<Future<?>> futures = new ArrayList<>();
        try {
            // when
            for (final String stage : stages) {
                futures.add(pool.submit(() -> {
                    go.await();
                    store.update(job.getId(), current -> current.withStageStarted(stage, stage, clock.instant()));
                    store.update(job.getId(),
                                 current -> current.withStageCompleted(stage, stage + "-output", clock.instant()));
                    return null;
                }));
            }
            go.countDown();
            for (final Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // then
        final Job updated = store.get(job.getId());
        assertThat(updated.getPartialResults()).hasSize(stageCount);
        assertThat(updated.getProgress()).hasSize(stageCount);
        assertThat(updated.progressPercent()).isEqualTo(100);
    }
}
