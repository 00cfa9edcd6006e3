package com.eyelevel.docsummarizer.config;

import com.eyelevel.docsummarizer.store.InMemoryJobStore;
import com.eyelevel.docsummarizer.store.JobStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

/**
 * Wires the job store and the clock it stamps records with. Both are plain beans so tests can build
 * their own instances with a fixed clock or a deterministic id generator.
 */
@Configuration
public class JobStoreConfig {

    private static final String JOB_ID_PREFIX = "job_";
    private static final int JOB_ID_HEX_LENGTH = 12;
    private static final int MAX_ID_ATTEMPTS = 5;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(final Clock clock) {
        return new InMemoryJobStore(clock, JobStoreConfig::newJobId, MAX_ID_ATTEMPTS);
    }

    static String newJobId() {
        return JOB_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, JOB_ID_HEX_LENGTH);
    }
}
