package com.eyelevel.docsummarizer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Progress record of one stage within a job run. {@code finishedAt} and {@code outcome} are
 * {@code null} while the stage is still executing.
 */
@Value
@Builder(toBuilder = true)
public class StageCheckpoint {

    String stageName;
    Instant startedAt;
    Instant finishedAt;
    StageOutcome outcome;

    public boolean isFinished() {
        return outcome != null;
    }

    public StageCheckpoint finish(final StageOutcome stageOutcome, final Instant at) {
        return toBuilder().outcome(stageOutcome).finishedAt(at).build();
    }
}
