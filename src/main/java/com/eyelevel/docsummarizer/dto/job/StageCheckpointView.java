package com.eyelevel.docsummarizer.dto.job;

import com.eyelevel.docsummarizer.model.StageOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageCheckpointView(String stage, Instant startedAt, Instant finishedAt, StageOutcome outcome) {
}
