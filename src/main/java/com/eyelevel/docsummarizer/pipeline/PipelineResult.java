package com.eyelevel.docsummarizer.pipeline;

import com.eyelevel.docsummarizer.model.StageOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a pipeline run ended. {@code outputs} holds every stage output produced before the run stopped,
 * in stage order; {@code failedStage} and {@code failureMessage} are set only for {@link StageOutcome#FAILED}.
 */
public record PipelineResult(StageOutcome outcome, Map<String, Object> outputs, String failedStage,
                             String failureMessage) {

    public static PipelineResult succeeded(final Map<String, Object> outputs) {
        return new PipelineResult(StageOutcome.SUCCEEDED, copy(outputs), null, null);
    }

    public static PipelineResult failed(final String stage, final String message, final Map<String, Object> outputs) {
        return new PipelineResult(StageOutcome.FAILED, copy(outputs), stage, message);
    }

    public static PipelineResult cancelled(final Map<String, Object> outputs) {
        return new PipelineResult(StageOutcome.CANCELLED, copy(outputs), null, null);
    }

    private static Map<String, Object> copy(final Map<String, Object> outputs) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
