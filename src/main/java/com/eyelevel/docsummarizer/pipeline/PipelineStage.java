package com.eyelevel.docsummarizer.pipeline;

import com.eyelevel.docsummarizer.exception.StageExecutionException;

/**
 * One named step of a job pipeline. A stage reads the job input, its options and the outputs of
 * earlier stages from the {@link StageContext} and returns its own output. Stages never touch the
 * job store; progress is recorded by whoever drives the {@link PipelineRunner}.
 *
 * @param <O> The type of output the stage produces.
 */
public interface PipelineStage<O> {

    /**
     * @return The stable name under which the output is recorded, e.g. {@code extract}.
     */
    String name();

    /**
     * @return A short human-readable description of the work, shown as the job's current activity.
     */
    default String description() {
        return "Running " + name();
    }

    /**
     * @param context The job input, options and prior outputs.
     * @return The non-null stage output.
     * @throws StageExecutionException if the stage cannot produce its output.
     */
    O execute(StageContext context) throws StageExecutionException;
}
