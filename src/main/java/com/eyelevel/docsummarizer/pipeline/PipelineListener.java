package com.eyelevel.docsummarizer.pipeline;

/**
 * Receives stage boundary events from the {@link PipelineRunner}. Returning {@code false} from either
 * callback tells the runner that the job can no longer accept progress (it was cancelled or otherwise
 * finalized) and that it should stop.
 */
public interface PipelineListener {

    boolean onStageStarted(String stageName, String description);

    boolean onStageCompleted(String stageName, Object output);

    PipelineListener NO_OP = new PipelineListener() {
        @Override
        public boolean onStageStarted(final String stageName, final String description) {
            return true;
        }

        @Override
        public boolean onStageCompleted(final String stageName, final Object output) {
            return true;
        }
    };
}
