package com.eyelevel.docsummarizer.pipeline.stage;

/**
 * Names under which stage outputs are recorded on a job.
 */
public final class StageNames {

    public static final String EXTRACT = "extract";
    public static final String EXTRACT_ENTITIES = "extractEntities";
    public static final String SUMMARIZE = "summarize";

    private StageNames() {
    }
}
