package com.eyelevel.docsummarizer.pipeline;

import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.model.JobConfig;
import com.eyelevel.docsummarizer.model.JobResult;

import java.util.List;
import java.util.Map;

/**
 * Decides which stages a job runs and how their outputs become the job result.
 */
public interface PipelineDefinition {

    List<PipelineStage<?>> stages(JobConfig config);

    /**
     * @param outputs Every stage output of a successful run, keyed by stage name.
     * @throws StageExecutionException if an output the result needs is missing.
     */
    JobResult assembleResult(Map<String, Object> outputs, JobConfig config) throws StageExecutionException;
}
