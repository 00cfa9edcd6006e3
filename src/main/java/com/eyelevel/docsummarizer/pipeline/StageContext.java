package com.eyelevel.docsummarizer.pipeline;

import com.eyelevel.docsummarizer.exception.StageExecutionException;
import com.eyelevel.docsummarizer.model.InputHandle;
import com.eyelevel.docsummarizer.model.JobConfig;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class StageContext {

    String jobId;
    InputHandle input;
    JobConfig config;

    /**
     * Outputs of the stages that already ran, keyed by stage name.
     */
    @Builder.Default
    Map<String, Object> priorOutputs = Map.of();

    public StageContext withOutputs(final Map<String, Object> outputs) {
        return toBuilder().priorOutputs(Collections.unmodifiableMap(new LinkedHashMap<>(outputs))).build();
    }

    public boolean hasOutput(final String stageName) {
        return priorOutputs.containsKey(stageName);
    }

    /**
     * Fetches the output of an earlier stage.
     *
     * @throws StageExecutionException if the stage has not run or produced an output of another type.
     */
    public <T> T requireOutput(final String stageName, final Class<T> type) throws StageExecutionException {
        final Object output = priorOutputs.get(stageName);
        if (output == null) {
            throw new StageExecutionException("Missing output of stage '" + stageName + "'");
        }
        if (!type.isInstance(output)) {
            throw new StageExecutionException(String.format("Output of stage '%s' is a %s, expected %s", stageName,
                                                            output.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(output);
    }
}
