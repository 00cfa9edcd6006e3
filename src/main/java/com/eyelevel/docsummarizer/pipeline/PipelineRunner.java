package com.eyelevel.docsummarizer.pipeline;

import com.eyelevel.docsummarizer.exception.StageExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Runs an ordered list of stages once for one job, feeding each stage the outputs of the stages before
 * it. The first failure stops the run; there are no retries at this level. Linkage and other
 * non-fatal errors thrown by a stage count as stage failures; {@link VirtualMachineError}s propagate.
 * Cancellation is checked before every stage, so a running stage is always allowed to finish.
 */
@Slf4j
@Component
public class PipelineRunner {

    /**
     * @param stages    The stages in execution order.
     * @param context   Job input and options. Outputs already present in the context are reused and
     *                  their stages skipped.
     * @param listener  Notified at every stage boundary; may veto continuation.
     * @param cancelled Polled before each stage.
     * @return The outcome together with the outputs produced so far.
     */
    public PipelineResult run(final List<? extends PipelineStage<?>> stages, final StageContext context,
                              final PipelineListener listener, final BooleanSupplier cancelled) {
        final Map<String, Object> outputs = new LinkedHashMap<>(context.getPriorOutputs());

        for (final PipelineStage<?> stage : stages) {
            final String stageName = stage.name();
            if (cancelled.getAsBoolean()) {
                log.info("[JobId: {}] Cancellation observed before stage '{}'.", context.getJobId(), stageName);
                return PipelineResult.cancelled(outputs);
            }
            if (outputs.containsKey(stageName)) {
                log.debug("[JobId: {}] Stage '{}' already has an output, skipping.", context.getJobId(), stageName);
                continue;
            }
            if (!listener.onStageStarted(stageName, stage.description())) {
                return PipelineResult.cancelled(outputs);
            }

            final long startNanos = System.nanoTime();
            final Object output;
            try {
                output = stage.execute(context.withOutputs(outputs));
            } catch (StageExecutionException e) {
                log.warn("[JobId: {}] Stage '{}' failed: {}", context.getJobId(), stageName, e.getMessage());
                return PipelineResult.failed(stageName, e.getMessage(), outputs);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                log.error("[JobId: {}] Stage '{}' failed unexpectedly.", context.getJobId(), stageName, e);
                final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                return PipelineResult.failed(stageName, message, outputs);
            }
            if (output == null) {
                return PipelineResult.failed(stageName, "Stage produced no output", outputs);
            }

            outputs.put(stageName, output);
            log.info("[JobId: {}] Stage '{}' finished in {} ms.", context.getJobId(), stageName,
                     (System.nanoTime() - startNanos) / 1_000_000);
            if (!listener.onStageCompleted(stageName, output)) {
                return PipelineResult.cancelled(outputs);
            }
        }
        return PipelineResult.succeeded(outputs);
    }
}
