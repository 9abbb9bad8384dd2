package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;

/**
 * One named, idempotent pipeline step.
 *
 * <p>Implementations must tolerate being invoked again for a pipeline state they already processed,
 * for instance after a worker crashed before the step was recorded as complete. Expected failures are
 * returned as {@link HandlerResult} values; anything thrown is treated as a transient failure.
 */
public interface StepHandler {

    String stepName();

    HandlerResult invoke(Pipeline pipeline);
}
