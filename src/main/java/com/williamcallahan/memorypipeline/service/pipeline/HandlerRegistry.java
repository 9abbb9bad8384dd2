package com.williamcallahan.memorypipeline.service.pipeline;

import com.williamcallahan.memorypipeline.service.pipeline.handlers.StepHandler;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Closed map from step name to handler, built once from the handler beans.
 */
@Component
public class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, StepHandler> handlers;

    /**
     * @throws IllegalStateException if two handlers claim the same step name
     */
    public HandlerRegistry(List<StepHandler> stepHandlers) {
        Map<String, StepHandler> byName = new LinkedHashMap<>();
        for (StepHandler handler : stepHandlers) {
            String stepName = handler.stepName();
            if (stepName == null || stepName.isBlank()) {
                throw new IllegalStateException(handler.getClass().getName() + " has no step name");
            }
            StepHandler existing = byName.putIfAbsent(stepName, handler);
            if (existing != null) {
                throw new IllegalStateException("Step '" + stepName + "' is handled by both "
                        + existing.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byName);
        log.info("[PIPELINE] Registered step handlers: {}", handlers.keySet());
    }

    public Optional<StepHandler> find(String stepName) {
        return Optional.ofNullable(handlers.get(stepName));
    }

    public StepHandler require(String stepName) {
        return find(stepName).orElseThrow(() -> new InvalidPipelineException("Unknown pipeline step: " + stepName));
    }

    public Set<String> stepNames() {
        return handlers.keySet();
    }

    /**
     * @throws InvalidPipelineException if the list is empty or names a step without a handler
     */
    public void validate(List<String> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidPipelineException("A pipeline needs at least one step");
        }
        for (String step : steps) {
            if (step == null || !handlers.containsKey(step)) {
                throw new InvalidPipelineException(
                        "Unknown pipeline step '" + step + "'; known steps are " + handlers.keySet());
            }
        }
    }
}
