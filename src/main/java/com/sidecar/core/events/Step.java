package com.sidecar.core.events;

import com.sidecar.core.model.EraId;
import com.sidecar.core.model.ExecutionEffect;

import java.util.Objects;

/**
 * The execution effects produced by the era-end step.
 */
public record Step(EraId eraId, ExecutionEffect executionEffect) implements SseData {

    public Step {
        Objects.requireNonNull(eraId, "eraId");
        Objects.requireNonNull(executionEffect, "executionEffect");
    }

    @Override
    public SseEventType type() {
        return SseEventType.STEP;
    }

    @Override
    public <R> R accept(SseDataVisitor<R> visitor) {
        return visitor.visitStep(this);
    }
}
