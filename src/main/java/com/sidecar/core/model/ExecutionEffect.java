package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The global state changes produced by executing a deploy or an era-end step.
 */
public record ExecutionEffect(
    @JsonProperty("operations") List<Operation> operations,
    @JsonProperty("transforms") List<TransformEntry> transforms
) {

    public ExecutionEffect {
        operations = List.copyOf(operations);
        transforms = List.copyOf(transforms);
    }

    public static ExecutionEffect empty() {
        return new ExecutionEffect(List.of(), List.of());
    }
}
