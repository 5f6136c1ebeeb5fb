package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record TransformEntry(
    @JsonProperty("key") String key,
    @JsonProperty("transform") Transform transform
) {

    public TransformEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(transform, "transform");
    }
}
