package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single named runtime argument passed to deploy code.
 */
public record NamedArg(
    @JsonProperty("name") String name,
    @JsonProperty("value") CLValue value
) {

    public NamedArg {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
