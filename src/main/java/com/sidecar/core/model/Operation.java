package com.sidecar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One global state access recorded during execution.
 *
 * @param key  formatted global state key, e.g. {@code "account-hash-..."}
 * @param kind the access kind
 */
public record Operation(
    @JsonProperty("key") String key,
    @JsonProperty("kind") OpKind kind
) {

    public Operation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(kind, "kind");
    }
}
